package com.delta.backgrounder.check.source;

import com.delta.backgrounder.check.model.PhotoSearchResult;

public interface ReversePhotoSearcher {

    PhotoSearchResult search(String imageUrl);
}
