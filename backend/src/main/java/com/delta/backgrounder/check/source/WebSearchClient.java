package com.delta.backgrounder.check.source;

import com.delta.backgrounder.check.model.SearchHit;

import java.util.List;

public interface WebSearchClient {

    List<SearchHit> search(String query);

    List<SearchHit> searchNews(String query);
}
