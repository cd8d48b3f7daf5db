package com.delta.backgrounder.check.source;

import com.delta.backgrounder.check.model.SocialProfile;

import java.util.List;

public interface SocialMediaScanner {

    /**
     * Profiles of {@code name} across the known platforms, deduplicated by URL.
     */
    List<SocialProfile> scan(String name);
}
