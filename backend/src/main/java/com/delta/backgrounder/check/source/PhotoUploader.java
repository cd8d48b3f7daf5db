package com.delta.backgrounder.check.source;

import java.util.Optional;

public interface PhotoUploader {

    /**
     * Publishes image bytes and returns a URL the reverse image search can fetch.
     */
    Optional<String> upload(byte[] image);
}
