package com.delta.backgrounder.check.http;

import com.delta.backgrounder.check.model.HttpFetchResult;

/**
 * A source call that did not produce a usable response.
 */
public class SourceFetchException extends RuntimeException {
    private final String source;
    private final int statusCode;
    private final String errorCode;

    public SourceFetchException(String source, int statusCode, String errorCode, String message) {
        super(source + ": " + message);
        this.source = source;
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }

    public static SourceFetchException from(String source, HttpFetchResult result) {
        if (result.errorCode() != null) {
            return new SourceFetchException(source, result.statusCode(), result.errorCode(), result.errorMessage());
        }
        return new SourceFetchException(
            source,
            result.statusCode(),
            "http_" + result.statusCode(),
            "HTTP " + result.statusCode() + " from " + result.requestedUrl()
        );
    }

    public String getSource() {
        return source;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
