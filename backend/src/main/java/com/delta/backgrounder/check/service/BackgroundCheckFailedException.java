package com.delta.backgrounder.check.service;

public class BackgroundCheckFailedException extends RuntimeException {
    public BackgroundCheckFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
