package com.delta.backgrounder.check.model;

import java.time.Duration;

/**
 * Result of running one task: either a payload or a failure marker, never both.
 */
public record TaskOutcome(
    String taskId,
    SourceResult result,
    String errorCode,
    String errorMessage,
    Duration duration
) {
    public static TaskOutcome success(String taskId, SourceResult result, Duration duration) {
        return new TaskOutcome(taskId, result, null, null, duration);
    }

    public static TaskOutcome failure(String taskId, String errorCode, String errorMessage, Duration duration) {
        return new TaskOutcome(taskId, null, errorCode, errorMessage, duration);
    }

    public boolean isSuccessful() {
        return errorCode == null;
    }

    public String detail() {
        return result == null ? null : result.detail();
    }
}
