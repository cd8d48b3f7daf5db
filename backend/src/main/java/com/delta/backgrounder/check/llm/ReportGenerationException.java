package com.delta.backgrounder.check.llm;

/**
 * The summarizer could not produce a narrative; callers substitute a fallback report.
 */
public class ReportGenerationException extends RuntimeException {
    public ReportGenerationException(String message) {
        super(message);
    }

    public ReportGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
