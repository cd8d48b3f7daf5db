package com.delta.backgrounder.check.model;

/**
 * Payload produced by one source task. Failures never produce a SourceResult;
 * they are carried by {@link TaskOutcome} instead.
 */
public interface SourceResult {

    /**
     * Short human detail for progress reporting, or null when there is nothing to say.
     */
    String detail();

    static String countFound(int count) {
        return count + " found";
    }
}
