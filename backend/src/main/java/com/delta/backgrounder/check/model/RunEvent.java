package com.delta.backgrounder.check.model;

/**
 * Message travelling from a running check to its consumer.
 */
public interface RunEvent {

    /**
     * Event type used on the wire, e.g. the SSE event name.
     */
    String eventName();
}
