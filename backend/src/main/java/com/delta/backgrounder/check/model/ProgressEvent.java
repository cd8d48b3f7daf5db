package com.delta.backgrounder.check.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressEvent(
    ProgressPhase phase,
    String taskId,
    String label,
    TaskState state,
    Integer completed,
    Integer total,
    String detail
) implements RunEvent {

    public static ProgressEvent phase(ProgressPhase phase, String label, TaskState state, String detail) {
        return new ProgressEvent(phase, null, label, state, null, null, detail);
    }

    @Override
    @JsonIgnore
    public String eventName() {
        return "status";
    }
}
