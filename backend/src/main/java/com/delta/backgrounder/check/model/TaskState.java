package com.delta.backgrounder.check.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TaskState {
    RUNNING,
    DONE,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
