package com.delta.backgrounder.check.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProgressPhase {
    RESUME_PARSE("resume_parse"),
    PHOTO_UPLOAD("photo_upload"),
    SEARCH_START("search_start"),
    TASK_DONE("task_done"),
    ANALYZING("analyzing");

    private final String wireName;

    ProgressPhase(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
