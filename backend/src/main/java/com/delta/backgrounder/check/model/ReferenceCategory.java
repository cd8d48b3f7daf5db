package com.delta.backgrounder.check.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReferenceCategory {
    HR("HR / People Ops"),
    MANAGEMENT("Management"),
    SAME_DEPARTMENT("Same Department"),
    COLLEAGUE("Colleague");

    private final String label;

    ReferenceCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
