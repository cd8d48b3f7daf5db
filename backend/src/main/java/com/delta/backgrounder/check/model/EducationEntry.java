package com.delta.backgrounder.check.model;

public record EducationEntry(
    String school,
    String degree,
    String field
) {
    public EducationEntry {
        school = ModelLists.blankToNull(school);
        degree = ModelLists.blankToNull(degree);
        field = ModelLists.blankToNull(field);
    }
}
