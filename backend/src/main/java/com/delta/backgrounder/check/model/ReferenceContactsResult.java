package com.delta.backgrounder.check.model;

import java.util.List;

public record ReferenceContactsResult(List<ReferenceContact> contacts) implements SourceResult {
    public ReferenceContactsResult {
        contacts = ModelLists.copy(contacts);
    }

    @Override
    public String detail() {
        return SourceResult.countFound(contacts.size());
    }
}
