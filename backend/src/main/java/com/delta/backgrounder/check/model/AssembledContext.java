package com.delta.backgrounder.check.model;

import java.util.List;

public record AssembledContext(
    String contextText,
    List<String> sourcesUsed,
    String confidenceNote
) {
    public AssembledContext {
        contextText = contextText == null ? "" : contextText;
        sourcesUsed = ModelLists.copy(sourcesUsed);
        confidenceNote = confidenceNote == null ? "" : confidenceNote;
    }
}
