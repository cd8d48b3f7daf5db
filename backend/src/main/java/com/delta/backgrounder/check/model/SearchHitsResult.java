package com.delta.backgrounder.check.model;

import java.util.List;

public record SearchHitsResult(List<SearchHit> hits) implements SourceResult {
    public SearchHitsResult {
        hits = ModelLists.copy(hits);
    }

    @Override
    public String detail() {
        return hits.isEmpty() ? "No results" : hits.size() + " results";
    }
}
