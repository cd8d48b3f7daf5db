package com.delta.backgrounder.check.model;

import java.util.List;

public record CompanyChecksResult(List<CompanyCheck> checks) implements SourceResult {
    public CompanyChecksResult {
        checks = ModelLists.copy(checks);
    }

    @Override
    public String detail() {
        return SourceResult.countFound(checks.size());
    }
}
