package com.delta.backgrounder.check.source;

import com.delta.backgrounder.check.model.CompanyCheck;

import java.util.List;

public interface CompanyVerifier {

    CompanyCheck verify(String companyName);

    /**
     * Verifies every company; a failed lookup yields an unverified check rather than an exception.
     */
    List<CompanyCheck> verifyAll(List<String> companyNames);
}
