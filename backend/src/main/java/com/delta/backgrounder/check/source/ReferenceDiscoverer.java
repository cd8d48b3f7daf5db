package com.delta.backgrounder.check.source;

import com.delta.backgrounder.check.model.BackgroundCheckRequest;
import com.delta.backgrounder.check.model.ReferenceContact;
import com.delta.backgrounder.check.model.ResumeData;

import java.util.List;

public interface ReferenceDiscoverer {

    /**
     * People at the subject's current and past employers who could confirm employment.
     * {@code resume} may be null.
     */
    List<ReferenceContact> discover(BackgroundCheckRequest request, ResumeData resume);
}
