package com.delta.backgrounder.check.llm;

import com.delta.backgrounder.check.model.AggregatedData;
import com.delta.backgrounder.check.model.BackgroundCheckRequest;
import com.delta.backgrounder.check.model.ReportNarrative;

public interface ReportGenerator {

    /**
     * @throws ReportGenerationException when no usable narrative could be produced
     */
    ReportNarrative summarize(BackgroundCheckRequest request, AggregatedData aggregated);
}
