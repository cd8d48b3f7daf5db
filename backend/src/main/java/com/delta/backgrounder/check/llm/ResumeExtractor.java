package com.delta.backgrounder.check.llm;

import com.delta.backgrounder.check.model.ResumeData;

public interface ResumeExtractor {

    /**
     * Structured fields from résumé text. Never fails: when extraction does not work the
     * result carries only the raw text.
     */
    ResumeData extract(String rawText);
}
