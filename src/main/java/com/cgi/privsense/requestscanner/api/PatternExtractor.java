package com.cgi.privsense.requestscanner.api;

import com.cgi.privsense.requestscanner.model.Candidate;
import com.cgi.privsense.requestscanner.model.enums.PIIType;

import java.util.List;

/**
 * Regex-driven extractor of PII candidates for one PII type.
 */
public interface PatternExtractor {
    /**
     * PII type produced by this extractor.
     *
     * @return PII type
     */
    PIIType getType();

    /**
     * Finds every match in the normalized text.
     *
     * @param text Normalized text
     * @return Candidates in match order, empty if nothing matched
     */
    List<Candidate> extract(String text);
}
