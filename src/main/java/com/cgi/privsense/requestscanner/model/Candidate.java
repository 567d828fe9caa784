package com.cgi.privsense.requestscanner.model;

import com.cgi.privsense.requestscanner.model.enums.PIIType;
import lombok.Value;

/**
 * A raw substring matched by an extractor, not yet validated.
 */
@Value
public class Candidate {
    PIIType piiType;
    String value;
    /**
     * Offset of the match in the normalized text.
     */
    int start;
}
