package com.cgi.privsense.requestscanner.api;

import com.cgi.privsense.requestscanner.model.Candidate;
import com.cgi.privsense.requestscanner.model.ScanContext;
import com.cgi.privsense.requestscanner.model.enums.PIIType;

/**
 * Acceptance rule for the candidates of one PII type.
 */
public interface CandidateValidator {
    PIIType getType();

    /**
     * Decides whether a candidate is a genuine value of its type.
     *
     * @param candidate Candidate to check
     * @param context Record being scanned
     * @return true if the candidate is accepted
     */
    boolean isValid(Candidate candidate, ScanContext context);
}
