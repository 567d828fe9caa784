/*
 * PIIDetector.java - Main interface for PII detection in request records
 */
package com.cgi.privsense.requestscanner.api;

import com.cgi.privsense.requestscanner.model.PIIMapping;

/**
 * Main interface for Personally Identifiable Information (PII) detection
 * in free-text request records.
 */
public interface PIIDetector {
    /**
     * Detects PII in a single record.
     *
     * @param text Raw record text
     * @return Validated PII values by type, after conflict resolution
     */
    PIIMapping detectPII(String text);
}
