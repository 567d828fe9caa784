package com.cgi.privsense.requestscanner.api;

import com.cgi.privsense.requestscanner.model.BatchScanResult;

/**
 * Interface for generating reports on scanned request records.
 */
public interface PIIReportGenerator {
    /**
     * Generates a report listing the verdict and detected PII of every record.
     *
     * @param result Batch scan result
     * @return Formatted report
     */
    String generateReport(BatchScanResult result);

    /**
     * Generates a summary of the batch.
     *
     * @param result Batch scan result
     * @return Formatted summary
     */
    String generateSummary(BatchScanResult result);

    /**
     * Exports results in a specific format.
     *
     * @param result Batch scan result
     * @param format Export format (JSON, CSV)
     * @return Exported data
     */
    byte[] exportResults(BatchScanResult result, String format);
}
