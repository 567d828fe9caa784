package com.cgi.privsense.requestscanner.service;

import com.cgi.privsense.requestscanner.api.PIIDetector;
import com.cgi.privsense.requestscanner.model.BatchScanResult;
import com.cgi.privsense.requestscanner.model.PIIMapping;
import com.cgi.privsense.requestscanner.model.RecordScanResult;
import com.cgi.privsense.requestscanner.model.enums.ClassificationVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Scans request records and classifies each one as public or non-public.
 */
@Service
public class RequestScannerService {
    private static final Logger log = LoggerFactory.getLogger(RequestScannerService.class);

    private final PIIDetector piiDetector;
    private final PIIClassifier classifier;

    public RequestScannerService(PIIDetector piiDetector, PIIClassifier classifier) {
        this.piiDetector = piiDetector;
        this.classifier = classifier;
    }

    /**
     * Scans a single record.
     *
     * @param text Record text
     * @return Verdict and detected PII
     * @throws IllegalArgumentException if the text is null or blank
     */
    public RecordScanResult scan(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Record text must not be blank");
        }
        return scanRecord(1, text);
    }

    /**
     * Scans a batch of records. Blank records are skipped; the others are
     * numbered from 1 in input order.
     *
     * @param records Record texts
     * @return Batch result with per-record verdicts and statistics
     */
    public BatchScanResult scanBatch(List<String> records) {
        long startTime = System.currentTimeMillis();
        BatchScanResult result = BatchScanResult.builder().build();

        if (records == null || records.isEmpty()) {
            log.warn("No records to scan");
            return result;
        }

        int recordIndex = 0;
        for (String text : records) {
            if (text == null || text.isBlank()) {
                result.recordSkipped();
                continue;
            }
            result.addRecordResult(scanRecord(++recordIndex, text));
        }

        result.setProcessingTimeMs(System.currentTimeMillis() - startTime);
        log.info("Batch scan completed: {} records scanned, {} skipped, {} non-public, {} public in {} ms",
                result.getScannedRecords(), result.getSkippedRecords(), result.getNonPublicRecords(),
                result.getPublicRecords(), result.getProcessingTimeMs());
        return result;
    }

    private RecordScanResult scanRecord(int recordIndex, String text) {
        PIIMapping mapping = piiDetector.detectPII(text);
        ClassificationVerdict verdict = classifier.classify(mapping);

        log.debug("Record {} classified as {} ({} PII types)",
                recordIndex, verdict, mapping.nonEmptyEntries().size());

        return RecordScanResult.builder()
                .recordIndex(recordIndex)
                .verdict(verdict)
                .detectedPii(mapping.nonEmptyEntries())
                .build();
    }
}
