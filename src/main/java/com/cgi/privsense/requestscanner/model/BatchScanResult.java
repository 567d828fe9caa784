package com.cgi.privsense.requestscanner.model;

import com.cgi.privsense.requestscanner.model.enums.PIIType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchScanResult {
    @Builder.Default
    private List<RecordScanResult> recordResults = new ArrayList<>();

    /**
     * Number of records holding each PII type.
     */
    @Builder.Default
    private Map<PIIType, Integer> piiTypeCounts = new EnumMap<>(PIIType.class);

    private int scannedRecords;
    private int skippedRecords;
    private int nonPublicRecords;
    private int publicRecords;
    private long processingTimeMs;

    /**
     * Adds a record result and updates the batch statistics.
     *
     * @param recordResult Scan result for one record
     */
    public void addRecordResult(RecordScanResult recordResult) {
        if (recordResults == null) {
            recordResults = new ArrayList<>();
        }
        recordResults.add(recordResult);
        updateStatistics(recordResult);
    }

    /**
     * Records a blank record that was not scanned.
     */
    public void recordSkipped() {
        skippedRecords++;
    }

    private void updateStatistics(RecordScanResult recordResult) {
        scannedRecords++;
        if (recordResult.isNonPublic()) {
            nonPublicRecords++;
        } else {
            publicRecords++;
        }

        if (recordResult.getDetectedPii() == null) {
            return;
        }

        if (piiTypeCounts == null) {
            piiTypeCounts = new EnumMap<>(PIIType.class);
        }
        for (PIIType type : recordResult.getDetectedPii().keySet()) {
            piiTypeCounts.merge(type, 1, Integer::sum);
        }
    }
}
