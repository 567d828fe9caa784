/*
 * PIIReportGeneratorImpl.java - Report generation for scanned request records
 */
package com.cgi.privsense.requestscanner.service;

import com.cgi.privsense.requestscanner.api.PIIReportGenerator;
import com.cgi.privsense.requestscanner.exception.ReportExportException;
import com.cgi.privsense.requestscanner.model.BatchScanResult;
import com.cgi.privsense.requestscanner.model.RecordScanResult;
import com.cgi.privsense.requestscanner.model.enums.PIIType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Implementation of the PII report generator.
 */
@Component
public class PIIReportGeneratorImpl implements PIIReportGenerator {
    private static final Logger log = LoggerFactory.getLogger(PIIReportGeneratorImpl.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public String generateReport(BatchScanResult result) {
        StringBuilder report = new StringBuilder();

        for (RecordScanResult record : result.getRecordResults()) {
            report.append(String.format("\nREGISTRO %d\n", record.getRecordIndex()));
            report.append(record.getVerdict().getLabel()).append('\n');

            record.getDetectedPii().forEach((type, values) ->
                    report.append(String.format("%s: %s\n", type.getLabel(), values)));
        }

        return report.toString();
    }

    @Override
    public String generateSummary(BatchScanResult result) {
        StringBuilder summary = new StringBuilder();
        summary.append("== Request Classification Summary ==\n\n");

        int scanned = result.getScannedRecords();
        summary.append(String.format("Records scanned: %d\n", scanned));
        summary.append(String.format("Blank records skipped: %d\n", result.getSkippedRecords()));
        summary.append(String.format("Non-public records: %d (%.2f%%)\n",
                result.getNonPublicRecords(), percentage(result.getNonPublicRecords(), scanned)));
        summary.append(String.format("Public records: %d (%.2f%%)\n",
                result.getPublicRecords(), percentage(result.getPublicRecords(), scanned)));
        summary.append(String.format("Total processing time: %.2f seconds\n\n", result.getProcessingTimeMs() / 1000.0));

        summary.append("Records by PII type:\n");
        for (PIIType type : PIIType.values()) {
            summary.append(String.format("- %s: %d\n", type.getLabel(),
                    result.getPiiTypeCounts().getOrDefault(type, 0)));
        }

        return summary.toString();
    }

    @Override
    public byte[] exportResults(BatchScanResult result, String format) {
        if ("json".equalsIgnoreCase(format)) {
            return exportToJson(result);
        } else if ("csv".equalsIgnoreCase(format)) {
            return exportToCsv(result);
        }
        throw new IllegalArgumentException("Unsupported format: " + format);
    }

    /**
     * Exports results in JSON format.
     *
     * @param result Result to export
     * @return JSON data
     */
    private byte[] exportToJson(BatchScanResult result) {
        Map<String, Object> exportData = new LinkedHashMap<>();
        exportData.put("scannedRecords", result.getScannedRecords());
        exportData.put("skippedRecords", result.getSkippedRecords());
        exportData.put("nonPublicRecords", result.getNonPublicRecords());
        exportData.put("publicRecords", result.getPublicRecords());
        exportData.put("processingTimeMs", result.getProcessingTimeMs());

        List<Map<String, Object>> records = new ArrayList<>();
        for (RecordScanResult record : result.getRecordResults()) {
            Map<String, Object> recordData = new LinkedHashMap<>();
            recordData.put("record", record.getRecordIndex());
            recordData.put("verdict", record.getVerdict().getLabel());

            Map<String, List<String>> pii = new LinkedHashMap<>();
            record.getDetectedPii().forEach((type, values) -> pii.put(type.getLabel(), values));
            recordData.put("pii", pii);

            records.add(recordData);
        }
        exportData.put("records", records);

        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(exportData);
        } catch (JsonProcessingException e) {
            log.error("Error exporting results: {}", e.getMessage(), e);
            throw new ReportExportException("Error exporting results", e);
        }
    }

    /**
     * Exports results in CSV format, one line per detected value.
     * Records without PII get a single line with empty type and value.
     *
     * @param result Result to export
     * @return CSV data
     */
    private byte[] exportToCsv(BatchScanResult result) {
        StringBuilder csv = new StringBuilder();
        csv.append("Record,Verdict,PII Type,Value\n");

        for (RecordScanResult record : result.getRecordResults()) {
            String prefix = record.getRecordIndex() + "," + escapeCsv(record.getVerdict().getLabel()) + ",";
            if (record.getDetectedPii().isEmpty()) {
                csv.append(prefix).append(",\n");
                continue;
            }
            record.getDetectedPii().forEach((type, values) -> {
                for (String value : values) {
                    csv.append(prefix)
                            .append(type.getLabel()).append(',')
                            .append(escapeCsv(value)).append('\n');
                }
            });
        }

        return csv.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static String escapeCsv(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    private static double percentage(int part, int total) {
        return total == 0 ? 0.0 : (double) part / total * 100;
    }
}
