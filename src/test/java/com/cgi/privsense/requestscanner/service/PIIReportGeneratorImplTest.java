package com.cgi.privsense.requestscanner.service;

import com.cgi.privsense.requestscanner.model.BatchScanResult;
import com.cgi.privsense.requestscanner.model.RecordScanResult;
import com.cgi.privsense.requestscanner.model.enums.ClassificationVerdict;
import com.cgi.privsense.requestscanner.model.enums.PIIType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PIIReportGeneratorImplTest {

    private final PIIReportGeneratorImpl generator = new PIIReportGeneratorImpl();

    private BatchScanResult batch;

    @BeforeEach
    void setUp() {
        Map<PIIType, List<String>> pii = new EnumMap<>(PIIType.class);
        pii.put(PIIType.PRIMARY_NATIONAL_ID, List.of("123.456.789-09"));
        pii.put(PIIType.ADDRESS, List.of("Rua A, 10"));

        batch = BatchScanResult.builder().build();
        batch.addRecordResult(RecordScanResult.builder()
                .recordIndex(1)
                .verdict(ClassificationVerdict.NON_PUBLIC)
                .detectedPii(pii)
                .build());
        batch.addRecordResult(RecordScanResult.builder()
                .recordIndex(2)
                .verdict(ClassificationVerdict.PUBLIC)
                .build());
    }

    @Test
    @DisplayName("Should write one block per record with verdict and values")
    void generatesReport() {
        String report = generator.generateReport(batch);

        assertEquals(String.join("\n",
                "",
                "REGISTRO 1",
                "NÃO PÚBLICO",
                "CPF: [123.456.789-09]",
                "ENDERECO: [Rua A, 10]",
                "",
                "REGISTRO 2",
                "PÚBLICO",
                ""), report);
    }

    @Test
    @DisplayName("Should summarize counts per verdict and PII type")
    void generatesSummary() {
        String summary = generator.generateSummary(batch);

        assertTrue(summary.contains("Records scanned: 2"));
        assertTrue(summary.contains("Non-public records: 1"));
        assertTrue(summary.contains("- CPF: 1"));
        assertTrue(summary.contains("- EMAIL: 0"));
    }

    @Test
    @DisplayName("Should export records and statistics as JSON")
    void exportsJson() throws Exception {
        byte[] data = generator.exportResults(batch, "JSON");

        JsonNode root = new ObjectMapper().readTree(data);
        assertEquals(2, root.get("scannedRecords").asInt());
        assertEquals(1, root.get("nonPublicRecords").asInt());
        JsonNode first = root.get("records").get(0);
        assertEquals("NÃO PÚBLICO", first.get("verdict").asText());
        assertEquals("123.456.789-09", first.get("pii").get("CPF").get(0).asText());
        assertTrue(root.get("records").get(1).get("pii").isEmpty());
    }

    @Test
    @DisplayName("Should export one CSV line per value and quote values with commas")
    void exportsCsv() {
        String csv = new String(generator.exportResults(batch, "csv"), StandardCharsets.UTF_8);

        assertEquals(String.join("\n",
                "Record,Verdict,PII Type,Value",
                "1,NÃO PÚBLICO,CPF,123.456.789-09",
                "1,NÃO PÚBLICO,ENDERECO,\"Rua A, 10\"",
                "2,PÚBLICO,,",
                ""), csv);
    }

    @Test
    @DisplayName("Should reject unsupported export formats")
    void rejectsUnknownFormat() {
        assertThrows(IllegalArgumentException.class, () -> generator.exportResults(batch, "xml"));
    }
}
