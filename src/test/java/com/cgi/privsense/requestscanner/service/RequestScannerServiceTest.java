package com.cgi.privsense.requestscanner.service;

import com.cgi.privsense.requestscanner.api.PIIDetector;
import com.cgi.privsense.requestscanner.model.BatchScanResult;
import com.cgi.privsense.requestscanner.model.PIIMapping;
import com.cgi.privsense.requestscanner.model.RecordScanResult;
import com.cgi.privsense.requestscanner.model.enums.ClassificationVerdict;
import com.cgi.privsense.requestscanner.model.enums.PIIType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RequestScannerServiceTest {

    @Mock
    private PIIDetector piiDetector;

    private RequestScannerService service;

    @BeforeEach
    void setUp() {
        service = new RequestScannerService(piiDetector, new PIIClassifier(EnumSet.allOf(PIIType.class)));
    }

    @Test
    @DisplayName("Should classify a single record and keep only non-empty types")
    void scansSingleRecord() {
        when(piiDetector.detectPII("CPF 123.456.789-09"))
                .thenReturn(PIIMapping.empty().with(PIIType.PRIMARY_NATIONAL_ID, List.of("123.456.789-09")));

        RecordScanResult result = service.scan("CPF 123.456.789-09");

        assertEquals(1, result.getRecordIndex());
        assertEquals(ClassificationVerdict.NON_PUBLIC, result.getVerdict());
        assertEquals(Map.of(PIIType.PRIMARY_NATIONAL_ID, List.of("123.456.789-09")), result.getDetectedPii());
    }

    @Test
    @DisplayName("Should classify a record without PII as public")
    void scansPublicRecord() {
        when(piiDetector.detectPII(anyString())).thenReturn(PIIMapping.empty());

        RecordScanResult result = service.scan("Solicito cópia do contrato");

        assertEquals(ClassificationVerdict.PUBLIC, result.getVerdict());
        assertTrue(result.getDetectedPii().isEmpty());
    }

    @Test
    @DisplayName("Should reject a blank single record")
    void rejectsBlankRecord() {
        assertThrows(IllegalArgumentException.class, () -> service.scan("   "));
        assertThrows(IllegalArgumentException.class, () -> service.scan(null));
        verify(piiDetector, never()).detectPII(anyString());
    }

    @Test
    @DisplayName("Should skip blank records and number the others from 1")
    void scansBatch() {
        when(piiDetector.detectPII("email a@b.com"))
                .thenReturn(PIIMapping.empty().with(PIIType.EMAIL, List.of("a@b.com")));
        when(piiDetector.detectPII("sem dados")).thenReturn(PIIMapping.empty());

        BatchScanResult result = service.scanBatch(Arrays.asList("email a@b.com", " ", null, "sem dados"));

        assertEquals(2, result.getScannedRecords());
        assertEquals(2, result.getSkippedRecords());
        assertEquals(1, result.getNonPublicRecords());
        assertEquals(1, result.getPublicRecords());
        assertEquals(1, result.getPiiTypeCounts().get(PIIType.EMAIL));

        List<RecordScanResult> records = result.getRecordResults();
        assertEquals(1, records.get(0).getRecordIndex());
        assertTrue(records.get(0).isNonPublic());
        assertEquals(2, records.get(1).getRecordIndex());
        assertFalse(records.get(1).isNonPublic());
    }

    @Test
    @DisplayName("Should return an empty result for an empty batch")
    void scansEmptyBatch() {
        BatchScanResult result = service.scanBatch(List.of());

        assertEquals(0, result.getScannedRecords());
        assertTrue(result.getRecordResults().isEmpty());
    }
}
