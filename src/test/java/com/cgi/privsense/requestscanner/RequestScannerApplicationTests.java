package com.cgi.privsense.requestscanner;

import com.cgi.privsense.requestscanner.model.PIIMapping;
import com.cgi.privsense.requestscanner.model.RecordScanResult;
import com.cgi.privsense.requestscanner.model.enums.ClassificationVerdict;
import com.cgi.privsense.requestscanner.model.enums.PIIType;
import com.cgi.privsense.requestscanner.ner.LazyEntityRecognizer;
import com.cgi.privsense.requestscanner.service.PIIDetectorImpl;
import com.cgi.privsense.requestscanner.service.RequestScannerService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@SpringBootTest
class RequestScannerApplicationTests {

    @MockBean
    private LazyEntityRecognizer entityRecognizer;

    @Autowired
    private PIIDetectorImpl piiDetector;

    @Autowired
    private RequestScannerService scannerService;

    @Test
    @DisplayName("Should wire the full pipeline and classify a record with PII")
    void classifiesRecordEndToEnd() {
        when(entityRecognizer.recognize(anyString())).thenReturn(List.of());

        RecordScanResult result = scannerService.scan(
                "Contato: maria.silva@example.com, CPF 123.456.789-09, Rua das Flores 123");

        assertEquals(ClassificationVerdict.NON_PUBLIC, result.getVerdict());
        assertEquals(List.of("maria.silva@example.com"), result.getDetectedPii().get(PIIType.EMAIL));
    }

    @Test
    @DisplayName("Should classify a record without PII as public")
    void classifiesPublicRecord() {
        when(entityRecognizer.recognize(anyString())).thenReturn(List.of());

        PIIMapping mapping = piiDetector.detectPII("Solicito a relação de contratos firmados em 2023.");

        assertEquals(PIIMapping.empty(), mapping);
    }
}
