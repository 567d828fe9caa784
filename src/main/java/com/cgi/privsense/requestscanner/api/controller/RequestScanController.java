package com.cgi.privsense.requestscanner.api.controller;

import com.cgi.privsense.requestscanner.api.PIIReportGenerator;
import com.cgi.privsense.requestscanner.api.dto.ApiResponse;
import com.cgi.privsense.requestscanner.api.dto.ScanBatchRequest;
import com.cgi.privsense.requestscanner.api.dto.ScanTextRequest;
import com.cgi.privsense.requestscanner.model.BatchScanResult;
import com.cgi.privsense.requestscanner.model.RecordScanResult;
import com.cgi.privsense.requestscanner.service.RequestScannerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * REST Controller for request record classification.
 */
@RestController
@RequestMapping("/api/requests")
@Tag(name = "Request Scanner", description = "API for detecting PII in access-to-information requests")
public class RequestScanController {
    private static final Logger log = LoggerFactory.getLogger(RequestScanController.class);

    private final RequestScannerService scannerService;
    private final PIIReportGenerator reportGenerator;

    public RequestScanController(RequestScannerService scannerService, PIIReportGenerator reportGenerator) {
        this.scannerService = scannerService;
        this.reportGenerator = reportGenerator;
    }

    @Operation(summary = "Detect PII in a single request and classify it")
    @PostMapping("/scan")
    public ResponseEntity<ApiResponse<RecordScanResult>> scanText(@RequestBody ScanTextRequest request) {
        RecordScanResult result = scannerService.scan(request.getText());
        log.info("Request scanned, verdict: {}", result.getVerdict());
        return ResponseEntity.ok(ApiResponse.success(result));
    }

    @Operation(summary = "Detect PII in a batch of requests and classify each one")
    @PostMapping("/scan/batch")
    public ResponseEntity<ApiResponse<BatchScanResult>> scanBatch(@RequestBody ScanBatchRequest request) {
        log.info("Starting batch scan of {} records", request.getRecords() == null ? 0 : request.getRecords().size());
        BatchScanResult result = scannerService.scanBatch(request.getRecords());
        return ResponseEntity.ok(ApiResponse.success(result));
    }

    @Operation(summary = "Generate a textual report for a batch of requests")
    @PostMapping(value = "/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> generateReport(@RequestBody ScanBatchRequest request,
                                                 @RequestParam(defaultValue = "false") boolean summary) {
        BatchScanResult result = scannerService.scanBatch(request.getRecords());
        String report = summary ? reportGenerator.generateSummary(result) : reportGenerator.generateReport(result);
        return ResponseEntity.ok()
                .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                .body(report);
    }

    @Operation(summary = "Export the scan results of a batch in JSON or CSV")
    @PostMapping("/export")
    public ResponseEntity<byte[]> exportResults(@RequestBody ScanBatchRequest request,
                                                @RequestParam(defaultValue = "json") String format) {
        log.info("Exporting scan results in format: {}", format);

        BatchScanResult result = scannerService.scanBatch(request.getRecords());
        byte[] data = reportGenerator.exportResults(result, format);

        String extension = format.toLowerCase(Locale.ROOT);
        MediaType mediaType = "csv".equals(extension)
                ? new MediaType("text", "csv", StandardCharsets.UTF_8)
                : MediaType.APPLICATION_JSON;

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(mediaType);
        headers.setContentDispositionFormData("attachment", "request-scan." + extension);

        return ResponseEntity.ok()
                .headers(headers)
                .body(data);
    }
}
