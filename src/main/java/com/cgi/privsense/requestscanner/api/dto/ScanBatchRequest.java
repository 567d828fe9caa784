package com.cgi.privsense.requestscanner.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Batch of request texts; blank entries are skipped.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScanBatchRequest {
    private List<String> records = new ArrayList<>();
}
