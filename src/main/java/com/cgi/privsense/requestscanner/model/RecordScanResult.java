package com.cgi.privsense.requestscanner.model;

import com.cgi.privsense.requestscanner.model.enums.ClassificationVerdict;
import com.cgi.privsense.requestscanner.model.enums.PIIType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordScanResult {
    private int recordIndex;
    private ClassificationVerdict verdict;

    /**
     * Detected values restricted to the PII types that are not empty.
     */
    @Builder.Default
    private Map<PIIType, List<String>> detectedPii = new EnumMap<>(PIIType.class);

    public boolean isNonPublic() {
        return verdict == ClassificationVerdict.NON_PUBLIC;
    }
}
