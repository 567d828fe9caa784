package com.cgi.privsense.requestscanner.model.enums;

/**
 * Publication verdict for a request record.
 */
public enum ClassificationVerdict {
    NON_PUBLIC("NÃO PÚBLICO"),
    PUBLIC("PÚBLICO");

    private final String label;

    ClassificationVerdict(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
