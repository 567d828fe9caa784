package com.cgi.privsense.requestscanner.model.enums;

/**
 * Enumeration of PII types detected in request records.
 * Declaration order is the order used when reporting.
 */
public enum PIIType {
    // Brazilian national identifiers
    PRIMARY_NATIONAL_ID("CPF"),       // Cadastro de Pessoas Físicas
    SECONDARY_NATIONAL_ID("RG"),      // Registro Geral (identity card)

    // Contact information
    EMAIL("EMAIL"),
    PHONE_NUMBER("TELEFONE"),
    ADDRESS("ENDERECO"),

    // Resolved from named entities, not from patterns
    PERSON_NAME("NOME");

    private final String label;

    PIIType(String label) {
        this.label = label;
    }

    /**
     * Label used in textual reports.
     *
     * @return Report label
     */
    public String getLabel() {
        return label;
    }
}
