package com.cgi.privsense.requestscanner.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TextNormalizerTest {

    private final TextNormalizer normalizer = new TextNormalizer();

    @Test
    @DisplayName("Should trim leading and trailing whitespace")
    void trimsWhitespace() {
        assertEquals("Pedido de acesso", normalizer.normalize("  \n Pedido de acesso \t "));
    }

    @Test
    @DisplayName("Should replace non-breaking spaces, including at the edges")
    void replacesNonBreakingSpaces() {
        assertEquals("Rua das Flores", normalizer.normalize("Rua\u00A0das\u00A0Flores"));
        assertEquals("Pedido", normalizer.normalize("\u00A0Pedido\u00A0"));
    }

    @Test
    @DisplayName("Should keep case, punctuation and inner whitespace")
    void keepsEverythingElse() {
        assertEquals("Sr. JOÃO,  CPF:  123", normalizer.normalize(" Sr. JOÃO,  CPF:  123 "));
    }
}
