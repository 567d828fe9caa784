package com.cgi.privsense.requestscanner.service;

import org.springframework.stereotype.Component;

/**
 * Minimal cleanup applied before any matching. Case, punctuation and
 * inner whitespace are kept since patterns and the recognizer rely on them.
 */
@Component
public class TextNormalizer {
    private static final char NO_BREAK_SPACE = '\u00A0';

    public String normalize(String text) {
        // String.strip() does not treat U+00A0 as whitespace, so replace first
        return text.replace(NO_BREAK_SPACE, ' ').strip();
    }
}
