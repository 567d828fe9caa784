package com.cgi.privsense.requestscanner.model;

import java.util.Locale;

/**
 * Normalized text of a single record, shared by the validators of that record.
 */
public class ScanContext {
    private final String text;

    public ScanContext(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    /**
     * Returns the lower-cased slice of at most {@code size} characters
     * that ends right before {@code offset}.
     *
     * @param offset End of the window (exclusive)
     * @param size Maximum window length
     * @return Lower-cased window, possibly empty
     */
    public String precedingWindow(int offset, int size) {
        int end = Math.min(Math.max(offset, 0), text.length());
        int start = Math.max(0, end - size);
        return text.substring(start, end).toLowerCase(Locale.ROOT);
    }
}
