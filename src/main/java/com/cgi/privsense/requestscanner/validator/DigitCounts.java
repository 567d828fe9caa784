package com.cgi.privsense.requestscanner.validator;

/**
 * Digit helpers shared by the numeric validators.
 */
final class DigitCounts {

    private DigitCounts() {
    }

    static String digitsOf(String value) {
        StringBuilder digits = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
            }
        }
        return digits.toString();
    }
}
