package com.cgi.privsense.requestscanner.model.enums;

/**
 * Categories of named entities returned by the recognizer.
 * Only {@link #PERSON} spans are used for name extraction.
 */
public enum EntityCategory {
    PERSON,
    LOCATION,
    ORGANIZATION,
    MISCELLANEOUS,
    OTHER
}
