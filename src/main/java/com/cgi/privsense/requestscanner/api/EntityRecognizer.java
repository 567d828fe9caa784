package com.cgi.privsense.requestscanner.api;

import com.cgi.privsense.requestscanner.model.EntitySpan;

import java.util.List;

/**
 * Named-entity recognizer used for person-name extraction.
 * Implementations must be safe to call from several threads.
 */
public interface EntityRecognizer {
    /**
     * Recognizes entities in a text.
     *
     * @param text Normalized text
     * @return Entity spans in text order
     */
    List<EntitySpan> recognize(String text);
}
