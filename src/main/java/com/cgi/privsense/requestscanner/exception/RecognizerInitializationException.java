package com.cgi.privsense.requestscanner.exception;

/**
 * Thrown when the named-entity recognizer cannot be initialized.
 * Not retried: names cannot be extracted without the recognizer.
 */
public class RecognizerInitializationException extends BaseException {
    private static final long serialVersionUID = 1L;

    public RecognizerInitializationException(String message) {
        super(message, "NER_INITIALIZATION_ERROR");
    }

    public RecognizerInitializationException(String message, Throwable cause) {
        super(message, cause, "NER_INITIALIZATION_ERROR");
    }
}
