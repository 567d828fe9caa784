package com.cgi.privsense.requestscanner.exception;

/**
 * Exception for failed calls to an initialized recognizer.
 */
public class EntityRecognitionException extends BaseException {
    private static final long serialVersionUID = 1L;

    public EntityRecognitionException(String message, Throwable cause) {
        super(message, cause, "NER_SERVICE_ERROR");
    }
}
