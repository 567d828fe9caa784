package com.cgi.privsense.requestscanner.exception;

/**
 * Base exception class for all exceptions in the application.
 * Carries an error code used in API error responses.
 */
public abstract class BaseException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String errorCode;

    protected BaseException(String message, String errorCode) {
        this(message, null, errorCode);
    }

    protected BaseException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
