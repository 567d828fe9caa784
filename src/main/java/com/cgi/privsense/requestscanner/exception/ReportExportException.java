package com.cgi.privsense.requestscanner.exception;

/**
 * Exception for report serialization errors.
 */
public class ReportExportException extends BaseException {
    private static final long serialVersionUID = 1L;

    public ReportExportException(String message, Throwable cause) {
        super(message, cause, "REPORT_EXPORT_ERROR");
    }
}
