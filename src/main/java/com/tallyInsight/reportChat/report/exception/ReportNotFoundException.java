package com.tallyInsight.reportChat.report.exception;

/**
 * Exception thrown when the question names no known report, or the backend has no export for it.
 */
public class ReportNotFoundException extends RuntimeException {

    public ReportNotFoundException(String message) {
        super(message);
    }
}
