package com.tallyInsight.reportChat.report.exception;

/**
 * Exception thrown when a report is requested before any company was selected.
 */
public class NoCompanySelectedException extends RuntimeException {

    public NoCompanySelectedException(String message) {
        super(message);
    }
}
