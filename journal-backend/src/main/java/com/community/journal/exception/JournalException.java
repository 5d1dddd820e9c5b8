package com.community.journal.exception;

public class JournalException extends RuntimeException {
    private final String errorCode;

    public JournalException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public JournalException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
