package com.community.journal.exception;

public class NotFoundException extends JournalException {
    public NotFoundException(String message) {
        super(message, "NOT_FOUND");
    }
}
