package com.community.journal.exception;

/**
 * 调用方可修正的错误：参数越界、日期不对、重复打分、不是自己的分配等。
 */
public class ValidationException extends JournalException {
    public ValidationException(String message) {
        super(message, "VALIDATION_ERROR");
    }
}
