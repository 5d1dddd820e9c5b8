package com.community.journal.exception;

/**
 * 分配插入在内部重试后仍然冲突。
 */
public class AssignmentConflictException extends JournalException {
    public AssignmentConflictException(String message) {
        super(message, "ASSIGNMENT_CONFLICT");
    }
}
