package com.purchasingpower.memory.exception;

/**
 * The memory exists but its state forbids the requested operation, e.g. updating a
 * soft-deleted memory or importing over an existing id with the {@code error} policy.
 */
public class MemoryConflictException extends MemoryServiceException {

    public MemoryConflictException(String message) {
        super(ErrorCode.CONFLICT, message, false);
    }
}
