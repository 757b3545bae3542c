package com.purchasingpower.memory.exception;

public class MemoryValidationException extends MemoryServiceException {

    public MemoryValidationException(String message) {
        super(ErrorCode.VALIDATION, message, false);
    }
}
