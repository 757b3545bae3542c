package com.purchasingpower.memory.exception;

import lombok.Getter;

/**
 * Base type for every failure the memory service reports to callers.
 *
 * @since 1.0.0
 */
@Getter
public class MemoryServiceException extends RuntimeException {

    private final ErrorCode code;
    private final boolean retryable;

    public MemoryServiceException(ErrorCode code, String message, boolean retryable) {
        super(message);
        this.code = code;
        this.retryable = retryable;
    }

    public MemoryServiceException(ErrorCode code, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.retryable = retryable;
    }
}
