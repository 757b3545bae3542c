package com.purchasingpower.memory.exception;

/**
 * Raised when a graph query fails the read-only screen.
 */
public class QueryRejectedException extends MemoryServiceException {

    public QueryRejectedException(String message) {
        super(ErrorCode.SECURITY_REJECTED, message, false);
    }
}
