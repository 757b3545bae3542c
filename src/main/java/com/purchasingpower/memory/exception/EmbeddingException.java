package com.purchasingpower.memory.exception;

public class EmbeddingException extends MemoryServiceException {

    public EmbeddingException(String message, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, message, true, cause);
    }
}
