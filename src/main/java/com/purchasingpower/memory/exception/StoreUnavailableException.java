package com.purchasingpower.memory.exception;

import lombok.Getter;

/**
 * A backing store could not be reached or rejected the request as a whole.
 */
@Getter
public class StoreUnavailableException extends MemoryServiceException {

    private final String store;

    public StoreUnavailableException(String store, String message, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, store + " unavailable: " + message, true, cause);
        this.store = store;
    }
}
