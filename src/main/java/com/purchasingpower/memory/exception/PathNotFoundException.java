package com.purchasingpower.memory.exception;

/**
 * A file or directory given for indexing does not exist or has the wrong kind.
 */
public class PathNotFoundException extends MemoryServiceException {

    public PathNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message, false);
    }
}
