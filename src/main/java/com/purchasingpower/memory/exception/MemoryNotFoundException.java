package com.purchasingpower.memory.exception;

import lombok.Getter;

@Getter
public class MemoryNotFoundException extends MemoryServiceException {

    private final String memoryId;

    public MemoryNotFoundException(String type, String memoryId) {
        super(ErrorCode.NOT_FOUND, "Memory not found: " + type + "/" + memoryId, false);
        this.memoryId = memoryId;
    }
}
