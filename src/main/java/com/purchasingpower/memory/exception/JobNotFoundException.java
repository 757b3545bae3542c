package com.purchasingpower.memory.exception;

public class JobNotFoundException extends MemoryServiceException {

    public JobNotFoundException(String jobId) {
        super(ErrorCode.NOT_FOUND, "Job not found: " + jobId, false);
    }
}
