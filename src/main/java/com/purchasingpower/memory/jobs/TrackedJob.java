package com.purchasingpower.memory.jobs;

/**
 * A background job that can be registered in a {@link JobStore}.
 */
public interface TrackedJob {

    String getId();

    JobStatus getStatus();
}
