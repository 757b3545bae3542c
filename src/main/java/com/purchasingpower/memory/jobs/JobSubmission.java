package com.purchasingpower.memory.jobs;

/**
 * Immediate answer to a job submission; the job itself is polled by id.
 */
public record JobSubmission(String jobId, JobStatus status) {

    public static JobSubmission pending(String jobId) {
        return new JobSubmission(jobId, JobStatus.PENDING);
    }
}
