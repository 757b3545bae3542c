package com.purchasingpower.memory.maintenance;

import com.purchasingpower.memory.jobs.JobSubmission;

import java.util.List;

/**
 * Background repair of drift between the vector and graph stores.
 *
 * <p>Every phase honours {@code dryRun}: a dry run reports what would change and writes
 * nothing, so two consecutive dry runs report the same counts.
 *
 * @since 1.0.0
 */
public interface NormalizationService {

    /**
     * @param phases phases in execution order; null or empty runs {@link NormalizationPhase#defaults()}
     */
    JobSubmission submit(String projectId, List<NormalizationPhase> phases, boolean dryRun);

    NormalizationJob getJob(String jobId);

    List<NormalizationJob> listJobs();
}
