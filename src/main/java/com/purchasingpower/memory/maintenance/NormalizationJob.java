package com.purchasingpower.memory.maintenance;

import com.purchasingpower.memory.jobs.JobStatus;
import com.purchasingpower.memory.jobs.TrackedJob;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A normalization run. Phases execute in order; {@link #getResults()} grows by one entry
 * per executed phase.
 *
 * @since 1.0.0
 */
@Getter
public class NormalizationJob implements TrackedJob {

    private final String id;
    private final String projectId;
    private final List<NormalizationPhase> phases;
    private final boolean dryRun;
    private final Instant startedAt;
    private final List<PhaseResult> results = new CopyOnWriteArrayList<>();

    private volatile JobStatus status = JobStatus.PENDING;
    private volatile Instant completedAt;
    private volatile String error;

    public NormalizationJob(String id, String projectId, List<NormalizationPhase> phases, boolean dryRun,
                            Instant startedAt) {
        this.id = id;
        this.projectId = projectId;
        this.phases = List.copyOf(phases);
        this.dryRun = dryRun;
        this.startedAt = startedAt;
    }

    public void start() {
        status = JobStatus.RUNNING;
    }

    public void addResult(PhaseResult result) {
        results.add(result);
    }

    public void complete(Instant at) {
        completedAt = at;
        status = JobStatus.COMPLETE;
    }

    public void fail(String message, Instant at) {
        error = message;
        completedAt = at;
        status = JobStatus.FAILED;
    }
}
