package com.purchasingpower.memory.maintenance.impl;

import com.purchasingpower.memory.configuration.AsyncConfig;
import com.purchasingpower.memory.core.ProjectIds;
import com.purchasingpower.memory.exception.JobNotFoundException;
import com.purchasingpower.memory.jobs.JobStore;
import com.purchasingpower.memory.jobs.JobSubmission;
import com.purchasingpower.memory.maintenance.MaintenancePhase;
import com.purchasingpower.memory.maintenance.NormalizationJob;
import com.purchasingpower.memory.maintenance.NormalizationPhase;
import com.purchasingpower.memory.maintenance.NormalizationService;
import com.purchasingpower.memory.maintenance.PhaseResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs normalization jobs on the job executor. A failing phase is recorded as an
 * {@code Error: ...} result and the remaining phases still run.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class NormalizationServiceImpl implements NormalizationService {

    private final Map<NormalizationPhase, MaintenancePhase> phases = new EnumMap<>(NormalizationPhase.class);
    private final JobStore<NormalizationJob> jobStore;
    private final Executor executor;
    private final Clock clock;

    public NormalizationServiceImpl(List<MaintenancePhase> maintenancePhases,
                                    JobStore<NormalizationJob> jobStore,
                                    @Qualifier(AsyncConfig.JOB_EXECUTOR) Executor executor,
                                    Clock clock) {
        for (MaintenancePhase phase : maintenancePhases) {
            phases.put(phase.phase(), phase);
        }
        this.jobStore = jobStore;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public JobSubmission submit(String projectId, List<NormalizationPhase> requested, boolean dryRun) {
        ProjectIds.requireValid(projectId);
        List<NormalizationPhase> ordered = requested == null || requested.isEmpty()
                ? NormalizationPhase.defaults()
                : requested;

        NormalizationJob job = new NormalizationJob(UUID.randomUUID().toString(), projectId, ordered, dryRun,
                clock.instant());
        jobStore.put(job);
        log.info("🚀 Normalization job {} queued for {}: {}{}", job.getId(), projectId, ordered,
                dryRun ? " (dry run)" : "");

        CompletableFuture.runAsync(() -> runJob(job), executor);
        return JobSubmission.pending(job.getId());
    }

    private void runJob(NormalizationJob job) {
        try {
            job.start();
            for (NormalizationPhase phase : job.getPhases()) {
                job.addResult(runPhase(job, phase));
            }
            job.complete(clock.instant());
            log.info("✅ Normalization job {} complete", job.getId());
        } catch (RuntimeException e) {
            log.error("❌ Normalization job {} failed: {}", job.getId(), e.getMessage(), e);
            job.fail(e.getMessage(), clock.instant());
        }
    }

    private PhaseResult runPhase(NormalizationJob job, NormalizationPhase phase) {
        MaintenancePhase executorForPhase = phases.get(phase);
        if (executorForPhase == null) {
            return PhaseResult.failed(phase, "No executor for phase " + phase.getWireName());
        }
        try {
            return executorForPhase.run(job.getProjectId(), job.isDryRun());
        } catch (RuntimeException e) {
            log.warn("⚠️  Phase {} of job {} failed: {}", phase.getWireName(), job.getId(), e.getMessage());
            return PhaseResult.failed(phase, e.getMessage());
        }
    }

    @Override
    public NormalizationJob getJob(String jobId) {
        return jobStore.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @Override
    public List<NormalizationJob> listJobs() {
        return jobStore.list().stream()
                .sorted(Comparator.comparing(NormalizationJob::getStartedAt).reversed())
                .toList();
    }
}
