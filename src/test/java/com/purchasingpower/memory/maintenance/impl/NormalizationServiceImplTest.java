package com.purchasingpower.memory.maintenance.impl;

import com.purchasingpower.memory.exception.JobNotFoundException;
import com.purchasingpower.memory.jobs.InMemoryJobStore;
import com.purchasingpower.memory.jobs.JobStatus;
import com.purchasingpower.memory.jobs.JobSubmission;
import com.purchasingpower.memory.maintenance.MaintenancePhase;
import com.purchasingpower.memory.maintenance.NormalizationJob;
import com.purchasingpower.memory.maintenance.NormalizationPhase;
import com.purchasingpower.memory.maintenance.PhaseResult;
import com.purchasingpower.memory.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NormalizationServiceImplTest {

    private static final String PROJECT = "demo-project";

    private final MutableClock clock = new MutableClock(Instant.parse("2024-06-01T10:00:00Z"));

    private static MaintenancePhase phase(NormalizationPhase type, int count) {
        MaintenancePhase phase = mock(MaintenancePhase.class);
        when(phase.phase()).thenReturn(type);
        when(phase.run(anyString(), anyBoolean()))
                .thenReturn(PhaseResult.of(type, count, new ArrayList<>(), "nothing"));
        return phase;
    }

    private NormalizationServiceImpl service(List<MaintenancePhase> phases) {
        return new NormalizationServiceImpl(phases, new InMemoryJobStore<>(), Runnable::run, clock);
    }

    @Test
    @DisplayName("Without explicit phases the default three run in order")
    void defaultPhases() {
        // Given
        MaintenancePhase dedup = phase(NormalizationPhase.DEDUP, 2);
        MaintenancePhase orphans = phase(NormalizationPhase.ORPHAN_DETECTION, 0);
        MaintenancePhase cleanup = phase(NormalizationPhase.CLEANUP, 1);
        MaintenancePhase refresh = phase(NormalizationPhase.EMBEDDING_REFRESH, 5);
        NormalizationServiceImpl service = service(List.of(refresh, cleanup, orphans, dedup));

        // When
        JobSubmission submission = service.submit(PROJECT, null, true);
        NormalizationJob job = service.getJob(submission.jobId());

        // Then
        assertThat(submission.status()).isEqualTo(JobStatus.PENDING);
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETE);
        assertThat(job.isDryRun()).isTrue();
        assertThat(job.getResults()).extracting(PhaseResult::getPhase).containsExactly(
                NormalizationPhase.DEDUP, NormalizationPhase.ORPHAN_DETECTION, NormalizationPhase.CLEANUP);
        assertThat(job.getResults()).extracting(PhaseResult::getCount).containsExactly(2, 0, 1);
        verify(dedup).run(PROJECT, true);
    }

    @Test
    @DisplayName("A failing phase is recorded as an error and later phases still run")
    void failingPhase() {
        // Given
        MaintenancePhase dedup = mock(MaintenancePhase.class);
        when(dedup.phase()).thenReturn(NormalizationPhase.DEDUP);
        when(dedup.run(anyString(), anyBoolean())).thenThrow(new IllegalStateException("vector store timeout"));
        MaintenancePhase cleanup = phase(NormalizationPhase.CLEANUP, 3);
        NormalizationServiceImpl service = service(List.of(dedup, cleanup));

        // When
        JobSubmission submission = service.submit(PROJECT,
                List.of(NormalizationPhase.DEDUP, NormalizationPhase.CLEANUP), false);
        NormalizationJob job = service.getJob(submission.jobId());

        // Then
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETE);
        assertThat(job.getResults().get(0).getDetails()).containsExactly("Error: vector store timeout");
        assertThat(job.getResults().get(1).getCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("A phase without an executor reports an error")
    void unknownPhase() {
        NormalizationServiceImpl service = service(List.of());

        NormalizationJob job = service.getJob(
                service.submit(PROJECT, List.of(NormalizationPhase.EMBEDDING_REFRESH), false).jobId());

        assertThat(job.getResults()).singleElement()
                .extracting(PhaseResult::getDetails)
                .isEqualTo(List.of("Error: No executor for phase embedding_refresh"));
    }

    @Test
    @DisplayName("Jobs are listed newest first and unknown ids are not found")
    void listJobs() {
        NormalizationServiceImpl service = service(List.of(phase(NormalizationPhase.DEDUP, 0)));
        String first = service.submit(PROJECT, List.of(NormalizationPhase.DEDUP), true).jobId();
        clock.advance(Duration.ofMinutes(1));
        String second = service.submit(PROJECT, List.of(NormalizationPhase.DEDUP), true).jobId();

        assertThat(service.listJobs()).extracting(NormalizationJob::getId).containsExactly(second, first);
        assertThatThrownBy(() -> service.getJob("nope")).isInstanceOf(JobNotFoundException.class);
    }
}
