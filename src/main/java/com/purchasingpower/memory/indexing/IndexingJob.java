package com.purchasingpower.memory.indexing;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.purchasingpower.memory.jobs.JobStatus;
import com.purchasingpower.memory.jobs.TrackedJob;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Progress of a directory indexing run. Written by the job thread, read by pollers.
 *
 * @since 1.0.0
 */
@Getter
public class IndexingJob implements TrackedJob {

    public static final String CANCELLED_MESSAGE = "Job cancelled by user";

    private final String id;
    private final String projectId;
    private final String path;
    private final Instant startedAt;
    private final List<String> errors = new CopyOnWriteArrayList<>();

    @Getter(AccessLevel.NONE)
    private final AtomicInteger filesProcessed = new AtomicInteger();

    @Getter(AccessLevel.NONE)
    private final AtomicInteger functionsIndexed = new AtomicInteger();

    private volatile JobStatus status = JobStatus.PENDING;
    private volatile int filesTotal;
    private volatile Instant completedAt;
    private volatile String error;

    public IndexingJob(String id, String projectId, String path, Instant startedAt) {
        this.id = id;
        this.projectId = projectId;
        this.path = path;
        this.startedAt = startedAt;
    }

    public int getFilesProcessed() {
        return filesProcessed.get();
    }

    public int getFunctionsIndexed() {
        return functionsIndexed.get();
    }

    @JsonIgnore
    public boolean isCancelled() {
        return status == JobStatus.FAILED && CANCELLED_MESSAGE.equals(error);
    }

    public synchronized void start(int total) {
        if (status == JobStatus.PENDING) {
            filesTotal = total;
            status = JobStatus.RUNNING;
        }
    }

    public void fileDone(int functions) {
        filesProcessed.incrementAndGet();
        functionsIndexed.addAndGet(functions);
    }

    public void fileFailed(String file, String message) {
        filesProcessed.incrementAndGet();
        errors.add(file + ": " + message);
    }

    public synchronized void complete(Instant at) {
        if (!status.isTerminal()) {
            status = JobStatus.COMPLETE;
            completedAt = at;
        }
    }

    public synchronized void fail(String message, Instant at) {
        if (!status.isTerminal()) {
            error = message;
            status = JobStatus.FAILED;
            completedAt = at;
        }
    }

    /**
     * @return false when the job had already finished
     */
    public synchronized boolean cancel(Instant at) {
        if (status.isTerminal()) {
            return false;
        }
        fail(CANCELLED_MESSAGE, at);
        return true;
    }
}
