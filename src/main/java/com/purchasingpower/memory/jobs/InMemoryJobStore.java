package com.purchasingpower.memory.jobs;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local job registry. Jobs do not survive a restart.
 */
public class InMemoryJobStore<T extends TrackedJob> implements JobStore<T> {

    private final ConcurrentHashMap<String, T> jobs = new ConcurrentHashMap<>();

    @Override
    public void put(T job) {
        jobs.put(job.getId(), job);
    }

    @Override
    public Optional<T> get(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public List<T> list() {
        return new ArrayList<>(jobs.values());
    }
}
