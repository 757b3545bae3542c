package com.purchasingpower.memory.jobs;

import java.util.List;
import java.util.Optional;

/**
 * Registry of background jobs, polled by id.
 *
 * @param <T> job record type
 * @since 1.0.0
 */
public interface JobStore<T extends TrackedJob> {

    void put(T job);

    Optional<T> get(String jobId);

    List<T> list();
}
