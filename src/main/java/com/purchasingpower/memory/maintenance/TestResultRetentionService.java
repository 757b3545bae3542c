package com.purchasingpower.memory.maintenance;

import java.util.Map;

/**
 * Keeps per-suite test-result history bounded.
 *
 * <p>Active {@code test_result} memories are grouped by {@code metadata.suite_id}, falling
 * back to {@code metadata.suite_name}. Within a suite the newest {@code keepCount} results
 * are always kept.
 *
 * @since 1.0.0
 */
public interface TestResultRetentionService {

    /**
     * Soft-deletes results beyond {@code keepCount} that are also older than the cutoff,
     * and removes their graph nodes.
     */
    TestResultCleanupResult cleanup(String projectId, TestResultCleanupRequest request);

    /**
     * Runs before a new test result is written. Keeps the newest configured number of
     * results of the suite named in {@code metadata} regardless of age. Never throws:
     * failures are logged and reported as zero.
     *
     * @return number of results soft-deleted
     */
    int cleanupOnWrite(String projectId, Map<String, Object> metadata);
}
