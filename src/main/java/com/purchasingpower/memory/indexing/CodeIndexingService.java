package com.purchasingpower.memory.indexing;

import com.purchasingpower.memory.jobs.JobSubmission;

import java.util.List;

/**
 * Stores source files as memories and their functions as {@code function} memories.
 *
 * <p>Re-indexing a file replaces its functions: the active {@code function} memories
 * recorded for the same {@code file_path} are soft-deleted before the new ones are written.
 *
 * @since 1.0.0
 */
public interface CodeIndexingService {

    /**
     * @param language    overrides extension-based detection when not null
     * @param targetClass Python class whose dunder methods are kept, may be null
     */
    IndexFileResult indexFile(String projectId, String path, String language, String targetClass);

    /**
     * Starts a background job. Null pattern lists fall back to the configured defaults.
     */
    JobSubmission indexDirectory(String projectId, String path, List<String> includePatterns,
                                 List<String> excludePatterns);

    IndexingJob getJob(String jobId);

    IndexingJob cancel(String jobId);
}
