package com.purchasingpower.memory.configuration;

import com.purchasingpower.memory.indexing.IndexingJob;
import com.purchasingpower.memory.jobs.InMemoryJobStore;
import com.purchasingpower.memory.jobs.JobStore;
import com.purchasingpower.memory.maintenance.NormalizationJob;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Job registries. Replace these beans to keep jobs across restarts.
 */
@Configuration
public class JobStoreConfig {

    @Bean
    public JobStore<IndexingJob> indexingJobStore() {
        return new InMemoryJobStore<>();
    }

    @Bean
    public JobStore<NormalizationJob> normalizationJobStore() {
        return new InMemoryJobStore<>();
    }
}
