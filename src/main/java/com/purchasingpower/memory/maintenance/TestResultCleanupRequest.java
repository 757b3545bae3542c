package com.purchasingpower.memory.maintenance;

import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Parameters of the on-demand test-result retention action. Unset counts fall back to
 * the configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestResultCleanupRequest {

    private String suiteName;
    private String suiteId;

    @Min(0)
    private Integer olderThanDays;

    @Min(0)
    private Integer keepCount;

    private boolean dryRun;
}
