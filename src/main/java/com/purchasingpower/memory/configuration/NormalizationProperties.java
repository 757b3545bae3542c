package com.purchasingpower.memory.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class NormalizationProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double duplicateThreshold = 0.95;

    @Min(2)
    private int duplicateSearchLimit = 10;

    /**
     * Soft-deleted memories untouched for longer than this are purged by cleanup.
     */
    @Min(0)
    private int retentionDays = 30;

    private double varianceEpsilon = 0.001;

    @Min(1)
    private int scrollPageSize = 256;
}
