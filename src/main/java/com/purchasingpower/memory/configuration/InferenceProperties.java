package com.purchasingpower.memory.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * Thresholds for automatic relationship inference on create.
 */
@Data
public class InferenceProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double scoreThreshold = 0.75;

    @Min(1)
    private int maxMatches = 3;
}
