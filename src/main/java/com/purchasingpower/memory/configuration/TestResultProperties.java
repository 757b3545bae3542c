package com.purchasingpower.memory.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class TestResultProperties {

    @Min(0)
    private int keepCount = 10;

    @Min(0)
    private int olderThanDays = 30;
}
