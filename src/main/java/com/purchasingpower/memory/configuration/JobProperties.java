package com.purchasingpower.memory.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class JobProperties {

    @Min(1)
    private int corePoolSize = 2;

    @Min(1)
    private int maxPoolSize = 4;

    @Min(0)
    private int queueCapacity = 100;
}
