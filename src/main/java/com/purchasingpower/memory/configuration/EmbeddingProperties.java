package com.purchasingpower.memory.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class EmbeddingProperties {

    @NotBlank
    private String baseUrl = "http://localhost:11434";

    @NotBlank
    private String modelName = "nomic-embed-text";

    @Min(1)
    private int timeoutSeconds = 120;

    @Min(0)
    private int maxRetries = 3;
}
