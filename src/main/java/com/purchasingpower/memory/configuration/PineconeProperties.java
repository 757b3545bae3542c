package com.purchasingpower.memory.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class PineconeProperties {

    @NotBlank
    private String apiKey;

    /**
     * Single index holding every collection; each collection is a namespace.
     */
    @NotBlank
    private String indexName;
}
