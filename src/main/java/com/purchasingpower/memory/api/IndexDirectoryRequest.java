package com.purchasingpower.memory.api;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexDirectoryRequest {

    @NotBlank
    private String path;

    /** Defaults to {@code memory.indexing.include-patterns}. */
    private List<String> includePatterns;

    /** Defaults to {@code memory.indexing.exclude-patterns}. */
    private List<String> excludePatterns;
}
