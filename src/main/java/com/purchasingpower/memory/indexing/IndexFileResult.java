package com.purchasingpower.memory.indexing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexFileResult {

    /** The {@code code_pattern} memory holding the whole file. */
    private String memoryId;
    private String filePath;
    private String language;
    private int functionsIndexed;
    private int staleFunctionsRemoved;
}
