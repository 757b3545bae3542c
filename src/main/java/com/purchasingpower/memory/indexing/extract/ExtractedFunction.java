package com.purchasingpower.memory.indexing.extract;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A function or method found in a source file. Lines are 1-based and inclusive.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedFunction {

    private String name;
    private String body;
    private int startLine;
    private int endLine;
    private String signature;
    private boolean async;
    private boolean method;
    private String className;
}
