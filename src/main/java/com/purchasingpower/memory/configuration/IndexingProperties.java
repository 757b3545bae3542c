package com.purchasingpower.memory.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class IndexingProperties {

    private boolean extractFunctions = true;

    /**
     * Maximum characters of content copied onto graph nodes.
     */
    @Min(1)
    private int contentSummaryLength = 500;

    private List<String> includePatterns = new ArrayList<>(List.of(
            "*.ts", "*.tsx", "*.js", "*.jsx", "*.py", "*.go", "*.java", "*.rs", "*.cs"));

    private List<String> excludePatterns = new ArrayList<>(List.of(
            "node_modules", "dist", ".git", "__pycache__", "vendor", "target", "build"));
}
