package com.purchasingpower.memory.indexing.extract;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rust functions; {@code impl} and {@code trait} blocks act as the class scope.
 */
@Component
public class RustExtractor extends BraceScopedExtractor {

    private static final Pattern IMPL = Pattern.compile(
            "^\\s*(?:pub(?:\\([^)]*\\))?\\s+)?(?:unsafe\\s+)?(?:impl(?:<[^>]*>)?\\s+(?:[\\w:<>, ']+\\s+for\\s+)?|trait\\s+)(?<name>[A-Za-z_]\\w*)");

    private static final Pattern FN = Pattern.compile(
            "^\\s*(?:pub(?:\\([^)]*\\))?\\s+)?(?:const\\s+)?(?:async\\s+)?(?:unsafe\\s+)?(?:extern\\s+\"[^\"]*\"\\s+)?fn\\s+(?<name>[A-Za-z_]\\w*)");

    @Override
    public Set<String> languages() {
        return Set.of("rust");
    }

    @Override
    protected Pattern classPattern() {
        return IMPL;
    }

    @Override
    protected List<Pattern> functionPatterns() {
        return List.of(FN);
    }
}
