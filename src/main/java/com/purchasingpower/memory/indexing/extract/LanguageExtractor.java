package com.purchasingpower.memory.indexing.extract;

import java.util.List;
import java.util.Set;

/**
 * Finds functions in the source of one or more languages.
 *
 * @since 1.0.0
 */
public interface LanguageExtractor {

    /**
     * Language names this extractor handles, as produced by
     * {@link com.purchasingpower.memory.indexing.LanguageDetector}.
     */
    Set<String> languages();

    List<ExtractedFunction> extract(String source, ExtractionOptions options);
}
