package com.purchasingpower.memory.indexing.extract;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up the extractor for a language. Every {@link LanguageExtractor} bean registers itself.
 */
@Slf4j
@Component
public class ExtractorRegistry {

    private final Map<String, LanguageExtractor> byLanguage = new HashMap<>();

    public ExtractorRegistry(List<LanguageExtractor> extractors) {
        for (LanguageExtractor extractor : extractors) {
            for (String language : extractor.languages()) {
                LanguageExtractor previous = byLanguage.put(language, extractor);
                if (previous != null) {
                    log.warn("⚠️  {} replaces {} for language {}", extractor.getClass().getSimpleName(),
                            previous.getClass().getSimpleName(), language);
                }
            }
        }
        log.info("✅ Function extractors registered for {}", byLanguage.keySet());
    }

    public Optional<LanguageExtractor> find(String language) {
        return Optional.ofNullable(language != null ? byLanguage.get(language) : null);
    }
}
