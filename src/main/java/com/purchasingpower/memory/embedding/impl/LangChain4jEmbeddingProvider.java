package com.purchasingpower.memory.embedding.impl;

import com.purchasingpower.memory.configuration.EmbeddingProperties;
import com.purchasingpower.memory.configuration.MemoryProperties;
import com.purchasingpower.memory.embedding.EmbeddingProvider;
import com.purchasingpower.memory.exception.EmbeddingException;
import com.purchasingpower.memory.exception.MemoryValidationException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * LangChain4j-backed embedding provider. Retries and timeouts are handled by the model
 * client; anything that still fails surfaces as {@link EmbeddingException}.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class LangChain4jEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingModel embeddingModel;

    @Autowired
    public LangChain4jEmbeddingProvider(MemoryProperties properties) {
        this(buildOllamaModel(properties.getEmbedding()));
    }

    public LangChain4jEmbeddingProvider(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    private static EmbeddingModel buildOllamaModel(EmbeddingProperties config) {
        log.info("🔷 Initializing embedding model");
        log.info("   - Ollama URL: {}", config.getBaseUrl());
        log.info("   - Model: {}", config.getModelName());
        log.info("   - Timeout: {}s, Max Retries: {}", config.getTimeoutSeconds(), config.getMaxRetries());

        return OllamaEmbeddingModel.builder()
                .baseUrl(config.getBaseUrl())
                .modelName(config.getModelName())
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .maxRetries(config.getMaxRetries())
                .logRequests(false)
                .logResponses(false)
                .build();
    }

    @Override
    public List<Float> embed(String text) {
        if (text == null || text.isEmpty()) {
            throw new MemoryValidationException("Text cannot be empty");
        }

        log.debug("🔷 Generating embedding (length: {})", text.length());
        try {
            Response<Embedding> response = embeddingModel.embed(text);
            return toFloatList(response.content());
        } catch (RuntimeException e) {
            log.error("❌ Failed to generate embedding after retries: {}", e.getMessage());
            throw new EmbeddingException("Embedding generation failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<List<Float>> embedBatch(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        log.info("🔷 Generating embeddings for {} texts in batch", texts.size());

        List<TextSegment> segments = texts.stream()
                .map(TextSegment::from)
                .toList();
        try {
            Response<List<Embedding>> response = embeddingModel.embedAll(segments);
            List<List<Float>> vectors = new ArrayList<>(segments.size());
            for (Embedding embedding : response.content()) {
                vectors.add(toFloatList(embedding));
            }
            if (vectors.size() != texts.size()) {
                throw new EmbeddingException("Embedding provider returned " + vectors.size()
                        + " vectors for " + texts.size() + " texts", null);
            }
            log.info("✅ Generated {} embeddings", vectors.size());
            return vectors;
        } catch (EmbeddingException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("❌ Batch embedding generation failed after retries: {}", e.getMessage());
            throw new EmbeddingException("Batch embedding generation failed: " + e.getMessage(), e);
        }
    }

    private List<Float> toFloatList(Embedding embedding) {
        float[] vector = embedding.vector();
        List<Float> result = new ArrayList<>(vector.length);
        for (float value : vector) {
            result.add(value);
        }
        return result;
    }
}
