package com.purchasingpower.memory.embedding;

import java.util.List;

/**
 * Turns text into fixed-length vectors.
 *
 * @since 1.0.0
 */
public interface EmbeddingProvider {

    List<Float> embed(String text);

    /**
     * Embeds all texts in one provider call; results keep input order.
     */
    List<List<Float>> embedBatch(List<String> texts);
}
