package com.purchasingpower.memory.support;

import com.purchasingpower.memory.embedding.EmbeddingProvider;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic bag-of-words embeddings. Identical texts embed identically, texts sharing
 * no words are (almost always) orthogonal. Tests that need an exact geometry register
 * vectors for specific texts.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {

    public static final int DIMENSION = 64;

    private final Map<String, List<Float>> registered = new HashMap<>();
    private final AtomicInteger calls = new AtomicInteger();

    public HashingEmbeddingProvider register(String text, List<Float> vector) {
        registered.put(text, vector);
        return this;
    }

    /**
     * A unit vector along one axis.
     */
    public static List<Float> axis(int index) {
        List<Float> vector = zeros();
        vector.set(index, 1f);
        return vector;
    }

    /**
     * A unit vector mostly along {@code index}, tilted towards {@code other} so that its
     * cosine with {@code axis(index)} equals {@code cosine}.
     */
    public static List<Float> tilted(int index, int other, double cosine) {
        List<Float> vector = zeros();
        vector.set(index, (float) cosine);
        vector.set(other, (float) Math.sqrt(1 - cosine * cosine));
        return vector;
    }

    public static List<Float> zeros() {
        List<Float> vector = new ArrayList<>(DIMENSION);
        for (int i = 0; i < DIMENSION; i++) {
            vector.add(0f);
        }
        return vector;
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public List<Float> embed(String text) {
        calls.incrementAndGet();
        List<Float> fixed = registered.get(text);
        if (fixed != null) {
            return new ArrayList<>(fixed);
        }
        double[] counts = new double[DIMENSION];
        for (String token : text.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (!token.isEmpty()) {
                counts[Math.floorMod(token.hashCode(), DIMENSION)] += 1;
            }
        }
        double norm = 0;
        for (double count : counts) {
            norm += count * count;
        }
        if (norm == 0) {
            return axis(0);
        }
        double length = Math.sqrt(norm);
        List<Float> vector = new ArrayList<>(DIMENSION);
        for (double count : counts) {
            vector.add((float) (count / length));
        }
        return vector;
    }

    @Override
    public List<List<Float>> embedBatch(List<String> texts) {
        List<List<Float>> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }
}
