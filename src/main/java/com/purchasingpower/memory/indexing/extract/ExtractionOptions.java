package com.purchasingpower.memory.indexing.extract;

/**
 * @param targetClass when set, dunder methods of this class are kept
 */
public record ExtractionOptions(String targetClass) {

    public static ExtractionOptions defaults() {
        return new ExtractionOptions(null);
    }
}
