package com.purchasingpower.memory.model;

/**
 * Backing services whose calls are logged through {@link com.purchasingpower.memory.util.ExternalCallLogger}.
 */
public enum ServiceType {
    PINECONE("🔵", "VECTOR DB"),
    NEO4J("🟢", "GRAPH DB"),
    EMBEDDING("🔷", "EMBEDDING");

    private final String emoji;
    private final String tag;

    ServiceType(String emoji, String tag) {
        this.emoji = emoji;
        this.tag = tag;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getTag() {
        return tag;
    }
}
