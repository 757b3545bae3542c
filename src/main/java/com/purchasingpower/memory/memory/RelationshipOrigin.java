package com.purchasingpower.memory.memory;

/**
 * Stored on every edge as the {@code origin} property.
 */
public enum RelationshipOrigin {
    EXPLICIT("explicit"),
    INFERRED("inferred");

    private final String value;

    RelationshipOrigin(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
