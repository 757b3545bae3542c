package com.purchasingpower.memory.transfer;

import com.purchasingpower.memory.exception.MemoryValidationException;

import java.util.Locale;

/**
 * What to do with an imported record whose id already exists in its collection.
 */
public enum ImportConflictPolicy {
    SKIP,
    OVERWRITE,
    ERROR;

    public static ImportConflictPolicy fromValue(String value) {
        if (value == null || value.isBlank()) {
            return SKIP;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MemoryValidationException("Unknown conflict policy: " + value);
        }
    }
}
