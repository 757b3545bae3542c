package com.purchasingpower.memory.maintenance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.purchasingpower.memory.exception.MemoryValidationException;

import java.util.List;
import java.util.Locale;

/**
 * Maintenance passes a normalization job can run. Jobs run them in the order requested.
 *
 * @since 1.0.0
 */
public enum NormalizationPhase {
    DEDUP("dedup"),
    ORPHAN_DETECTION("orphan_detection"),
    CLEANUP("cleanup"),
    EMBEDDING_REFRESH("embedding_refresh");

    private final String wireName;

    NormalizationPhase(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Phases run when a job names none. Embedding refresh is opt-in.
     */
    public static List<NormalizationPhase> defaults() {
        return List.of(DEDUP, ORPHAN_DETECTION, CLEANUP);
    }

    @JsonCreator
    public static NormalizationPhase fromWireName(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (NormalizationPhase phase : values()) {
                if (phase.wireName.equals(normalized)) {
                    return phase;
                }
            }
        }
        throw new MemoryValidationException("Unknown normalization phase: " + value);
    }
}
