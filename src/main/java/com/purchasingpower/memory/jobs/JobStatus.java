package com.purchasingpower.memory.jobs;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a background job. {@code COMPLETE} and {@code FAILED} are terminal.
 *
 * @since 1.0.0
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETE,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}
