package com.purchasingpower.memory.storage;

/**
 * Minimal view of a graph node, used by reconciliation.
 */
public record GraphNodeRef(String memoryId, String type, boolean deleted) {
}
