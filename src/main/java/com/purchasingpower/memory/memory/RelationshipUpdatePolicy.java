package com.purchasingpower.memory.memory;

/**
 * What an update carrying explicit relationships does to the edges a memory already has.
 * Inferred edges are never touched by an update.
 */
public enum RelationshipUpdatePolicy {
    /** Drop the node's previous explicit edges, then create the new ones. */
    REPLACE,
    /** Only add the new edges. */
    APPEND
}
