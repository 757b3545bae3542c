package com.purchasingpower.memory.storage;

import java.util.List;

/**
 * One page of a filtered scroll. {@code nextOffset} is null once the collection is exhausted.
 */
public record ScrollPage(List<VectorPoint> points, String nextOffset) {

    public static ScrollPage empty() {
        return new ScrollPage(List.of(), null);
    }

    public boolean hasMore() {
        return nextOffset != null;
    }
}
