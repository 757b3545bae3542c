package com.purchasingpower.memory.storage;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A similarity search hit.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoredPoint {

    private String collection;
    private double score;
    private VectorPoint point;

    public String getId() {
        return point.getId();
    }
}
