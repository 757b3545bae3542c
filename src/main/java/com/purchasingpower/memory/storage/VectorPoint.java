package com.purchasingpower.memory.storage;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A stored point: id, embedding and payload.
 *
 * @since 1.0.0
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class VectorPoint {

    private String id;

    @Builder.Default
    private List<Float> vector = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> payload = new LinkedHashMap<>();

    public Object payloadValue(String path) {
        return PayloadFilter.resolve(payload, path);
    }

    public VectorPoint copy() {
        return toBuilder()
                .vector(vector != null ? new ArrayList<>(vector) : new ArrayList<>())
                .payload(PayloadFilter.deepCopy(payload))
                .build();
    }
}
