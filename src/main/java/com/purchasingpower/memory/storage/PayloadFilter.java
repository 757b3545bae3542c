package com.purchasingpower.memory.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Conjunctive equality filter over payload fields. Paths may be dotted to reach into
 * nested maps, e.g. {@code metadata.file_path}.
 *
 * @since 1.0.0
 */
public final class PayloadFilter {

    private static final PayloadFilter NONE = new PayloadFilter(Collections.emptyMap());

    private final Map<String, Object> conditions;

    private PayloadFilter(Map<String, Object> conditions) {
        this.conditions = conditions;
    }

    public static PayloadFilter none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Object> conditions() {
        return Collections.unmodifiableMap(conditions);
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    public boolean matches(Map<String, Object> payload) {
        for (Map.Entry<String, Object> condition : conditions.entrySet()) {
            Object actual = resolve(payload, condition.getKey());
            if (!valuesEqual(condition.getValue(), actual)) {
                return false;
            }
        }
        return true;
    }

    /**
     * A copy of this filter with one more condition.
     */
    public PayloadFilter and(String path, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(conditions);
        merged.put(path, value);
        return new PayloadFilter(merged);
    }

    @SuppressWarnings("unchecked")
    public static Object resolve(Map<String, Object> payload, String path) {
        if (payload == null || path == null) {
            return null;
        }
        if (payload.containsKey(path)) {
            return payload.get(path);
        }
        Object current = payload;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<String, Object>) current).get(segment);
        }
        return current;
    }

    static boolean valuesEqual(Object expected, Object actual) {
        if (expected instanceof Number && actual instanceof Number) {
            return ((Number) expected).doubleValue() == ((Number) actual).doubleValue();
        }
        if (expected instanceof Boolean && actual == null) {
            // an absent flag reads as false
            return !((Boolean) expected);
        }
        return Objects.equals(expected, actual);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source == null) {
            return copy;
        }
        for (Map.Entry<String, Object> entry : source.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Map) {
                value = deepCopy((Map<String, Object>) value);
            } else if (value instanceof List) {
                value = new ArrayList<>((List<Object>) value);
            }
            copy.put(entry.getKey(), value);
        }
        return copy;
    }

    @Override
    public String toString() {
        return conditions.toString();
    }

    public static final class Builder {
        private final Map<String, Object> conditions = new LinkedHashMap<>();

        public Builder eq(String path, Object value) {
            conditions.put(path, value);
            return this;
        }

        public PayloadFilter build() {
            return conditions.isEmpty() ? NONE : new PayloadFilter(new LinkedHashMap<>(conditions));
        }
    }
}
