package com.purchasingpower.memory.memory;

import com.purchasingpower.memory.configuration.MemoryProperties;
import com.purchasingpower.memory.core.Memory;
import com.purchasingpower.memory.core.MemoryType;
import com.purchasingpower.memory.storage.PayloadFilter;
import com.purchasingpower.memory.storage.VectorPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps memories to vector points and graph node properties.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class MemoryPointMapper {

    public static final String PROJECT_ID = "project_id";
    public static final String TYPE = "type";
    public static final String CONTENT = "content";
    public static final String METADATA = "metadata";
    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";
    public static final String DELETED = "deleted";

    private static final Set<String> RESERVED_NODE_KEYS = Set.of(
            "memory_id", PROJECT_ID, TYPE, CONTENT, CREATED_AT, UPDATED_AT, DELETED);

    private final MemoryProperties properties;

    /**
     * Active (not soft-deleted) memories of one project.
     */
    public static PayloadFilter activeFilter(String projectId) {
        return PayloadFilter.builder()
                .eq(PROJECT_ID, projectId)
                .eq(DELETED, false)
                .build();
    }

    public static PayloadFilter deletedFilter(String projectId) {
        return PayloadFilter.builder()
                .eq(PROJECT_ID, projectId)
                .eq(DELETED, true)
                .build();
    }

    public static PayloadFilter projectFilter(String projectId) {
        return PayloadFilter.builder().eq(PROJECT_ID, projectId).build();
    }

    public VectorPoint toPoint(Memory memory) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PROJECT_ID, memory.getProjectId());
        payload.put(TYPE, memory.getType().getWireName());
        payload.put(CONTENT, memory.getContent());
        payload.put(METADATA, memory.getMetadata() != null
                ? new LinkedHashMap<>(memory.getMetadata())
                : new LinkedHashMap<>());
        payload.put(CREATED_AT, memory.getCreatedAt().toString());
        payload.put(UPDATED_AT, memory.getUpdatedAt().toString());
        payload.put(DELETED, memory.isDeleted());

        return VectorPoint.builder()
                .id(memory.getId())
                .vector(memory.getVector() != null ? memory.getVector() : new ArrayList<>())
                .payload(payload)
                .build();
    }

    /**
     * @param fallbackType type of the collection the point was read from, used when the
     *                     payload has none
     */
    @SuppressWarnings("unchecked")
    public Memory toMemory(VectorPoint point, MemoryType fallbackType) {
        Map<String, Object> payload = point.getPayload();
        MemoryType type = MemoryType.find(asString(payload.get(TYPE))).orElse(fallbackType);
        Object metadata = payload.get(METADATA);

        return Memory.builder()
                .id(point.getId())
                .type(type)
                .content(asString(payload.get(CONTENT)))
                .metadata(metadata instanceof Map
                        ? new LinkedHashMap<>((Map<String, Object>) metadata)
                        : new LinkedHashMap<>())
                .vector(point.getVector())
                .projectId(asString(payload.get(PROJECT_ID)))
                .createdAt(parseInstant(payload.get(CREATED_AT)))
                .updatedAt(parseInstant(payload.get(UPDATED_AT)))
                .deleted(Boolean.TRUE.equals(payload.get(DELETED)))
                .build();
    }

    /**
     * Node properties for a graph-eligible memory: type, a content summary, and the scalar
     * metadata values (graph properties cannot hold nested maps).
     */
    public Map<String, Object> nodeProperties(Memory memory) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.putAll(graphMetadata(memory.getMetadata()));
        props.put(TYPE, memory.getType().getWireName());
        props.put(CONTENT, summarize(memory.getContent()));
        if (memory.getUpdatedAt() != null) {
            props.put(UPDATED_AT, memory.getUpdatedAt().toString());
        }
        return props;
    }

    public Map<String, Object> graphMetadata(Map<String, Object> metadata) {
        Map<String, Object> props = new LinkedHashMap<>();
        if (metadata == null) {
            return props;
        }
        for (Map.Entry<String, Object> entry : metadata.entrySet()) {
            if (RESERVED_NODE_KEYS.contains(entry.getKey())) {
                continue;
            }
            Object value = toGraphValue(entry.getValue());
            if (value != null) {
                props.put(entry.getKey(), value);
            }
        }
        return props;
    }

    public String summarize(String content) {
        int limit = properties.getIndexing().getContentSummaryLength();
        if (content == null || content.length() <= limit) {
            return content;
        }
        return content.substring(0, limit);
    }

    private static Object toGraphValue(Object value) {
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof List<?> list) {
            List<String> strings = new ArrayList<>();
            for (Object item : list) {
                if (item instanceof Map || item instanceof List) {
                    return null;
                }
                strings.add(String.valueOf(item));
            }
            return strings;
        }
        return null;
    }

    public static Instant parseInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value == null || value.toString().isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.toString());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
