package com.purchasingpower.memory.storage.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.protobuf.ListValue;
import com.google.protobuf.NullValue;
import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import com.purchasingpower.memory.exception.MemoryValidationException;
import com.purchasingpower.memory.storage.PayloadFilter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts payload maps to and from Pinecone metadata {@link Struct}s.
 *
 * <p>Pinecone metadata is flat, so the nested {@code metadata} map is stored twice: as a JSON
 * string ({@code metadata_json}) for lossless round-trips, and as one {@code meta_<key>}
 * field per scalar value so equality filters on {@code metadata.<key>} run server-side.
 */
@Slf4j
class PineconePayloadCodec {

    static final String METADATA = "metadata";
    static final String METADATA_JSON = "metadata_json";
    static final String FLAT_PREFIX = "meta_";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    PineconePayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @SuppressWarnings("unchecked")
    Struct encode(Map<String, Object> payload) {
        Struct.Builder builder = Struct.newBuilder();
        for (Map.Entry<String, Object> entry : payload.entrySet()) {
            if (METADATA.equals(entry.getKey()) && entry.getValue() instanceof Map) {
                Map<String, Object> metadata = (Map<String, Object>) entry.getValue();
                builder.putFields(METADATA_JSON, stringValue(writeJson(metadata)));
                for (Map.Entry<String, Object> meta : metadata.entrySet()) {
                    if (isScalar(meta.getValue())) {
                        builder.putFields(FLAT_PREFIX + meta.getKey(), toValue(meta.getValue()));
                    }
                }
            } else if (entry.getValue() != null) {
                builder.putFields(entry.getKey(), toValue(entry.getValue()));
            }
        }
        return builder.build();
    }

    Map<String, Object> decode(Struct struct) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (struct == null) {
            return payload;
        }
        for (Map.Entry<String, Value> field : struct.getFieldsMap().entrySet()) {
            String key = field.getKey();
            if (key.startsWith(FLAT_PREFIX)) {
                continue;
            }
            if (METADATA_JSON.equals(key)) {
                payload.put(METADATA, readJson(field.getValue().getStringValue()));
            } else {
                payload.put(key, fromValue(field.getValue()));
            }
        }
        payload.putIfAbsent(METADATA, new LinkedHashMap<>());
        return payload;
    }

    /**
     * Builds a Pinecone filter, e.g. {@code {"project_id": {"$eq": "demo"}}}.
     */
    Struct encodeFilter(PayloadFilter filter) {
        if (filter == null || filter.isEmpty()) {
            return null;
        }
        Struct.Builder builder = Struct.newBuilder();
        for (Map.Entry<String, Object> condition : filter.conditions().entrySet()) {
            builder.putFields(fieldName(condition.getKey()), Value.newBuilder()
                    .setStructValue(Struct.newBuilder()
                            .putFields("$eq", toValue(condition.getValue()))
                            .build())
                    .build());
        }
        return builder.build();
    }

    static String fieldName(String path) {
        if (path.startsWith(METADATA + ".")) {
            return FLAT_PREFIX + path.substring(METADATA.length() + 1);
        }
        return path;
    }

    private static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    private Value toValue(Object value) {
        if (value == null) {
            return Value.newBuilder().setNullValue(NullValue.NULL_VALUE).build();
        }
        if (value instanceof Boolean) {
            return Value.newBuilder().setBoolValue((Boolean) value).build();
        }
        if (value instanceof Number) {
            return Value.newBuilder().setNumberValue(((Number) value).doubleValue()).build();
        }
        if (value instanceof List<?> list) {
            ListValue.Builder listBuilder = ListValue.newBuilder();
            for (Object item : list) {
                listBuilder.addValues(stringValue(String.valueOf(item)));
            }
            return Value.newBuilder().setListValue(listBuilder.build()).build();
        }
        if (value instanceof Map) {
            return stringValue(writeJson(value));
        }
        return stringValue(value.toString());
    }

    private Object fromValue(Value value) {
        switch (value.getKindCase()) {
            case BOOL_VALUE:
                return value.getBoolValue();
            case NUMBER_VALUE:
                double number = value.getNumberValue();
                if (number == Math.rint(number) && Math.abs(number) < Long.MAX_VALUE) {
                    return (long) number;
                }
                return number;
            case STRING_VALUE:
                return value.getStringValue();
            case LIST_VALUE:
                List<Object> items = new ArrayList<>();
                for (Value item : value.getListValue().getValuesList()) {
                    items.add(fromValue(item));
                }
                return items;
            case STRUCT_VALUE:
                return decode(value.getStructValue());
            default:
                return null;
        }
    }

    private static Value stringValue(String text) {
        return Value.newBuilder().setStringValue(text).build();
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new MemoryValidationException("Metadata is not serializable: " + e.getOriginalMessage());
        }
    }

    private Map<String, Object> readJson(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("⚠️  Unreadable metadata_json, returning empty metadata: {}", e.getOriginalMessage());
            return new LinkedHashMap<>();
        }
    }
}
