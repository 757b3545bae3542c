package com.purchasingpower.memory.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.purchasingpower.memory.exception.MemoryValidationException;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Kinds of project knowledge a memory can hold.
 *
 * <p>The wire name is used for collection naming ({@code {projectId}_{wireName}}),
 * payloads and the REST surface. Graph-eligible types are mirrored as nodes in the
 * graph store, labelled with the capitalized wire name.
 *
 * @since 1.0.0
 */
public enum MemoryType {
    REQUIREMENTS("requirements", true),
    DESIGN("design", true),
    ARCHITECTURE("architecture", true),
    CODE_PATTERN("code_pattern", false),
    COMPONENT("component", true),
    FUNCTION("function", true),
    TEST_RESULT("test_result", true),
    TEST_HISTORY("test_history", false),
    SESSION("session", false),
    USER_PREFERENCE("user_preference", false);

    private final String wireName;
    private final boolean graphEligible;

    MemoryType(String wireName, boolean graphEligible) {
        this.wireName = wireName;
        this.graphEligible = graphEligible;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isGraphEligible() {
        return graphEligible;
    }

    /**
     * Graph label, e.g. {@code Requirements} or {@code Test_result}.
     */
    public String getGraphLabel() {
        return Character.toUpperCase(wireName.charAt(0)) + wireName.substring(1);
    }

    public String collectionName(String projectId) {
        return projectId + "_" + wireName;
    }

    public static Set<MemoryType> graphEligibleTypes() {
        EnumSet<MemoryType> eligible = EnumSet.noneOf(MemoryType.class);
        for (MemoryType type : values()) {
            if (type.graphEligible) {
                eligible.add(type);
            }
        }
        return eligible;
    }

    public static List<MemoryType> all() {
        return Arrays.asList(values());
    }

    public static Optional<MemoryType> find(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        String normalized = wireName.trim().toLowerCase(Locale.ROOT);
        for (MemoryType type : values()) {
            if (type.wireName.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static MemoryType fromWireName(String wireName) {
        return find(wireName).orElseThrow(() ->
                new MemoryValidationException("Unknown memory type: " + wireName));
    }
}
