package com.purchasingpower.memory.memory;

import com.purchasingpower.memory.core.MemoryType;

import java.util.EnumMap;
import java.util.Map;

import static com.purchasingpower.memory.core.MemoryType.ARCHITECTURE;
import static com.purchasingpower.memory.core.MemoryType.COMPONENT;
import static com.purchasingpower.memory.core.MemoryType.DESIGN;
import static com.purchasingpower.memory.core.MemoryType.FUNCTION;
import static com.purchasingpower.memory.core.MemoryType.REQUIREMENTS;
import static com.purchasingpower.memory.core.MemoryType.TEST_RESULT;

/**
 * Relationship label for an inferred edge from a new memory to a similar existing one.
 *
 * <p>Similarity inference on create only searches collections of other types, so same-type
 * rules such as component to component {@code DEPENDS_ON} never fire from that path.
 *
 * @since 1.0.0
 */
public final class RelationshipInference {

    public static final String DEFAULT_LABEL = "RELATED_TO";

    private static final Map<MemoryType, Map<MemoryType, String>> RULES = new EnumMap<>(MemoryType.class);

    static {
        rule(ARCHITECTURE, REQUIREMENTS, "GUIDES");
        rule(ARCHITECTURE, DESIGN, "GUIDES");
        rule(ARCHITECTURE, COMPONENT, "GUIDES");
        rule(DESIGN, REQUIREMENTS, "IMPLEMENTS");
        rule(REQUIREMENTS, DESIGN, "IMPLEMENTED_BY");
        rule(COMPONENT, DESIGN, "IMPLEMENTS");
        rule(DESIGN, COMPONENT, "IMPLEMENTED_BY");
        rule(FUNCTION, COMPONENT, "BELONGS_TO");
        rule(COMPONENT, FUNCTION, "CONTAINS");
        rule(TEST_RESULT, COMPONENT, "TESTS");
        rule(TEST_RESULT, REQUIREMENTS, "VERIFIES");
        rule(COMPONENT, TEST_RESULT, "TESTED_BY");
        rule(REQUIREMENTS, TEST_RESULT, "VERIFIED_BY");
        rule(COMPONENT, COMPONENT, "DEPENDS_ON");
    }

    private RelationshipInference() {
    }

    public static String infer(MemoryType source, MemoryType target) {
        Map<MemoryType, String> targets = RULES.get(source);
        if (targets == null) {
            return DEFAULT_LABEL;
        }
        return targets.getOrDefault(target, DEFAULT_LABEL);
    }

    private static void rule(MemoryType source, MemoryType target, String label) {
        RULES.computeIfAbsent(source, key -> new EnumMap<>(MemoryType.class)).put(target, label);
    }
}
