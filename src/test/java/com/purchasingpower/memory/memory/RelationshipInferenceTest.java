package com.purchasingpower.memory.memory;

import com.purchasingpower.memory.core.MemoryType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RelationshipInferenceTest {

    @Test
    @DisplayName("Known type pairs get their specific label")
    void knownPairs() {
        assertThat(RelationshipInference.infer(MemoryType.DESIGN, MemoryType.REQUIREMENTS)).isEqualTo("IMPLEMENTS");
        assertThat(RelationshipInference.infer(MemoryType.REQUIREMENTS, MemoryType.DESIGN)).isEqualTo("IMPLEMENTED_BY");
        assertThat(RelationshipInference.infer(MemoryType.ARCHITECTURE, MemoryType.COMPONENT)).isEqualTo("GUIDES");
        assertThat(RelationshipInference.infer(MemoryType.FUNCTION, MemoryType.COMPONENT)).isEqualTo("BELONGS_TO");
        assertThat(RelationshipInference.infer(MemoryType.TEST_RESULT, MemoryType.REQUIREMENTS)).isEqualTo("VERIFIES");
        assertThat(RelationshipInference.infer(MemoryType.COMPONENT, MemoryType.COMPONENT)).isEqualTo("DEPENDS_ON");
    }

    @Test
    @DisplayName("Any other pair falls back to RELATED_TO")
    void fallback() {
        assertThat(RelationshipInference.infer(MemoryType.FUNCTION, MemoryType.DESIGN))
                .isEqualTo(RelationshipInference.DEFAULT_LABEL)
                .isEqualTo("RELATED_TO");
        assertThat(RelationshipInference.infer(MemoryType.SESSION, MemoryType.DESIGN)).isEqualTo("RELATED_TO");
    }
}
