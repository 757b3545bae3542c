package com.purchasingpower.memory.storage;

import com.purchasingpower.memory.exception.QueryRejectedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReadOnlyQueryGuardTest {

    @Test
    @DisplayName("Reads mentioning created_at and deleted properties pass")
    void propertyNamesContainingKeywordsPass() {
        String cypher = "MATCH (n:Design) WHERE n.deleted = false RETURN n.created_at ORDER BY n.created_at";

        assertThat(ReadOnlyQueryGuard.check(cypher)).isEqualTo(cypher);
    }

    @Test
    @DisplayName("Keywords inside string literals are ignored")
    void keywordsInLiteralsPass() {
        assertThat(ReadOnlyQueryGuard.check("OPTIONAL MATCH (n) WHERE n.content = 'create and delete' RETURN n"))
                .isNotNull();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "MATCH (n) DETACH DELETE n",
            "MATCH (n) SET n.deleted = true",
            "MATCH (a), (b) CREATE (a)-[:X]->(b)",
            "MATCH (n) CALL db.labels() YIELD label RETURN label",
            "match (n) merge (m:Copy) return m"
    })
    @DisplayName("Mutating statements are rejected")
    void writesRejected(String cypher) {
        assertThatThrownBy(() -> ReadOnlyQueryGuard.check(cypher))
                .isInstanceOf(QueryRejectedException.class)
                .hasMessageContaining("not allowed");
    }

    @Test
    @DisplayName("Statements must start with MATCH")
    void mustStartWithMatch() {
        assertThatThrownBy(() -> ReadOnlyQueryGuard.check("RETURN 1"))
                .isInstanceOf(QueryRejectedException.class)
                .hasMessage("Only MATCH queries are allowed");
        assertThatThrownBy(() -> ReadOnlyQueryGuard.check("  "))
                .isInstanceOf(QueryRejectedException.class);
    }
}
