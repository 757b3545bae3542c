package com.purchasingpower.memory.maintenance.impl;

import com.purchasingpower.memory.core.MemoryType;
import com.purchasingpower.memory.maintenance.NormalizationPhase;
import com.purchasingpower.memory.maintenance.PhaseResult;
import com.purchasingpower.memory.support.MemoryFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.purchasingpower.memory.support.HashingEmbeddingProvider.axis;
import static com.purchasingpower.memory.support.HashingEmbeddingProvider.tilted;
import static com.purchasingpower.memory.support.MemoryFixture.PROJECT;
import static org.assertj.core.api.Assertions.assertThat;

class DedupPhaseTest {

    private MemoryFixture fixture;
    private DedupPhase phase;
    private String original;
    private String nearCopy;
    private String distinct;

    @BeforeEach
    void setUp() {
        fixture = new MemoryFixture();
        phase = new DedupPhase(fixture.vectorStore, fixture.memoryService, fixture.properties);

        fixture.embeddings.register("Use PostgreSQL for orders", axis(2));
        fixture.embeddings.register("Orders live in PostgreSQL", tilted(2, 3, 0.97));
        fixture.embeddings.register("Use S3 for invoices", axis(30));
        original = fixture.create(MemoryType.DESIGN, "Use PostgreSQL for orders");
        nearCopy = fixture.create(MemoryType.DESIGN, "Orders live in PostgreSQL");
        distinct = fixture.create(MemoryType.DESIGN, "Use S3 for invoices");
    }

    @Test
    @DisplayName("Dry run reports duplicates without deleting them")
    void dryRun() {
        PhaseResult result = phase.run(PROJECT, true);

        assertThat(result.getPhase()).isEqualTo(NormalizationPhase.DEDUP);
        assertThat(result.getCount()).isEqualTo(1);
        assertThat(result.getDetails()).containsExactly("design: 1 potential duplicates found");
        assertThat(fixture.load(MemoryType.DESIGN, nearCopy).isDeleted()).isFalse();
    }

    @Test
    @DisplayName("The first memory visited survives and its duplicates are soft-deleted")
    void removesDuplicates() {
        // When
        PhaseResult dry = phase.run(PROJECT, true);
        PhaseResult result = phase.run(PROJECT, false);

        // Then
        assertThat(result.getCount()).isEqualTo(dry.getCount());
        assertThat(fixture.load(MemoryType.DESIGN, original).isDeleted()).isFalse();
        assertThat(fixture.load(MemoryType.DESIGN, nearCopy).isDeleted()).isTrue();
        assertThat(fixture.load(MemoryType.DESIGN, distinct).isDeleted()).isFalse();
        assertThat(fixture.graphStore.node(PROJECT, nearCopy).properties()).containsEntry("deleted", true);
    }

    @Test
    @DisplayName("A second run finds nothing left to merge")
    void idempotent() {
        phase.run(PROJECT, false);

        PhaseResult second = phase.run(PROJECT, false);

        assertThat(second.getCount()).isZero();
        assertThat(second.getDetails()).containsExactly("No duplicates found");
    }

    @Test
    @DisplayName("Similar memories of different types are not duplicates")
    void sameTypeOnly() {
        fixture.embeddings.register("PostgreSQL holds orders", axis(2));
        fixture.create(MemoryType.REQUIREMENTS, "PostgreSQL holds orders");
        fixture.memoryService.delete(PROJECT, MemoryType.DESIGN, nearCopy, true);

        PhaseResult result = phase.run(PROJECT, true);

        assertThat(result.getCount()).isZero();
    }

    @Test
    @DisplayName("A cluster larger than the search limit collapses to one memory in a single run")
    void clusterLargerThanSearchLimit() {
        // Given
        fixture.memoryService.delete(PROJECT, MemoryType.DESIGN, nearCopy, true);
        int size = fixture.properties.getNormalization().getDuplicateSearchLimit() + 2;
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            String text = "Standup notes, day " + i;
            fixture.embeddings.register(text, axis(2));
            ids.add(fixture.create(MemoryType.SESSION, text));
        }

        // When
        PhaseResult first = phase.run(PROJECT, false);
        PhaseResult second = phase.run(PROJECT, false);

        // Then
        assertThat(first.getCount()).isEqualTo(size - 1);
        assertThat(first.getDetails()).contains("session: " + (size - 1) + " potential duplicates found");
        assertThat(second.getCount()).isZero();
        assertThat(ids).filteredOn(id -> !fixture.load(MemoryType.SESSION, id).isDeleted()).hasSize(1);
    }
}
