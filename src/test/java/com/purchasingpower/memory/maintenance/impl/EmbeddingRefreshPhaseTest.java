package com.purchasingpower.memory.maintenance.impl;

import com.purchasingpower.memory.core.MemoryType;
import com.purchasingpower.memory.exception.StoreUnavailableException;
import com.purchasingpower.memory.maintenance.PhaseResult;
import com.purchasingpower.memory.memory.MemoryPointMapper;
import com.purchasingpower.memory.storage.VectorPoint;
import com.purchasingpower.memory.storage.VectorStore;
import com.purchasingpower.memory.support.HashingEmbeddingProvider;
import com.purchasingpower.memory.support.MemoryFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.purchasingpower.memory.support.MemoryFixture.PROJECT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class EmbeddingRefreshPhaseTest {

    private MemoryFixture fixture;
    private EmbeddingRefreshPhase phase;

    @BeforeEach
    void setUp() {
        fixture = new MemoryFixture();
        phase = new EmbeddingRefreshPhase(fixture.vectorStore, fixture.embeddings, fixture.properties, fixture.clock);
    }

    private VectorPoint point(MemoryType type, String id) {
        return fixture.vectorStore.raw(type.collectionName(PROJECT), id);
    }

    @Test
    @DisplayName("Zero and near-constant vectors are re-embedded, healthy ones untouched")
    void refreshesPlaceholders() {
        // Given
        String zeros = fixture.create(MemoryType.SESSION, "zero vector note");
        String flat = fixture.create(MemoryType.SESSION, "flat vector note");
        String healthy = fixture.create(MemoryType.SESSION, "healthy vector note");
        point(MemoryType.SESSION, zeros).setVector(HashingEmbeddingProvider.zeros());
        point(MemoryType.SESSION, flat).setVector(new ArrayList<>(Collections.nCopies(64, 0.125f)));
        List<Float> healthyVector = new ArrayList<>(point(MemoryType.SESSION, healthy).getVector());
        fixture.clock.advance(Duration.ofHours(2));

        // When
        PhaseResult result = phase.run(PROJECT, false);

        // Then
        assertThat(result.getCount()).isEqualTo(2);
        assertThat(result.getDetails()).containsExactly("session: 2 embeddings to refresh");
        assertThat(point(MemoryType.SESSION, zeros).getVector())
                .isEqualTo(fixture.embeddings.embed("zero vector note"));
        assertThat(point(MemoryType.SESSION, flat).getPayload())
                .containsEntry(MemoryPointMapper.UPDATED_AT, fixture.clock.instant().toString());
        assertThat(point(MemoryType.SESSION, healthy).getVector()).isEqualTo(healthyVector);
        assertThat(phase.run(PROJECT, true).getDetails()).containsExactly("No embeddings need refresh");
    }

    @Test
    @DisplayName("Dry run leaves vectors as they are")
    void dryRun() {
        String id = fixture.create(MemoryType.DESIGN, "placeholder design");
        point(MemoryType.DESIGN, id).setVector(new ArrayList<>());

        PhaseResult result = phase.run(PROJECT, true);

        assertThat(result.getCount()).isEqualTo(1);
        assertThat(point(MemoryType.DESIGN, id).getVector()).isEmpty();
    }

    @Test
    @DisplayName("Variance below epsilon marks a vector for refresh")
    void needsRefresh() {
        assertThat(EmbeddingRefreshPhase.needsRefresh(null, 0.001)).isTrue();
        assertThat(EmbeddingRefreshPhase.needsRefresh(List.of(), 0.001)).isTrue();
        assertThat(EmbeddingRefreshPhase.needsRefresh(List.of(0f, 0f, 0f), 0.001)).isTrue();
        assertThat(EmbeddingRefreshPhase.needsRefresh(List.of(0.5f, 0.5f, 0.5f), 0.001)).isTrue();
        assertThat(EmbeddingRefreshPhase.needsRefresh(List.of(1f, 0f, 0f), 0.001)).isFalse();
    }

    @Test
    @DisplayName("An unreadable collection is reported and the remaining types are still refreshed")
    void unreadableCollection() {
        // Given
        String session = fixture.create(MemoryType.SESSION, "zero vector note");
        point(MemoryType.SESSION, session).setVector(HashingEmbeddingProvider.zeros());
        VectorStore store = spy(fixture.vectorStore);
        doThrow(new StoreUnavailableException("Pinecone", "boom", new RuntimeException("503")))
                .when(store).scrollAll(eq(MemoryType.DESIGN.collectionName(PROJECT)), any(), anyInt());
        EmbeddingRefreshPhase failing =
                new EmbeddingRefreshPhase(store, fixture.embeddings, fixture.properties, fixture.clock);

        // When
        PhaseResult result = failing.run(PROJECT, false);

        // Then
        assertThat(result.getCount()).isEqualTo(1);
        assertThat(result.getDetails()).containsExactlyInAnyOrder(
                "design: Pinecone unavailable: boom",
                "session: 1 embeddings to refresh");
        assertThat(point(MemoryType.SESSION, session).getVector())
                .isEqualTo(fixture.embeddings.embed("zero vector note"));
    }
}
