package com.purchasingpower.memory.memory.impl;

import com.purchasingpower.memory.configuration.MemoryProperties;
import com.purchasingpower.memory.core.Memory;
import com.purchasingpower.memory.core.MemoryDraft;
import com.purchasingpower.memory.core.MemoryType;
import com.purchasingpower.memory.core.ProjectIds;
import com.purchasingpower.memory.core.RelationshipRef;
import com.purchasingpower.memory.embedding.EmbeddingProvider;
import com.purchasingpower.memory.exception.MemoryConflictException;
import com.purchasingpower.memory.exception.MemoryNotFoundException;
import com.purchasingpower.memory.exception.MemoryValidationException;
import com.purchasingpower.memory.maintenance.TestResultRetentionService;
import com.purchasingpower.memory.memory.BulkCreateResult;
import com.purchasingpower.memory.memory.CreateResult;
import com.purchasingpower.memory.memory.GraphMirror;
import com.purchasingpower.memory.memory.MemoryPointMapper;
import com.purchasingpower.memory.memory.MemoryService;
import com.purchasingpower.memory.memory.MemoryUpdate;
import com.purchasingpower.memory.storage.VectorPoint;
import com.purchasingpower.memory.storage.VectorStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Default {@link MemoryService}: vector store first, graph second.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MemoryServiceImpl implements MemoryService {

    static final int MAX_CONTENT_LENGTH = 100_000;
    static final int MAX_BULK_SIZE = 100;

    private static final Pattern RELATIONSHIP_TYPE = Pattern.compile("^[A-Z][A-Z0-9_]{0,63}$");

    private final VectorStore vectorStore;
    private final EmbeddingProvider embeddingProvider;
    private final GraphMirror graphMirror;
    private final MemoryPointMapper mapper;
    private final TestResultRetentionService testResultRetention;
    private final MemoryProperties properties;
    private final Clock clock;

    @Override
    public CreateResult create(String projectId, MemoryDraft draft) {
        ProjectIds.requireValid(projectId);
        validateDraft(draft);
        validateRelationships(draft.getRelationships());

        MemoryType type = draft.getType();
        Map<String, Object> metadata = draft.getMetadata() != null
                ? new LinkedHashMap<>(draft.getMetadata())
                : new LinkedHashMap<>();

        Integer cleaned = null;
        if (type == MemoryType.TEST_RESULT) {
            cleaned = testResultRetention.cleanupOnWrite(projectId, metadata);
        }

        List<Float> vector = embeddingProvider.embed(draft.getContent());
        Instant now = clock.instant();
        Memory memory = Memory.builder()
                .id(UUID.randomUUID().toString())
                .type(type)
                .content(draft.getContent())
                .metadata(metadata)
                .vector(vector)
                .projectId(projectId)
                .createdAt(now)
                .updatedAt(now)
                .deleted(false)
                .build();

        vectorStore.upsert(memory.collectionName(), mapper.toPoint(memory));
        log.info("📝 Stored {} memory {} in {}", type.getWireName(), memory.getId(), memory.collectionName());

        Integer autoRelationships = null;
        if (type.isGraphEligible()) {
            autoRelationships = graphMirror.mirrorCreated(memory, draft.getRelationships());
        }

        return CreateResult.builder()
                .memoryId(memory.getId())
                .autoRelationships(autoRelationships)
                .oldTestResultsCleaned(cleaned)
                .build();
    }

    @Override
    public Memory get(String projectId, MemoryType type, String memoryId) {
        Memory memory = load(projectId, type, memoryId);
        if (memory.isDeleted()) {
            throw new MemoryNotFoundException(type.getWireName(), memoryId);
        }
        return memory;
    }

    @Override
    public Memory update(String projectId, MemoryType type, String memoryId, MemoryUpdate update) {
        Memory existing = load(projectId, type, memoryId);
        if (existing.isDeleted()) {
            throw new MemoryConflictException("Cannot update deleted memory: " + memoryId);
        }
        if (update.getContent() != null) {
            validateContent(update.getContent());
        }
        validateRelationships(update.getRelationships());

        Memory updated = existing.toBuilder()
                .metadata(new LinkedHashMap<>(existing.getMetadata()))
                .updatedAt(nextTimestamp(existing.getUpdatedAt()))
                .build();

        if (update.getContent() != null && !update.getContent().equals(existing.getContent())) {
            updated.setContent(update.getContent());
            updated.setVector(embeddingProvider.embed(update.getContent()));
            log.debug("Content of {} changed, re-embedded", memoryId);
        }
        if (update.getMetadata() != null) {
            updated.getMetadata().putAll(update.getMetadata());
        }

        vectorStore.upsert(updated.collectionName(), mapper.toPoint(updated));
        log.info("✏️  Updated {} memory {}", type.getWireName(), memoryId);

        if (type.isGraphEligible()) {
            graphMirror.updateNode(updated);
            if (update.getRelationships() != null) {
                graphMirror.replaceExplicit(updated, update.getRelationships(),
                        properties.getRelationships().getUpdatePolicy());
            }
        }
        return updated;
    }

    @Override
    public void delete(String projectId, MemoryType type, String memoryId, boolean hard) {
        Memory existing = load(projectId, type, memoryId);
        String collection = existing.collectionName();

        if (hard) {
            vectorStore.delete(collection, List.of(memoryId));
            if (type.isGraphEligible()) {
                graphMirror.remove(projectId, memoryId);
            }
            log.info("🗑️  Hard-deleted {} memory {}", type.getWireName(), memoryId);
            return;
        }

        if (existing.isDeleted()) {
            throw new MemoryConflictException("Memory already deleted: " + memoryId);
        }
        vectorStore.softDelete(projectId, collection, memoryId, nextTimestamp(existing.getUpdatedAt()));
        if (type.isGraphEligible()) {
            graphMirror.markDeleted(projectId, memoryId);
        }
        log.info("🗑️  Soft-deleted {} memory {}", type.getWireName(), memoryId);
    }

    @Override
    public BulkCreateResult bulkCreate(String projectId, List<MemoryDraft> drafts) {
        ProjectIds.requireValid(projectId);
        if (drafts == null || drafts.isEmpty() || drafts.size() > MAX_BULK_SIZE) {
            throw new MemoryValidationException("Bulk create takes 1 to " + MAX_BULK_SIZE + " memories");
        }
        drafts.forEach(this::validateDraft);

        Map<MemoryType, List<MemoryDraft>> byType = new EnumMap<>(MemoryType.class);
        for (MemoryDraft draft : drafts) {
            byType.computeIfAbsent(draft.getType(), key -> new ArrayList<>()).add(draft);
        }

        Instant now = clock.instant();
        List<String> ids = new ArrayList<>();
        for (Map.Entry<MemoryType, List<MemoryDraft>> group : byType.entrySet()) {
            MemoryType type = group.getKey();
            List<MemoryDraft> typed = group.getValue();
            List<List<Float>> vectors = embeddingProvider.embedBatch(
                    typed.stream().map(MemoryDraft::getContent).toList());

            List<VectorPoint> points = new ArrayList<>(typed.size());
            for (int i = 0; i < typed.size(); i++) {
                MemoryDraft draft = typed.get(i);
                Memory memory = Memory.builder()
                        .id(UUID.randomUUID().toString())
                        .type(type)
                        .content(draft.getContent())
                        .metadata(draft.getMetadata() != null
                                ? new LinkedHashMap<>(draft.getMetadata())
                                : new LinkedHashMap<>())
                        .vector(vectors.get(i))
                        .projectId(projectId)
                        .createdAt(now)
                        .updatedAt(now)
                        .build();
                points.add(mapper.toPoint(memory));
                ids.add(memory.getId());
            }
            vectorStore.upsertBatch(type.collectionName(projectId), points);
            log.info("📦 Bulk stored {} {} memories", points.size(), type.getWireName());
        }
        return new BulkCreateResult(ids);
    }

    private Memory load(String projectId, MemoryType type, String memoryId) {
        ProjectIds.requireValid(projectId);
        Objects.requireNonNull(type, "type");
        Optional<VectorPoint> point = vectorStore.get(projectId, type.collectionName(projectId), memoryId);
        return point.map(p -> mapper.toMemory(p, type))
                .orElseThrow(() -> new MemoryNotFoundException(type.getWireName(), memoryId));
    }

    /**
     * A mutation timestamp strictly after the previous one, even when the clock has not
     * moved on.
     */
    private Instant nextTimestamp(Instant previous) {
        Instant now = clock.instant();
        if (previous != null && !now.isAfter(previous)) {
            return previous.plusMillis(1);
        }
        return now;
    }

    private void validateDraft(MemoryDraft draft) {
        if (draft == null || draft.getType() == null) {
            throw new MemoryValidationException("Memory type is required");
        }
        validateContent(draft.getContent());
    }

    private void validateContent(String content) {
        if (content == null || content.isBlank()) {
            throw new MemoryValidationException("Content must not be empty");
        }
        if (content.length() > MAX_CONTENT_LENGTH) {
            throw new MemoryValidationException("Content exceeds " + MAX_CONTENT_LENGTH + " characters");
        }
    }

    private void validateRelationships(List<RelationshipRef> relationships) {
        if (relationships == null) {
            return;
        }
        for (RelationshipRef ref : relationships) {
            if (ref.getTargetId() == null || ref.getTargetId().isBlank()) {
                throw new MemoryValidationException("Relationship target id is required");
            }
            String type = ref.getType() != null ? ref.getType().trim().toUpperCase(Locale.ROOT) : "";
            if (!RELATIONSHIP_TYPE.matcher(type).matches()) {
                throw new MemoryValidationException("Invalid relationship type: " + ref.getType());
            }
        }
    }
}
