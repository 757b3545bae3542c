package com.purchasingpower.memory.transfer.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.memory.configuration.MemoryProperties;
import com.purchasingpower.memory.core.Memory;
import com.purchasingpower.memory.core.MemoryType;
import com.purchasingpower.memory.core.ProjectIds;
import com.purchasingpower.memory.exception.MemoryServiceException;
import com.purchasingpower.memory.memory.GraphMirror;
import com.purchasingpower.memory.memory.MemoryPointMapper;
import com.purchasingpower.memory.storage.PayloadFilter;
import com.purchasingpower.memory.storage.VectorPoint;
import com.purchasingpower.memory.storage.VectorStore;
import com.purchasingpower.memory.embedding.EmbeddingProvider;
import com.purchasingpower.memory.transfer.ExportImportService;
import com.purchasingpower.memory.transfer.ExportRecord;
import com.purchasingpower.memory.transfer.ExportRequest;
import com.purchasingpower.memory.transfer.ImportConflictPolicy;
import com.purchasingpower.memory.transfer.ImportResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Jackson-based JSONL transfer. Records are streamed line by line in both directions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JsonlExportImportService implements ExportImportService {

    static final String META_KEY = "_meta";

    private final VectorStore vectorStore;
    private final EmbeddingProvider embeddingProvider;
    private final GraphMirror graphMirror;
    private final MemoryPointMapper mapper;
    private final MemoryProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public int exportMemories(String projectId, ExportRequest request, OutputStream output) {
        ProjectIds.requireValid(projectId);
        List<MemoryType> types = request.getTypes() == null || request.getTypes().isEmpty()
                ? MemoryType.all()
                : request.getTypes();
        PayloadFilter filter = request.isIncludeDeleted()
                ? MemoryPointMapper.projectFilter(projectId)
                : MemoryPointMapper.activeFilter(projectId);

        int exported = 0;
        try {
            Writer writer = new BufferedWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("exportedAt", clock.instant().toString());
            meta.put("projectId", projectId);
            meta.put("types", types.stream().map(MemoryType::getWireName).toList());
            meta.put("version", FORMAT_VERSION);
            writeLine(writer, Map.of(META_KEY, meta));

            for (MemoryType type : types) {
                List<VectorPoint> points = vectorStore.scrollAll(type.collectionName(projectId), filter,
                        properties.getNormalization().getScrollPageSize());
                for (VectorPoint point : points) {
                    Memory memory = mapper.toMemory(point, type);
                    writeLine(writer, ExportRecord.builder()
                            .memoryId(memory.getId())
                            .type(type.getWireName())
                            .content(memory.getContent())
                            .metadata(memory.getMetadata())
                            .createdAt(memory.getCreatedAt() != null ? memory.getCreatedAt().toString() : null)
                            .updatedAt(memory.getUpdatedAt() != null ? memory.getUpdatedAt().toString() : null)
                            .deleted(memory.isDeleted())
                            .projectId(memory.getProjectId())
                            .build());
                    exported++;
                }
            }
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Export of " + projectId + " failed", e);
        }

        log.info("📤 Exported {} memories of {} ({} types)", exported, projectId, types.size());
        return exported;
    }

    private void writeLine(Writer writer, Object value) throws IOException {
        writer.write(objectMapper.writeValueAsString(value));
        writer.write('\n');
    }

    @Override
    public ImportResult importMemories(String projectId, InputStream input, ImportConflictPolicy policy) {
        ProjectIds.requireValid(projectId);
        ImportResult result = new ImportResult();

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                importLine(projectId, line, lineNumber, policy, result);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Import into " + projectId + " failed", e);
        }

        log.info("📥 Import into {}: {} imported, {} skipped, {} failed", projectId,
                result.getImported(), result.getSkipped(), result.getFailed());
        return result;
    }

    private void importLine(String projectId, String line, int lineNumber, ImportConflictPolicy policy,
                            ImportResult result) {
        ExportRecord record;
        try {
            JsonNode node = objectMapper.readTree(line);
            if (node.has(META_KEY)) {
                return;
            }
            record = objectMapper.treeToValue(node, ExportRecord.class);
        } catch (JsonProcessingException e) {
            result.recordFailure("Line " + lineNumber + ": invalid JSON: " + e.getOriginalMessage());
            return;
        }

        MemoryType type = MemoryType.find(record.getType()).orElse(null);
        if (type == null) {
            result.recordFailure("Line " + lineNumber + ": unknown memory type: " + record.getType());
            return;
        }
        if (record.getContent() == null || record.getContent().isBlank()) {
            result.recordFailure("Line " + lineNumber + ": content is empty");
            return;
        }

        String memoryId = record.getMemoryId() != null && !record.getMemoryId().isBlank()
                ? record.getMemoryId()
                : UUID.randomUUID().toString();
        String collection = type.collectionName(projectId);

        try {
            if (vectorStore.get(projectId, collection, memoryId).isPresent()) {
                switch (policy) {
                    case SKIP -> {
                        result.recordSkipped();
                        return;
                    }
                    case ERROR -> {
                        result.recordFailure("Memory already exists: " + memoryId);
                        return;
                    }
                    case OVERWRITE -> log.debug("Overwriting {} from line {}", memoryId, lineNumber);
                }
            }

            Instant now = clock.instant();
            Instant createdAt = MemoryPointMapper.parseInstant(record.getCreatedAt());
            Memory memory = Memory.builder()
                    .id(memoryId)
                    .type(type)
                    .content(record.getContent())
                    .metadata(record.getMetadata() != null
                            ? new LinkedHashMap<>(record.getMetadata())
                            : new LinkedHashMap<>())
                    .vector(embeddingProvider.embed(record.getContent()))
                    .projectId(projectId)
                    .createdAt(createdAt != null ? createdAt : now)
                    .updatedAt(now)
                    .deleted(false)
                    .build();

            vectorStore.upsert(collection, mapper.toPoint(memory));
            if (type.isGraphEligible()) {
                graphMirror.createNode(memory);
            }
            result.recordImported();
        } catch (MemoryServiceException e) {
            result.recordFailure("Failed to import memory: " + e.getMessage());
        }
    }
}
