package com.purchasingpower.memory.indexing.impl;

import com.purchasingpower.memory.configuration.AsyncConfig;
import com.purchasingpower.memory.configuration.IndexingProperties;
import com.purchasingpower.memory.configuration.MemoryProperties;
import com.purchasingpower.memory.core.MemoryDraft;
import com.purchasingpower.memory.core.MemoryType;
import com.purchasingpower.memory.core.ProjectIds;
import com.purchasingpower.memory.exception.JobNotFoundException;
import com.purchasingpower.memory.exception.MemoryServiceException;
import com.purchasingpower.memory.exception.MemoryValidationException;
import com.purchasingpower.memory.exception.PathNotFoundException;
import com.purchasingpower.memory.indexing.CodeIndexingService;
import com.purchasingpower.memory.indexing.IndexFileResult;
import com.purchasingpower.memory.indexing.IndexingJob;
import com.purchasingpower.memory.indexing.LanguageDetector;
import com.purchasingpower.memory.indexing.PathPatterns;
import com.purchasingpower.memory.indexing.extract.ExtractedFunction;
import com.purchasingpower.memory.indexing.extract.ExtractionOptions;
import com.purchasingpower.memory.indexing.extract.ExtractorRegistry;
import com.purchasingpower.memory.indexing.extract.LanguageExtractor;
import com.purchasingpower.memory.jobs.JobStore;
import com.purchasingpower.memory.jobs.JobSubmission;
import com.purchasingpower.memory.memory.MemoryPointMapper;
import com.purchasingpower.memory.memory.MemoryService;
import com.purchasingpower.memory.storage.PayloadFilter;
import com.purchasingpower.memory.storage.VectorPoint;
import com.purchasingpower.memory.storage.VectorStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Indexes files into {@code code_pattern} and {@code function} memories through the
 * {@link MemoryService}, so function memories get graph nodes and inferred edges like any
 * other write.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class CodeIndexingServiceImpl implements CodeIndexingService {

    private final MemoryService memoryService;
    private final VectorStore vectorStore;
    private final ExtractorRegistry extractors;
    private final JobStore<IndexingJob> jobStore;
    private final MemoryProperties properties;
    private final Executor executor;
    private final Clock clock;

    public CodeIndexingServiceImpl(MemoryService memoryService,
                                   VectorStore vectorStore,
                                   ExtractorRegistry extractors,
                                   JobStore<IndexingJob> jobStore,
                                   MemoryProperties properties,
                                   @Qualifier(AsyncConfig.JOB_EXECUTOR) Executor executor,
                                   Clock clock) {
        this.memoryService = memoryService;
        this.vectorStore = vectorStore;
        this.extractors = extractors;
        this.jobStore = jobStore;
        this.properties = properties;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public IndexFileResult indexFile(String projectId, String path, String language, String targetClass) {
        ProjectIds.requireValid(projectId);
        Path file = resolve(path);
        if (!Files.isRegularFile(file)) {
            throw new PathNotFoundException("File not found: " + path);
        }
        return indexResolvedFile(projectId, file, language, targetClass);
    }

    private IndexFileResult indexResolvedFile(String projectId, Path file, String language, String targetClass) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
        String content = new String(bytes, StandardCharsets.UTF_8);
        if (content.isBlank()) {
            throw new MemoryValidationException("File is empty: " + file);
        }

        String filePath = file.toString();
        String resolvedLanguage = language != null && !language.isBlank()
                ? language.trim().toLowerCase(Locale.ROOT)
                : LanguageDetector.detect(file).orElse(null);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("file_path", filePath);
        if (resolvedLanguage != null) {
            metadata.put("language", resolvedLanguage);
        }
        metadata.put("size_bytes", bytes.length);
        metadata.put("indexed_at", clock.instant().toString());

        String memoryId = memoryService.create(projectId, MemoryDraft.builder()
                .type(MemoryType.CODE_PATTERN)
                .content(content)
                .metadata(metadata)
                .build()).getMemoryId();

        int stale = 0;
        int indexed = 0;
        Optional<LanguageExtractor> extractor = extractors.find(resolvedLanguage);
        if (properties.getIndexing().isExtractFunctions() && extractor.isPresent()) {
            List<ExtractedFunction> functions = extractor.get()
                    .extract(content, new ExtractionOptions(targetClass));
            stale = removeStaleFunctions(projectId, filePath);
            for (ExtractedFunction function : functions) {
                memoryService.create(projectId, MemoryDraft.builder()
                        .type(MemoryType.FUNCTION)
                        .content(function.getBody())
                        .metadata(functionMetadata(function, filePath, resolvedLanguage))
                        .build());
                indexed++;
            }
        }

        log.info("📄 Indexed {} ({}): {} functions, {} stale removed",
                filePath, resolvedLanguage, indexed, stale);
        return IndexFileResult.builder()
                .memoryId(memoryId)
                .filePath(filePath)
                .language(resolvedLanguage)
                .functionsIndexed(indexed)
                .staleFunctionsRemoved(stale)
                .build();
    }

    /**
     * Soft-deletes every active function memory recorded for {@code filePath}.
     */
    private int removeStaleFunctions(String projectId, String filePath) {
        PayloadFilter filter = MemoryPointMapper.activeFilter(projectId).and("metadata.file_path", filePath);
        List<VectorPoint> stale = vectorStore.scrollAll(MemoryType.FUNCTION.collectionName(projectId), filter,
                properties.getNormalization().getScrollPageSize());
        for (VectorPoint point : stale) {
            memoryService.delete(projectId, MemoryType.FUNCTION, point.getId(), false);
        }
        if (!stale.isEmpty()) {
            log.debug("Removed {} stale functions of {}", stale.size(), filePath);
        }
        return stale.size();
    }

    private static Map<String, Object> functionMetadata(ExtractedFunction function, String filePath, String language) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("file_path", filePath);
        metadata.put("language", language);
        metadata.put("function_name", function.getName());
        metadata.put("start_line", function.getStartLine());
        metadata.put("end_line", function.getEndLine());
        metadata.put("signature", function.getSignature());
        metadata.put("is_async", function.isAsync());
        metadata.put("is_method", function.isMethod());
        if (function.getClassName() != null) {
            metadata.put("class_name", function.getClassName());
        }
        return metadata;
    }

    @Override
    public JobSubmission indexDirectory(String projectId, String path, List<String> includePatterns,
                                        List<String> excludePatterns) {
        ProjectIds.requireValid(projectId);
        Path root = resolve(path);
        if (!Files.isDirectory(root)) {
            throw new PathNotFoundException("Directory not found: " + path);
        }

        IndexingProperties indexing = properties.getIndexing();
        List<String> includes = includePatterns != null && !includePatterns.isEmpty()
                ? List.copyOf(includePatterns) : List.copyOf(indexing.getIncludePatterns());
        List<String> excludes = excludePatterns != null
                ? List.copyOf(excludePatterns) : List.copyOf(indexing.getExcludePatterns());

        IndexingJob job = new IndexingJob(UUID.randomUUID().toString(), projectId, root.toString(), clock.instant());
        jobStore.put(job);
        log.info("🚀 Indexing job {} queued for {}", job.getId(), root);

        CompletableFuture.runAsync(() -> runJob(job, root, includes, excludes), executor);
        return JobSubmission.pending(job.getId());
    }

    private void runJob(IndexingJob job, Path root, List<String> includes, List<String> excludes) {
        try {
            List<Path> files = collectFiles(root, includes, excludes, job);
            job.start(files.size());
            log.info("📂 Indexing job {}: {} files under {}", job.getId(), files.size(), root);

            for (Path file : files) {
                if (job.isCancelled()) {
                    log.info("⏹️  Indexing job {} cancelled after {} files", job.getId(), job.getFilesProcessed());
                    return;
                }
                try {
                    IndexFileResult result = indexResolvedFile(job.getProjectId(), file, null, null);
                    job.fileDone(result.getFunctionsIndexed());
                } catch (MemoryServiceException | UncheckedIOException e) {
                    log.warn("⚠️  Indexing job {}: {} failed: {}", job.getId(), file, e.getMessage());
                    job.fileFailed(root.relativize(file).toString(), e.getMessage());
                }
            }
            job.complete(clock.instant());
            log.info("✅ Indexing job {} complete: {} files, {} functions, {} errors", job.getId(),
                    job.getFilesProcessed(), job.getFunctionsIndexed(), job.getErrors().size());
        } catch (RuntimeException e) {
            log.error("❌ Indexing job {} failed: {}", job.getId(), e.getMessage(), e);
            job.fail(e.getMessage(), clock.instant());
        }
    }

    /**
     * Walks {@code root}, pruning excluded directories, and returns the included files in
     * walk order.
     */
    List<Path> collectFiles(Path root, List<String> includes, List<String> excludes, IndexingJob job) {
        List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && PathPatterns.matchesAny(relative(root, dir), excludes)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    String relativePath = relative(root, file);
                    if (attrs.isRegularFile()
                            && !PathPatterns.matchesAny(relativePath, excludes)
                            && PathPatterns.matchesAny(relativePath, includes)) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    job.getErrors().add(relative(root, file) + ": " + e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot walk " + root, e);
        }
        return files;
    }

    private static String relative(Path root, Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }

    @Override
    public IndexingJob getJob(String jobId) {
        return jobStore.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @Override
    public IndexingJob cancel(String jobId) {
        IndexingJob job = getJob(jobId);
        if (job.cancel(clock.instant())) {
            log.info("⏹️  Indexing job {} cancellation requested", jobId);
        }
        return job;
    }

    private static Path resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new MemoryValidationException("Path is required");
        }
        return Path.of(path).toAbsolutePath().normalize();
    }
}
