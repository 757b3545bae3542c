package com.purchasingpower.memory.indexing.impl;

import com.purchasingpower.memory.core.MemoryType;
import com.purchasingpower.memory.exception.JobNotFoundException;
import com.purchasingpower.memory.exception.PathNotFoundException;
import com.purchasingpower.memory.indexing.IndexFileResult;
import com.purchasingpower.memory.indexing.IndexingJob;
import com.purchasingpower.memory.indexing.extract.ExtractorRegistry;
import com.purchasingpower.memory.indexing.extract.JavaScriptExtractor;
import com.purchasingpower.memory.indexing.extract.PythonExtractor;
import com.purchasingpower.memory.jobs.InMemoryJobStore;
import com.purchasingpower.memory.jobs.JobStatus;
import com.purchasingpower.memory.jobs.JobSubmission;
import com.purchasingpower.memory.memory.MemoryPointMapper;
import com.purchasingpower.memory.storage.VectorPoint;
import com.purchasingpower.memory.support.MemoryFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

import static com.purchasingpower.memory.support.MemoryFixture.PROJECT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CodeIndexingServiceImplTest {

    @TempDir
    Path workspace;

    private MemoryFixture fixture;
    private final List<Runnable> queued = new ArrayList<>();

    @BeforeEach
    void setUp() {
        fixture = new MemoryFixture();
    }

    private CodeIndexingServiceImpl service(Executor executor) {
        return new CodeIndexingServiceImpl(fixture.memoryService, fixture.vectorStore,
                new ExtractorRegistry(List.of(new JavaScriptExtractor(), new PythonExtractor())),
                new InMemoryJobStore<>(), fixture.properties, executor, fixture.clock);
    }

    private List<VectorPoint> activeFunctions() {
        return fixture.vectorStore.scrollAll(MemoryType.FUNCTION.collectionName(PROJECT),
                MemoryPointMapper.activeFilter(PROJECT), 100);
    }

    @Test
    @DisplayName("Indexing a file stores the file and one memory per function")
    void indexFile() throws IOException {
        // Given
        Path file = Files.writeString(workspace.resolve("cart.js"), String.join("\n",
                "function add(a, b) {",
                "  return a + b;",
                "}",
                "const half = (x) => x / 2;"));

        // When
        IndexFileResult result = service(Runnable::run).indexFile(PROJECT, file.toString(), null, null);

        // Then
        assertThat(result.getLanguage()).isEqualTo("javascript");
        assertThat(result.getFunctionsIndexed()).isEqualTo(2);
        assertThat(result.getStaleFunctionsRemoved()).isZero();
        assertThat(fixture.load(MemoryType.CODE_PATTERN, result.getMemoryId()).getMetadata())
                .containsEntry("file_path", file.toAbsolutePath().normalize().toString())
                .containsEntry("language", "javascript")
                .containsKey("size_bytes");

        assertThat(activeFunctions())
                .extracting(point -> (Object) ((Map<?, ?>) point.getPayload().get("metadata")).get("function_name"))
                .containsExactlyInAnyOrder("add", "half");
        assertThat(fixture.graphStore.listNodes(PROJECT)).hasSize(2);
    }

    @Test
    @DisplayName("Re-indexing a file replaces its previous function memories")
    void reindexReplacesFunctions() throws IOException {
        // Given
        CodeIndexingServiceImpl service = service(Runnable::run);
        Path file = workspace.resolve("tasks.py");
        Files.writeString(file, "def one():\n    return 1\n\ndef two():\n    return 2\n");
        service.indexFile(PROJECT, file.toString(), null, null);

        // When
        Files.writeString(file, "def three():\n    return 3\n");
        IndexFileResult result = service.indexFile(PROJECT, file.toString(), null, null);

        // Then
        assertThat(result.getStaleFunctionsRemoved()).isEqualTo(2);
        assertThat(result.getFunctionsIndexed()).isEqualTo(1);
        assertThat(activeFunctions()).hasSize(1);
    }

    @Test
    @DisplayName("An explicit language overrides the extension")
    void languageOverride() throws IOException {
        Path file = Files.writeString(workspace.resolve("script.txt"), "def run():\n    pass\n");

        IndexFileResult result = service(Runnable::run).indexFile(PROJECT, file.toString(), "Python", null);

        assertThat(result.getLanguage()).isEqualTo("python");
        assertThat(result.getFunctionsIndexed()).isEqualTo(1);
    }

    @Test
    @DisplayName("Files in languages without an extractor are stored without functions")
    void unsupportedLanguage() throws IOException {
        Path file = Files.writeString(workspace.resolve("notes.md"), "# Notes\n\nfunction fake() {}\n");

        IndexFileResult result = service(Runnable::run).indexFile(PROJECT, file.toString(), null, null);

        assertThat(result.getLanguage()).isNull();
        assertThat(result.getFunctionsIndexed()).isZero();
        assertThat(fixture.load(MemoryType.CODE_PATTERN, result.getMemoryId())).isNotNull();
    }

    @Test
    @DisplayName("Missing files are reported as not found")
    void missingFile() {
        assertThatThrownBy(() -> service(Runnable::run)
                .indexFile(PROJECT, workspace.resolve("absent.js").toString(), null, null))
                .isInstanceOf(PathNotFoundException.class);
        assertThatThrownBy(() -> service(Runnable::run)
                .indexDirectory(PROJECT, workspace.resolve("absent").toString(), null, null))
                .isInstanceOf(PathNotFoundException.class);
    }

    @Test
    @DisplayName("Directory jobs honour include and exclude patterns and record per-file errors")
    void indexDirectory() throws IOException {
        // Given
        Files.createDirectories(workspace.resolve("src"));
        Files.createDirectories(workspace.resolve("node_modules/lib"));
        Files.writeString(workspace.resolve("src/app.js"), "function main() {\n  return 0;\n}\n");
        Files.writeString(workspace.resolve("src/jobs.py"), "def work():\n    pass\n\ndef rest():\n    pass\n");
        Files.writeString(workspace.resolve("src/empty.js"), "   \n");
        Files.writeString(workspace.resolve("node_modules/lib/dep.js"), "function dep() {}\n");
        Files.writeString(workspace.resolve("README.md"), "# readme\n");
        CodeIndexingServiceImpl service = service(Runnable::run);

        // When
        JobSubmission submission = service.indexDirectory(PROJECT, workspace.toString(), null, null);
        IndexingJob job = service.getJob(submission.jobId());

        // Then
        assertThat(submission.status()).isEqualTo(JobStatus.PENDING);
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETE);
        assertThat(job.getFilesTotal()).isEqualTo(3);
        assertThat(job.getFilesProcessed()).isEqualTo(3);
        assertThat(job.getFunctionsIndexed()).isEqualTo(3);
        assertThat(job.getErrors()).hasSize(1);
        assertThat(job.getErrors().get(0)).contains("empty.js");
        assertThat(job.getCompletedAt()).isEqualTo(MemoryFixture.START);
    }

    @Test
    @DisplayName("Caller patterns replace the configured defaults")
    void customPatterns() throws IOException {
        Files.writeString(workspace.resolve("a.js"), "function a() {}\n");
        Files.writeString(workspace.resolve("b.py"), "def b():\n    pass\n");
        CodeIndexingServiceImpl service = service(Runnable::run);

        JobSubmission submission = service.indexDirectory(PROJECT, workspace.toString(), List.of("*.py"), List.of());

        assertThat(service.getJob(submission.jobId()).getFilesTotal()).isEqualTo(1);
    }

    @Test
    @DisplayName("A cancelled job stops before indexing further files")
    void cancel() throws IOException {
        // Given
        Files.writeString(workspace.resolve("a.js"), "function a() {}\n");
        CodeIndexingServiceImpl service = service(queued::add);
        JobSubmission submission = service.indexDirectory(PROJECT, workspace.toString(), null, null);

        // When
        IndexingJob cancelled = service.cancel(submission.jobId());
        queued.forEach(Runnable::run);

        // Then
        assertThat(cancelled.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(cancelled.getError()).isEqualTo(IndexingJob.CANCELLED_MESSAGE);
        assertThat(cancelled.getFilesProcessed()).isZero();
        assertThat(activeFunctions()).isEmpty();
    }

    @Test
    @DisplayName("Cancelling a finished job leaves it unchanged")
    void cancelFinished() throws IOException {
        Files.writeString(workspace.resolve("a.js"), "function a() {}\n");
        CodeIndexingServiceImpl service = service(Runnable::run);
        JobSubmission submission = service.indexDirectory(PROJECT, workspace.toString(), null, null);

        IndexingJob job = service.cancel(submission.jobId());

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETE);
        assertThatThrownBy(() -> service.getJob("missing")).isInstanceOf(JobNotFoundException.class);
    }
}
