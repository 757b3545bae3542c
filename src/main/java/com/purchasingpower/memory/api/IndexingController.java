package com.purchasingpower.memory.api;

import com.purchasingpower.memory.indexing.CodeIndexingService;
import com.purchasingpower.memory.indexing.IndexFileResult;
import com.purchasingpower.memory.indexing.IndexingJob;
import com.purchasingpower.memory.jobs.JobSubmission;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/v1/projects/{projectId}/index")
@RequiredArgsConstructor
public class IndexingController {

    private final CodeIndexingService indexingService;

    @PostMapping("/file")
    public IndexFileResult indexFile(@PathVariable String projectId, @Valid @RequestBody IndexFileRequest request) {
        log.info("Indexing file {} into {}", request.getPath(), projectId);
        return indexingService.indexFile(projectId, request.getPath(), request.getLanguage(),
                request.getTargetClass());
    }

    /**
     * Starts a background job; poll {@code GET /index/jobs/{jobId}}.
     */
    @PostMapping("/directory")
    public ResponseEntity<JobSubmission> indexDirectory(@PathVariable String projectId,
                                                        @Valid @RequestBody IndexDirectoryRequest request) {
        log.info("Indexing directory {} into {}", request.getPath(), projectId);
        JobSubmission submission = indexingService.indexDirectory(projectId, request.getPath(),
                request.getIncludePatterns(), request.getExcludePatterns());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(submission);
    }

    @GetMapping("/jobs/{jobId}")
    public IndexingJob getJob(@PathVariable String projectId, @PathVariable String jobId) {
        return indexingService.getJob(jobId);
    }

    @DeleteMapping("/jobs/{jobId}")
    public IndexingJob cancel(@PathVariable String projectId, @PathVariable String jobId) {
        return indexingService.cancel(jobId);
    }
}
