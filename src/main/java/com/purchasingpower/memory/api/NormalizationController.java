package com.purchasingpower.memory.api;

import com.purchasingpower.memory.jobs.JobSubmission;
import com.purchasingpower.memory.maintenance.NormalizationJob;
import com.purchasingpower.memory.maintenance.NormalizationService;
import com.purchasingpower.memory.maintenance.TestResultCleanupRequest;
import com.purchasingpower.memory.maintenance.TestResultCleanupResult;
import com.purchasingpower.memory.maintenance.TestResultRetentionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/projects/{projectId}/normalize")
@RequiredArgsConstructor
public class NormalizationController {

    private final NormalizationService normalizationService;
    private final TestResultRetentionService testResultRetention;

    @PostMapping
    public ResponseEntity<JobSubmission> normalize(@PathVariable String projectId,
                                                   @RequestBody(required = false) NormalizeRequest request) {
        NormalizeRequest effective = request != null ? request : new NormalizeRequest();
        JobSubmission submission = normalizationService.submit(projectId, effective.getPhases(), effective.isDryRun());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(submission);
    }

    @GetMapping
    public List<NormalizationJob> listJobs(@PathVariable String projectId) {
        return normalizationService.listJobs().stream()
                .filter(job -> job.getProjectId().equals(projectId))
                .toList();
    }

    @GetMapping("/{jobId}")
    public NormalizationJob getJob(@PathVariable String projectId, @PathVariable String jobId) {
        return normalizationService.getJob(jobId);
    }

    @PostMapping("/test-results")
    public TestResultCleanupResult cleanupTestResults(@PathVariable String projectId,
                                                      @Valid @RequestBody(required = false) TestResultCleanupRequest request) {
        return testResultRetention.cleanup(projectId, request != null ? request : new TestResultCleanupRequest());
    }
}
