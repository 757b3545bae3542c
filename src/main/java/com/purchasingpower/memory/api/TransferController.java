package com.purchasingpower.memory.api;

import com.purchasingpower.memory.core.MemoryType;
import com.purchasingpower.memory.core.ProjectIds;
import com.purchasingpower.memory.transfer.ExportImportService;
import com.purchasingpower.memory.transfer.ExportRequest;
import com.purchasingpower.memory.transfer.ImportConflictPolicy;
import com.purchasingpower.memory.transfer.ImportResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.InputStream;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * NDJSON export and import.
 *
 * @since 1.0.0
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}")
@RequiredArgsConstructor
public class TransferController {

    static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private final ExportImportService exportImportService;
    private final Clock clock;

    @GetMapping("/export")
    public ResponseEntity<StreamingResponseBody> export(@PathVariable String projectId,
                                                        @RequestParam(required = false) List<String> types,
                                                        @RequestParam(defaultValue = "false") boolean includeDeleted) {
        ProjectIds.requireValid(projectId);
        List<MemoryType> memoryTypes = new ArrayList<>();
        if (types != null) {
            types.forEach(type -> memoryTypes.add(MemoryType.fromWireName(type)));
        }
        ExportRequest request = ExportRequest.builder().types(memoryTypes).includeDeleted(includeDeleted).build();

        String filename = "memories-" + projectId + "-" + LocalDate.now(clock) + ".jsonl";
        StreamingResponseBody body = output -> exportImportService.exportMemories(projectId, request, output);
        return ResponseEntity.ok()
                .contentType(NDJSON)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .body(body);
    }

    /**
     * POST /api/v1/projects/{projectId}/import?conflict=skip|overwrite|error with an NDJSON body.
     */
    @PostMapping("/import")
    public ImportResult importMemories(@PathVariable String projectId,
                                       @RequestParam(defaultValue = "skip") String conflict,
                                       InputStream body) {
        return exportImportService.importMemories(projectId, body, ImportConflictPolicy.fromValue(conflict));
    }
}
