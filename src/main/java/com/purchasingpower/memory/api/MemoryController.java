package com.purchasingpower.memory.api;

import com.purchasingpower.memory.core.Memory;
import com.purchasingpower.memory.core.MemoryDraft;
import com.purchasingpower.memory.core.MemoryType;
import com.purchasingpower.memory.memory.BulkCreateResult;
import com.purchasingpower.memory.memory.CreateResult;
import com.purchasingpower.memory.memory.MemoryPage;
import com.purchasingpower.memory.memory.MemoryQueryService;
import com.purchasingpower.memory.memory.MemoryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Memory CRUD.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/projects/{projectId}/memories")
@RequiredArgsConstructor
public class MemoryController {

    private final MemoryService memoryService;
    private final MemoryQueryService queryService;

    /**
     * POST /api/v1/projects/{projectId}/memories
     */
    @PostMapping
    public ResponseEntity<CreateResult> create(@PathVariable String projectId,
                                               @Valid @RequestBody CreateMemoryRequest request) {
        log.info("Creating {} memory in {}", request.getType().getWireName(), projectId);
        return ResponseEntity.status(HttpStatus.CREATED).body(memoryService.create(projectId, request.toDraft()));
    }

    /**
     * POST /api/v1/projects/{projectId}/memories/bulk
     */
    @PostMapping("/bulk")
    public ResponseEntity<BulkCreateResult> bulkCreate(@PathVariable String projectId,
                                                       @Valid @RequestBody BulkCreateRequest request) {
        List<MemoryDraft> drafts = request.getMemories().stream().map(CreateMemoryRequest::toDraft).toList();
        return ResponseEntity.status(HttpStatus.CREATED).body(memoryService.bulkCreate(projectId, drafts));
    }

    @GetMapping("/{type}/{memoryId}")
    public Memory get(@PathVariable String projectId, @PathVariable String type, @PathVariable String memoryId) {
        return memoryService.get(projectId, MemoryType.fromWireName(type), memoryId);
    }

    @PatchMapping("/{type}/{memoryId}")
    public Memory update(@PathVariable String projectId, @PathVariable String type, @PathVariable String memoryId,
                         @RequestBody UpdateMemoryRequest request) {
        return memoryService.update(projectId, MemoryType.fromWireName(type), memoryId, request.toUpdate());
    }

    /**
     * DELETE /api/v1/projects/{projectId}/memories/{type}/{memoryId}?hard=false
     */
    @DeleteMapping("/{type}/{memoryId}")
    public ResponseEntity<Void> delete(@PathVariable String projectId, @PathVariable String type,
                                       @PathVariable String memoryId,
                                       @RequestParam(defaultValue = "false") boolean hard) {
        memoryService.delete(projectId, MemoryType.fromWireName(type), memoryId, hard);
        return ResponseEntity.noContent().build();
    }

    /**
     * Pages through one type. {@code offset} is the cursor from the previous page.
     */
    @GetMapping("/{type}")
    public MemoryPage list(@PathVariable String projectId, @PathVariable String type,
                           @RequestParam(defaultValue = "20") int limit,
                           @RequestParam(required = false) String offset,
                           @RequestParam(defaultValue = "false") boolean includeDeleted) {
        return queryService.list(projectId, MemoryType.fromWireName(type), limit, offset, includeDeleted);
    }
}
