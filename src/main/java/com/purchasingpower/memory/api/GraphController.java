package com.purchasingpower.memory.api;

import com.purchasingpower.memory.core.ProjectIds;
import com.purchasingpower.memory.storage.GraphStore;
import com.purchasingpower.memory.storage.RelatedNode;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Graph traversal and read-only Cypher.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/projects/{projectId}/graph")
@RequiredArgsConstructor
public class GraphController {

    private final GraphStore graphStore;

    /**
     * POST /api/v1/projects/{projectId}/graph/query
     *
     * <p>Write clauses are rejected with 403.
     */
    @PostMapping("/query")
    public List<Map<String, Object>> query(@PathVariable String projectId,
                                           @Valid @RequestBody GraphQueryRequest request) {
        ProjectIds.requireValid(projectId);
        log.debug("Graph query for {}: {}", projectId, request.getCypher());
        return graphStore.query(projectId, request.getCypher(),
                request.getParameters() != null ? request.getParameters() : Map.of());
    }

    /**
     * GET /api/v1/projects/{projectId}/graph/related/{memoryId}?types=IMPLEMENTS&depth=2
     */
    @GetMapping("/related/{memoryId}")
    public List<RelatedNode> related(@PathVariable String projectId, @PathVariable String memoryId,
                                     @RequestParam(required = false) List<String> types,
                                     @RequestParam(defaultValue = "2") int depth) {
        ProjectIds.requireValid(projectId);
        return graphStore.getRelated(projectId, memoryId, types != null ? types : List.of(), depth);
    }
}
