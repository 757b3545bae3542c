package com.purchasingpower.memory.api;

import com.purchasingpower.memory.memory.MemoryQueryService;
import com.purchasingpower.memory.memory.MemoryStatistics;
import com.purchasingpower.memory.memory.SearchHit;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/projects/{projectId}")
@RequiredArgsConstructor
public class SearchController {

    private final MemoryQueryService queryService;

    @PostMapping("/search")
    public List<SearchHit> search(@PathVariable String projectId, @Valid @RequestBody SearchRequest request) {
        return queryService.search(projectId, request.toQuery());
    }

    @GetMapping("/stats")
    public MemoryStatistics statistics(@PathVariable String projectId) {
        return queryService.statistics(projectId);
    }
}
