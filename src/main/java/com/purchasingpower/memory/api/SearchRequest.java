package com.purchasingpower.memory.api;

import com.purchasingpower.memory.core.MemoryType;
import com.purchasingpower.memory.memory.SearchQuery;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

    @NotBlank
    private String query;

    @Builder.Default
    private List<MemoryType> types = new ArrayList<>();

    @Min(1)
    @Max(100)
    @Builder.Default
    private int limit = 10;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double scoreThreshold;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public SearchQuery toQuery() {
        return SearchQuery.builder()
                .query(query)
                .types(types != null ? types : new ArrayList<>())
                .limit(limit)
                .scoreThreshold(scoreThreshold)
                .metadata(metadata != null ? metadata : new LinkedHashMap<>())
                .build();
    }
}
