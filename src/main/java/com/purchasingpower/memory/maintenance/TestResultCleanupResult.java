package com.purchasingpower.memory.maintenance;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestResultCleanupResult {

    public static final String STATUS_COMPLETE = "complete";
    public static final String STATUS_DRY_RUN = "dry_run";

    private String status;
    private int cleanedCount;

    @Builder.Default
    private List<String> details = new ArrayList<>();

    private String suiteName;
    private String suiteId;
    private int olderThanDays;
    private int keepCount;
}
