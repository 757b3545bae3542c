package com.purchasingpower.memory.maintenance.impl;

import com.purchasingpower.memory.configuration.MemoryProperties;
import com.purchasingpower.memory.configuration.TestResultProperties;
import com.purchasingpower.memory.core.MemoryType;
import com.purchasingpower.memory.core.ProjectIds;
import com.purchasingpower.memory.maintenance.TestResultCleanupRequest;
import com.purchasingpower.memory.maintenance.TestResultCleanupResult;
import com.purchasingpower.memory.maintenance.TestResultRetentionService;
import com.purchasingpower.memory.memory.GraphMirror;
import com.purchasingpower.memory.memory.MemoryPointMapper;
import com.purchasingpower.memory.storage.PayloadFilter;
import com.purchasingpower.memory.storage.VectorPoint;
import com.purchasingpower.memory.storage.VectorStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class TestResultRetentionServiceImpl implements TestResultRetentionService {

    static final String SUITE_ID = "suite_id";
    static final String SUITE_NAME = "suite_name";
    private static final String UNKNOWN_SUITE = "unknown";

    private static final Comparator<VectorPoint> NEWEST_FIRST = Comparator.comparing(
            (VectorPoint point) -> MemoryPointMapper.parseInstant(point.getPayload().get(MemoryPointMapper.CREATED_AT)),
            Comparator.nullsLast(Comparator.reverseOrder()));

    private final VectorStore vectorStore;
    private final GraphMirror graphMirror;
    private final MemoryProperties properties;
    private final Clock clock;

    @Override
    public TestResultCleanupResult cleanup(String projectId, TestResultCleanupRequest request) {
        ProjectIds.requireValid(projectId);
        TestResultProperties defaults = properties.getTestResults();
        int keepCount = request.getKeepCount() != null ? request.getKeepCount() : defaults.getKeepCount();
        int olderThanDays = request.getOlderThanDays() != null ? request.getOlderThanDays() : defaults.getOlderThanDays();
        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofDays(olderThanDays));
        String collection = MemoryType.TEST_RESULT.collectionName(projectId);

        List<String> details = new ArrayList<>();
        int cleaned = 0;
        try {
            List<VectorPoint> points = vectorStore.scrollAll(collection,
                    suiteFilter(projectId, request.getSuiteId(), request.getSuiteName()),
                    properties.getNormalization().getScrollPageSize());

            for (Map.Entry<String, List<VectorPoint>> suite : groupBySuite(points).entrySet()) {
                List<VectorPoint> sorted = new ArrayList<>(suite.getValue());
                sorted.sort(NEWEST_FIRST);

                List<VectorPoint> expired = new ArrayList<>();
                for (int i = keepCount; i < sorted.size(); i++) {
                    Instant createdAt = MemoryPointMapper.parseInstant(
                            sorted.get(i).getPayload().get(MemoryPointMapper.CREATED_AT));
                    if (createdAt != null && createdAt.isBefore(cutoff)) {
                        expired.add(sorted.get(i));
                    }
                }
                if (expired.isEmpty()) {
                    continue;
                }

                details.add("Suite \"" + suite.getKey() + "\": " + expired.size() + " old results");
                if (!request.isDryRun()) {
                    for (VectorPoint point : expired) {
                        vectorStore.softDelete(projectId, collection, point.getId(), now);
                        graphMirror.remove(projectId, point.getId());
                    }
                }
                cleaned += expired.size();
            }
        } catch (RuntimeException e) {
            log.error("❌ Test result cleanup for {} failed: {}", projectId, e.getMessage(), e);
            details.add("Error: " + e.getMessage());
        }

        log.info("🧪 Test result cleanup for {}: {} results{}", projectId, cleaned,
                request.isDryRun() ? " (dry run)" : "");
        return TestResultCleanupResult.builder()
                .status(request.isDryRun() ? TestResultCleanupResult.STATUS_DRY_RUN : TestResultCleanupResult.STATUS_COMPLETE)
                .cleanedCount(cleaned)
                .details(details.isEmpty() ? new ArrayList<>(List.of("No test results to clean")) : details)
                .suiteName(request.getSuiteName())
                .suiteId(request.getSuiteId())
                .olderThanDays(olderThanDays)
                .keepCount(keepCount)
                .build();
    }

    @Override
    public int cleanupOnWrite(String projectId, Map<String, Object> metadata) {
        String suiteId = stringValue(metadata, SUITE_ID);
        String suiteName = stringValue(metadata, SUITE_NAME);
        if (suiteId == null && suiteName == null) {
            return 0;
        }

        int keepCount = properties.getTestResults().getKeepCount();
        String collection = MemoryType.TEST_RESULT.collectionName(projectId);
        try {
            List<VectorPoint> sorted = new ArrayList<>(vectorStore.scrollAll(collection,
                    suiteFilter(projectId, suiteId, suiteName), properties.getNormalization().getScrollPageSize()));
            if (sorted.size() <= keepCount) {
                return 0;
            }
            sorted.sort(NEWEST_FIRST);

            Instant now = clock.instant();
            List<VectorPoint> older = sorted.subList(keepCount, sorted.size());
            for (VectorPoint point : older) {
                vectorStore.softDelete(projectId, collection, point.getId(), now);
                graphMirror.markDeleted(projectId, point.getId());
            }
            log.info("🧪 Suite {}: {} older results soft-deleted", suiteId != null ? suiteId : suiteName, older.size());
            return older.size();
        } catch (RuntimeException e) {
            log.warn("⚠️  Test result cleanup on write failed for suite {}: {}",
                    suiteId != null ? suiteId : suiteName, e.getMessage());
            return 0;
        }
    }

    private static PayloadFilter suiteFilter(String projectId, String suiteId, String suiteName) {
        PayloadFilter filter = MemoryPointMapper.activeFilter(projectId);
        if (suiteId != null && !suiteId.isBlank()) {
            return filter.and("metadata." + SUITE_ID, suiteId);
        }
        if (suiteName != null && !suiteName.isBlank()) {
            return filter.and("metadata." + SUITE_NAME, suiteName);
        }
        return filter;
    }

    private static Map<String, List<VectorPoint>> groupBySuite(List<VectorPoint> points) {
        Map<String, List<VectorPoint>> suites = new LinkedHashMap<>();
        for (VectorPoint point : points) {
            String key = stringValue(point.getPayload().get(MemoryPointMapper.METADATA), SUITE_ID);
            if (key == null) {
                key = stringValue(point.getPayload().get(MemoryPointMapper.METADATA), SUITE_NAME);
            }
            suites.computeIfAbsent(key != null ? key : UNKNOWN_SUITE, k -> new ArrayList<>()).add(point);
        }
        return suites;
    }

    private static String stringValue(Object metadata, String key) {
        if (!(metadata instanceof Map<?, ?> map)) {
            return null;
        }
        Object value = map.get(key);
        return value != null && !value.toString().isBlank() ? value.toString() : null;
    }
}
