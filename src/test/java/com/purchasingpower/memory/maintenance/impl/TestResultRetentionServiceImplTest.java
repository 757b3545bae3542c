package com.purchasingpower.memory.maintenance.impl;

import com.purchasingpower.memory.core.MemoryType;
import com.purchasingpower.memory.maintenance.TestResultCleanupRequest;
import com.purchasingpower.memory.maintenance.TestResultCleanupResult;
import com.purchasingpower.memory.support.MemoryFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.purchasingpower.memory.support.MemoryFixture.PROJECT;
import static com.purchasingpower.memory.support.MemoryFixture.START;
import static org.assertj.core.api.Assertions.assertThat;

class TestResultRetentionServiceImplTest {

    private MemoryFixture fixture;
    private TestResultRetentionServiceImpl retention;

    /** Ten nightly runs aged 54, 48, ... 0 days, oldest first. */
    private final List<String> nightly = new ArrayList<>();

    @BeforeEach
    void setUp() {
        fixture = new MemoryFixture();
        retention = fixture.retention;
        for (int age = 54; age >= 0; age -= 6) {
            fixture.clock.set(START.minus(Duration.ofDays(age)));
            nightly.add(fixture.create(MemoryType.TEST_RESULT, "nightly run aged " + age, Map.of("suite_id", "nightly")));
        }
        fixture.clock.set(START);
    }

    private TestResultCleanupRequest.TestResultCleanupRequestBuilder keepThreeOlderThanThirty() {
        return TestResultCleanupRequest.builder().keepCount(3).olderThanDays(30);
    }

    @Test
    @DisplayName("Results beyond keepCount and older than the cutoff are soft-deleted")
    void cleansOldResults() {
        // When
        TestResultCleanupResult result = retention.cleanup(PROJECT, keepThreeOlderThanThirty().build());

        // Then
        assertThat(result.getStatus()).isEqualTo(TestResultCleanupResult.STATUS_COMPLETE);
        assertThat(result.getCleanedCount()).isEqualTo(4);
        assertThat(result.getDetails()).containsExactly("Suite \"nightly\": 4 old results");
        for (int i = 0; i < nightly.size(); i++) {
            boolean expired = i < 4;
            assertThat(fixture.load(MemoryType.TEST_RESULT, nightly.get(i)).isDeleted())
                    .as("run %d", i)
                    .isEqualTo(expired);
        }
        assertThat(fixture.graphStore.node(PROJECT, nightly.get(0))).isNull();
        assertThat(fixture.graphStore.node(PROJECT, nightly.get(9))).isNotNull();
    }

    @Test
    @DisplayName("Dry run reports the same count without deleting")
    void dryRun() {
        TestResultCleanupResult result = retention.cleanup(PROJECT, keepThreeOlderThanThirty().dryRun(true).build());

        assertThat(result.getStatus()).isEqualTo(TestResultCleanupResult.STATUS_DRY_RUN);
        assertThat(result.getCleanedCount()).isEqualTo(4);
        assertThat(fixture.load(MemoryType.TEST_RESULT, nightly.get(0)).isDeleted()).isFalse();
    }

    @Test
    @DisplayName("The newest keepCount results survive regardless of age")
    void keepCountWins() {
        TestResultCleanupResult result = retention.cleanup(PROJECT, TestResultCleanupRequest.builder()
                .keepCount(10).olderThanDays(0).build());

        assertThat(result.getCleanedCount()).isZero();
        assertThat(result.getDetails()).containsExactly("No test results to clean");
    }

    @Test
    @DisplayName("Suites are grouped by id, then name, and can be targeted")
    void suiteSelection() {
        // Given
        fixture.clock.set(START.minus(Duration.ofDays(90)));
        fixture.create(MemoryType.TEST_RESULT, "smoke run old", Map.of("suite_name", "smoke"));
        fixture.clock.set(START);
        fixture.create(MemoryType.TEST_RESULT, "smoke run new", Map.of("suite_name", "smoke"));

        // When
        TestResultCleanupResult smokeOnly = retention.cleanup(PROJECT, TestResultCleanupRequest.builder()
                .suiteName("smoke").keepCount(1).olderThanDays(30).dryRun(true).build());
        TestResultCleanupResult all = retention.cleanup(PROJECT, TestResultCleanupRequest.builder()
                .keepCount(1).olderThanDays(30).dryRun(true).build());
        TestResultCleanupResult unknownSuite = retention.cleanup(PROJECT, TestResultCleanupRequest.builder()
                .suiteId("missing").dryRun(true).build());

        // Then
        assertThat(smokeOnly.getDetails()).containsExactly("Suite \"smoke\": 1 old results");
        assertThat(all.getCleanedCount()).isEqualTo(5);
        assertThat(all.getDetails()).containsExactlyInAnyOrder(
                "Suite \"nightly\": 4 old results", "Suite \"smoke\": 1 old results");
        assertThat(unknownSuite.getCleanedCount()).isZero();
        assertThat(unknownSuite.getKeepCount()).isEqualTo(fixture.properties.getTestResults().getKeepCount());
    }

    @Test
    @DisplayName("Writes without a suite never trigger cleanup")
    void cleanupOnWriteNeedsSuite() {
        assertThat(retention.cleanupOnWrite(PROJECT, Map.of("status", "passed"))).isZero();
    }
}
