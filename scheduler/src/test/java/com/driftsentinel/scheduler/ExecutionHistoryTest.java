package com.driftsentinel.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ExecutionHistoryTest {

    private static final Instant NOW = Instant.parse("2024-03-04T10:00:00Z");

    @Test
    @DisplayName("Appending past capacity evicts the oldest entry")
    void evictsOldest() {
        ExecutionHistory history = new ExecutionHistory();
        List<DriftCheckResult> all = new ArrayList<>();
        for (int i = 0; i < 1001; i++) {
            DriftCheckResult r = result("m", ExecutionStatus.COMPLETED, false);
            all.add(r);
            history.record(r);
        }

        List<DriftCheckResult> snapshot = history.snapshot();
        assertThat(snapshot).hasSize(1000);
        assertThat(snapshot.get(0)).isEqualTo(all.get(1));
        assertThat(snapshot.get(999)).isEqualTo(all.get(1000));
    }

    @Test
    @DisplayName("Queries filter by model and status, most recent first")
    void queryFiltersMostRecentFirst() {
        ExecutionHistory history = new ExecutionHistory(10);
        DriftCheckResult a1 = result("a", ExecutionStatus.COMPLETED, false);
        DriftCheckResult b1 = result("b", ExecutionStatus.FAILED, false);
        DriftCheckResult a2 = result("a", ExecutionStatus.FAILED, false);
        DriftCheckResult a3 = result("a", ExecutionStatus.COMPLETED, true);
        List.of(a1, b1, a2, a3).forEach(history::record);

        assertThat(history.query(null, null, 100)).containsExactly(a3, a2, b1, a1);
        assertThat(history.query("a", null, 100)).containsExactly(a3, a2, a1);
        assertThat(history.query(null, ExecutionStatus.FAILED, 100)).containsExactly(a2, b1);
        assertThat(history.query("a", ExecutionStatus.COMPLETED, 1)).containsExactly(a3);
        assertThat(history.query("c", null, 100)).isEmpty();
    }

    @Test
    @DisplayName("Statistics are computed over the retained entries")
    void statistics() {
        ExecutionHistory history = new ExecutionHistory(4);
        history.record(result("a", ExecutionStatus.FAILED, false));
        history.record(result("a", ExecutionStatus.COMPLETED, true));
        history.record(result("a", ExecutionStatus.COMPLETED, false));
        history.record(result("b", ExecutionStatus.SKIPPED, false));
        history.record(result("b", ExecutionStatus.COMPLETED, true));

        SchedulerStatistics stats = history.statistics(2, 1);

        assertThat(stats.totalModelsConfigured()).isEqualTo(2);
        assertThat(stats.totalModelsEnabled()).isEqualTo(1);
        assertThat(stats.totalExecutions()).isEqualTo(4);
        assertThat(stats.successfulExecutions()).isEqualTo(3);
        assertThat(stats.failedExecutions()).isZero();
        assertThat(stats.skippedExecutions()).isEqualTo(1);
        assertThat(stats.alertsGenerated()).isEqualTo(2);
        assertThat(stats.successRate()).isCloseTo(75.0, within(1e-9));
    }

    @Test
    @DisplayName("Success rate of an empty history is zero")
    void emptySuccessRate() {
        assertThat(new ExecutionHistory().statistics(0, 0).successRate()).isZero();
    }

    @Test
    @DisplayName("Concurrent appends are all retained")
    void concurrentAppends() throws InterruptedException {
        ExecutionHistory history = new ExecutionHistory(10_000);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(8);
        for (int t = 0; t < 8; t++) {
            pool.execute(() -> {
                for (int i = 0; i < 500; i++) {
                    history.record(result("m", ExecutionStatus.COMPLETED, false));
                }
                done.countDown();
            });
        }
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        pool.shutdown();

        assertThat(history.size()).isEqualTo(4000);
    }

    // ---- Helpers ----

    private static DriftCheckResult result(String modelId, ExecutionStatus status, boolean alert) {
        return DriftCheckResult.builder()
                .modelId(modelId)
                .modelVersion("1")
                .timestamp(NOW)
                .status(status)
                .alertGenerated(alert)
                .build();
    }
}
