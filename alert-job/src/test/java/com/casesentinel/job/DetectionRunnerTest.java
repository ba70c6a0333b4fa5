package com.casesentinel.job;

import com.casesentinel.core.alert.AlertFormatter;
import com.casesentinel.core.alert.AlertGenerationService;
import com.casesentinel.core.alert.AlertWriter;
import com.casesentinel.core.detection.AlertDetector;
import com.casesentinel.core.model.Alert;
import com.casesentinel.core.model.AlertType;
import com.casesentinel.core.model.CaseCount;
import com.casesentinel.core.model.CaseRecord;
import com.casesentinel.core.model.DetectionResult;
import com.casesentinel.core.model.GroupingKey;
import com.casesentinel.core.model.Severity;
import com.casesentinel.core.model.TimeRange;
import com.casesentinel.core.model.TimeWindow;
import com.casesentinel.core.model.TrendingTopic;
import com.casesentinel.core.store.CaseStore;
import com.casesentinel.core.store.DataAccessException;
import com.casesentinel.core.trend.TrendingTopicAggregator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DetectionRunnerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-02T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private final List<Alert> stored = new CopyOnWriteArrayList<>();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final CountDownLatch release = new CountDownLatch(1);
    private DetectionRunner runner;

    @AfterEach
    void tearDown() {
        release.countDown();
        if (runner != null) {
            runner.close();
        }
    }

    @Test
    @DisplayName("A failing detector does not stop the others")
    void failureIsolation() {
        runner = runner(config(EnumSet.of(AlertType.SPIKE, AlertType.THRESHOLD), false, 5_000), List.of(
                new FailingDetector(AlertType.SPIKE),
                new FixedDetector(AlertType.THRESHOLD)), null);

        RunReport report = runner.run(TimeWindow.DAILY);

        assertThat(report.hasFailures()).isTrue();
        assertThat(report.getFailedDetectors()).containsExactly("spike");
        assertThat(report.getOutcomes()).extracting(DetectorOutcome::getDetector)
                .containsExactly("spike", "threshold");
        assertThat(report.getOutcomes().get(0).getError()).contains("DataAccessException").contains("store offline");
        assertThat(report.getTotalWritten()).isEqualTo(1);
        assertThat(stored).extracting(Alert::getTitle).containsExactly("High volume: 150 cases in Billing");

        assertThat(registry.get(JobMetrics.RUNS).tags("detector", "spike", "outcome", "failure")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get(JobMetrics.RUNS).tags("detector", "threshold", "outcome", "success")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get(JobMetrics.ALERTS_WRITTEN).tags("detector", "threshold")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A detector that misses its deadline is reported as timed out")
    void timeout() {
        runner = runner(config(EnumSet.of(AlertType.THRESHOLD, AlertType.URGENCY), false, 300), List.of(
                new FixedDetector(AlertType.THRESHOLD),
                new BlockingDetector(AlertType.URGENCY, release)), null);

        RunReport report = runner.run(TimeWindow.DAILY);

        assertThat(report.getFailedDetectors()).containsExactly("urgency");
        DetectorOutcome urgency = report.getOutcomes().get(1);
        assertThat(urgency.isSuccess()).isFalse();
        assertThat(urgency.getError()).contains("timed out after 300ms");
        assertThat(report.getOutcomes().get(0).isSuccess()).isTrue();
    }

    @Test
    @DisplayName("A detector that ignores interruption and finishes late writes nothing")
    void lateDetectorDoesNotWrite() {
        runner = runner(config(EnumSet.of(AlertType.THRESHOLD, AlertType.SPIKE), false, 200), List.of(
                new FixedDetector(AlertType.THRESHOLD),
                new SpinningDetector(AlertType.SPIKE, 800)), null);

        RunReport report = runner.run(TimeWindow.DAILY);
        runner.close();

        assertThat(report.getFailedDetectors()).containsExactly("spike");
        assertThat(report.getOutcomes().get(1).getError()).contains("timed out after 200ms");
        assertThat(stored).hasSize(1);
        assertThat(registry.get(JobMetrics.RUNS).tags("detector", "spike", "outcome", "failure")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A slow trending pass is held to the run deadline and stores nothing")
    void trendingDeadline() {
        List<List<TrendingTopic>> topics = new CopyOnWriteArrayList<>();
        TrendingTopicAggregator trending = new TrendingTopicAggregator(
                new SlowCaseStore(600), topics::add, CLOCK);
        JobConfig config = new JobConfig.Builder()
                .alertTypes(EnumSet.of(AlertType.THRESHOLD))
                .detectorTimeoutMs(100)
                .computeTrending(true)
                .build();
        runner = runner(config, List.of(new FixedDetector(AlertType.THRESHOLD)), trending);

        long start = System.nanoTime();
        RunReport report = runner.run(TimeWindow.DAILY);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        runner.close();

        assertThat(elapsedMs).isLessThan(1_000);
        assertThat(report.getFailedDetectors()).containsExactly(DetectionRunner.TRENDING);
        assertThat(report.getOutcomes().get(1).getError()).contains("timed out after 100ms");
        assertThat(report.getOutcomes().get(0).isSuccess()).isTrue();
        assertThat(topics).isEmpty();
    }

    @Test
    @DisplayName("Dry run detects without writing")
    void dryRun() {
        runner = runner(config(EnumSet.of(AlertType.THRESHOLD), true, 5_000),
                List.of(new FixedDetector(AlertType.THRESHOLD)), null);

        RunReport report = runner.run(TimeWindow.DAILY);

        assertThat(report.isDryRun()).isTrue();
        assertThat(report.hasFailures()).isFalse();
        assertThat(report.getOutcomes().get(0).getResultCount()).isEqualTo(1);
        assertThat(report.getTotalWritten()).isZero();
        assertThat(stored).isEmpty();
    }

    @Test
    @DisplayName("Trending pass is reported after the detectors")
    void trendingPass() {
        SqliteDatabase database = new SqliteDatabase(tempDir.resolve("cases.db"));
        TrendingTopicAggregator trending = new TrendingTopicAggregator(
                new SqliteCaseStore(database), new SqliteAlertStore(database), CLOCK);
        JobConfig config = new JobConfig.Builder()
                .alertTypes(EnumSet.of(AlertType.THRESHOLD))
                .computeTrending(true)
                .build();
        runner = runner(config, List.of(new FixedDetector(AlertType.THRESHOLD)), trending);

        RunReport report = runner.run(TimeWindow.WEEKLY);

        assertThat(report.getOutcomes()).extracting(DetectorOutcome::getDetector)
                .containsExactly("threshold", DetectionRunner.TRENDING);
        assertThat(report.getOutcomes().get(1).isSuccess()).isTrue();
        assertThat(report.getOutcomes().get(1).getResultCount()).isZero();
        assertThat(report.getWindow()).isEqualTo(TimeWindow.WEEKLY);
    }

    // ---------------------------------------------------------------
    // Fixtures
    // ---------------------------------------------------------------

    private DetectionRunner runner(JobConfig config, List<AlertDetector> detectors, TrendingTopicAggregator trending) {
        AlertGenerationService service = new AlertGenerationService(
                detectors, new AlertFormatter(), new AlertWriter(stored::addAll, CLOCK));
        return new DetectionRunner(service, trending, new JobMetrics(registry), config, CLOCK);
    }

    private static JobConfig config(EnumSet<AlertType> types, boolean dryRun, long timeoutMs) {
        return new JobConfig.Builder()
                .alertTypes(types)
                .dryRun(dryRun)
                .detectorTimeoutMs(timeoutMs)
                .computeTrending(false)
                .build();
    }

    private static List<DetectionResult> billingOverThreshold(TimeWindow window) {
        return List.of(DetectionResult.builder()
                .type(AlertType.THRESHOLD)
                .window(window)
                .businessUnit("Billing")
                .thresholdValue(100)
                .currentCount(150)
                .percentageChange(50.0)
                .severity(Severity.MEDIUM)
                .build());
    }

    /**
     * Busy-waits without checking the interrupt flag.
     */
    private static void spin(long millis) {
        long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
        while (System.nanoTime() < until) {
            Thread.onSpinWait();
        }
    }

    private static final class FixedDetector implements AlertDetector {
        private final AlertType type;

        FixedDetector(AlertType type) {
            this.type = type;
        }

        @Override
        public List<DetectionResult> detect(TimeWindow window) {
            return billingOverThreshold(window);
        }

        @Override
        public AlertType getType() {
            return type;
        }
    }

    private static final class FailingDetector implements AlertDetector {
        private final AlertType type;

        FailingDetector(AlertType type) {
            this.type = type;
        }

        @Override
        public List<DetectionResult> detect(TimeWindow window) {
            throw new DataAccessException("store offline");
        }

        @Override
        public AlertType getType() {
            return type;
        }
    }

    private static final class BlockingDetector implements AlertDetector {
        private final AlertType type;
        private final CountDownLatch release;

        BlockingDetector(AlertType type, CountDownLatch release) {
            this.type = type;
            this.release = release;
        }

        @Override
        public List<DetectionResult> detect(TimeWindow window) {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", e);
            }
            return List.of();
        }

        @Override
        public AlertType getType() {
            return type;
        }
    }

    private static final class SpinningDetector implements AlertDetector {
        private final AlertType type;
        private final long millis;

        SpinningDetector(AlertType type, long millis) {
            this.type = type;
            this.millis = millis;
        }

        @Override
        public List<DetectionResult> detect(TimeWindow window) {
            spin(millis);
            return billingOverThreshold(window);
        }

        @Override
        public AlertType getType() {
            return type;
        }
    }

    /**
     * Every case mentions a rising term; each query takes {@code millis}.
     */
    private static final class SlowCaseStore implements CaseStore {
        private final long millis;

        SlowCaseStore(long millis) {
            this.millis = millis;
        }

        @Override
        public List<CaseCount> countCases(TimeRange range, GroupingKey grouping) {
            spin(millis);
            return List.of();
        }

        @Override
        public List<CaseRecord> findCases(TimeRange range, Set<Severity> severities) {
            spin(millis);
            List<CaseRecord> cases = new ArrayList<>();
            if (range.contains(CLOCK.instant().minusSeconds(3_600))) {
                for (int i = 0; i < 6; i++) {
                    cases.add(CaseRecord.builder()
                            .id("slow-" + i)
                            .businessUnit("Billing")
                            .category("Accounts")
                            .severity(Severity.LOW)
                            .summary("router outage")
                            .createdAt(CLOCK.instant().minusSeconds(3_600))
                            .build());
                }
            }
            return cases;
        }
    }
}
