package com.casesentinel.job;

import com.casesentinel.core.config.AlertConfig;
import com.casesentinel.core.config.AlertConfigLoader;
import com.casesentinel.core.model.Alert;
import com.casesentinel.core.model.AlertType;
import com.casesentinel.core.model.CaseRecord;
import com.casesentinel.core.model.PredictedRisk;
import com.casesentinel.core.model.PredictionType;
import com.casesentinel.core.model.Severity;
import com.casesentinel.core.model.TimeWindow;
import com.casesentinel.core.trend.PredictedRiskDetector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the assembled pipeline against a SQLite file.
 */
class AlertComputeJobTest {

    private static final Instant NOW = Instant.parse("2025-06-02T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("One run writes alerts and trending topics for seeded cases")
    void endToEnd() {
        Path db = tempDir.resolve("cases.db");
        SqliteDatabase database = new SqliteDatabase(db);
        new SqliteCaseStore(database).insertCases(seed());

        JobConfig config = new JobConfig.Builder()
                .caseDbPath(db.toString())
                .timeWindow(TimeWindow.DAILY)
                .build();
        SimpleMeterRegistry registry = new SimpleMeterRegistry();

        RunReport report;
        try (DetectionRunner runner = AlertComputeJob.createRunner(database, config, AlertConfig.defaults(),
                new JobMetrics(registry), CLOCK)) {
            report = runner.run(TimeWindow.DAILY);
        }

        assertThat(report.hasFailures()).isFalse();
        assertThat(report.getOutcomes()).hasSize(5);

        SqliteAlertStore stored = new SqliteAlertStore(new SqliteDatabase(db));
        List<Alert> alerts = stored.findAlerts();
        assertThat(alerts).extracting(Alert::getType)
                .containsExactlyInAnyOrder(AlertType.SPIKE, AlertType.THRESHOLD, AlertType.URGENCY);
        assertThat(alerts).extracting(Alert::getTitle).contains(
                "High volume: 251 cases in Billing",
                "Urgent: 1 high-risk case detected in Billing");
        assertThat(alerts).allSatisfy(a -> assertThat(a.getCreatedAt()).isEqualTo(NOW));

        int topicsWritten = report.getOutcomes().get(4).getWritten();
        assertThat(topicsWritten).isPositive();
        assertThat(stored.findTopics()).hasSize(topicsWritten);
        assertThat(registry.get(JobMetrics.TOPICS_WRITTEN).counter().count()).isEqualTo(topicsWritten);
    }

    @Test
    @DisplayName("Predictor forecasts a topic rising day over day from SQLite")
    void predictions() {
        SqliteDatabase database = new SqliteDatabase(tempDir.resolve("cases.db"));
        List<CaseRecord> seed = new ArrayList<>();
        int[] daily = { 1, 2, 4, 8 };
        for (int day = 0; day < daily.length; day++) {
            Instant at = Instant.parse("2025-05-30T10:00:00Z").plus(Duration.ofDays(day));
            if (day == 2) {
                at = Instant.parse("2025-06-01T02:00:00Z");
            }
            for (int i = 0; i < daily[day]; i++) {
                seed.add(record("d" + day + "-" + i, "Network", Severity.LOW, "router outage", at));
            }
        }
        new SqliteCaseStore(database).insertCases(seed);

        PredictedRiskDetector predictor = AlertComputeJob.createPredictor(database, AlertConfig.defaults(), CLOCK);
        List<PredictedRisk> risks = predictor.compute(TimeWindow.DAILY, 10);

        assertThat(risks).isNotEmpty();
        assertThat(risks).allSatisfy(r -> {
            assertThat(r.getType()).isEqualTo(PredictionType.CONSECUTIVE_INCREASE);
            assertThat(r.getConsecutiveDays()).isEqualTo(4);
            assertThat(r.getCurrentCount()).isEqualTo(8);
        });
        assertThat(risks).extracting(PredictedRisk::getTerm)
                .containsExactlyInAnyOrder("router", "outage", "router outage");
    }

    @Test
    @DisplayName("Packaged alert-config.yml matches the built-in defaults")
    void packagedConfig() {
        AlertConfig packaged = AlertConfigLoader.fromClasspath(AlertConfigLoader.DEFAULT_RESOURCE);
        AlertConfig defaults = AlertConfig.defaults();

        assertThat(packaged.getSpikeFactor()).isEqualTo(defaults.getSpikeFactor());
        assertThat(packaged.getMinBaseline()).isEqualTo(defaults.getMinBaseline());
        assertThat(packaged.getDefaultThresholds()).isEqualTo(defaults.getDefaultThresholds());
        assertThat(packaged.getThresholdsByBusinessUnit()).isEqualTo(defaults.getThresholdsByBusinessUnit());
        assertThat(packaged.getUrgency()).isEqualTo(defaults.getUrgency());
        assertThat(packaged.getMisclassification()).isEqualTo(defaults.getMisclassification());
        assertThat(packaged.getPrediction()).isEqualTo(defaults.getPrediction());
    }

    private static List<CaseRecord> seed() {
        List<CaseRecord> seed = new ArrayList<>();
        for (int i = 0; i < 250; i++) {
            seed.add(record("cur-" + i, "Refunds", Severity.LOW, "billing question", NOW.minus(Duration.ofHours(1))));
        }
        for (int i = 0; i < 10; i++) {
            seed.add(record("base-" + i, "Refunds", Severity.LOW, "billing question", NOW.minus(Duration.ofHours(30))));
        }
        seed.add(record("legal-1", "Legal", Severity.HIGH, "customer mentioned lawsuit", NOW.minus(Duration.ofHours(2))));
        return seed;
    }

    private static CaseRecord record(String id, String category, Severity severity, String summary, Instant at) {
        return CaseRecord.builder()
                .id(id)
                .businessUnit("Billing")
                .category(category)
                .severity(severity)
                .summary(summary)
                .createdAt(at)
                .build();
    }
}
