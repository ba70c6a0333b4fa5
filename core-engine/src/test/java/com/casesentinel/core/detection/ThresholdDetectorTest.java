package com.casesentinel.core.detection;

import com.casesentinel.core.aggregation.CaseAggregator;
import com.casesentinel.core.config.AlertConfig;
import com.casesentinel.core.config.ConfigurationException;
import com.casesentinel.core.config.ThresholdTable;
import com.casesentinel.core.model.DetectionResult;
import com.casesentinel.core.model.Severity;
import com.casesentinel.core.model.TimeWindow;
import com.casesentinel.core.store.InMemoryCaseStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ThresholdDetector}.
 */
class ThresholdDetectorTest {

    private static final Instant NOW = Instant.parse("2025-06-02T12:00:00Z");
    private static final Instant CURRENT = NOW.minus(Duration.ofHours(2));
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private InMemoryCaseStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryCaseStore();
    }

    @Test
    @DisplayName("Should NOT fire when count equals the threshold")
    void shouldNotFireAtThreshold() {
        store.addMany(100, "Billing", "Refunds", Severity.LOW, "", CURRENT);

        assertThat(detector(AlertConfig.defaults()).detect(TimeWindow.DAILY)).isEmpty();
    }

    @Test
    @DisplayName("Severity follows the count to threshold ratio")
    void severityBuckets() {
        assertThat(ThresholdDetector.severityFor(101, 100)).isEqualTo(Severity.LOW);
        assertThat(ThresholdDetector.severityFor(149, 100)).isEqualTo(Severity.LOW);
        assertThat(ThresholdDetector.severityFor(150, 100)).isEqualTo(Severity.MEDIUM);
        assertThat(ThresholdDetector.severityFor(200, 100)).isEqualTo(Severity.HIGH);
        assertThat(ThresholdDetector.severityFor(300, 100)).isEqualTo(Severity.CRITICAL);
    }

    @Test
    @DisplayName("Should report threshold, count and percent over limit")
    void shouldReportBreach() {
        store.addMany(150, "Billing", "Refunds", Severity.LOW, "", CURRENT);

        List<DetectionResult> results = detector(AlertConfig.defaults()).detect(TimeWindow.DAILY);

        assertThat(results).hasSize(1);
        DetectionResult r = results.get(0);
        assertThat(r.getThresholdValue()).isEqualTo(100);
        assertThat(r.getCurrentCount()).isEqualTo(150);
        assertThat(r.getPercentageChange()).isEqualTo(50.0);
        assertThat(r.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(r.getCategory()).isNull();
    }

    @Test
    @DisplayName("Business-unit override wins over the default")
    void overrideWins() {
        store.addMany(140, "Customer Service", "Billing", Severity.LOW, "", CURRENT);

        // default is 100 but Customer Service allows 150 per day
        assertThat(detector(AlertConfig.defaults()).detect(TimeWindow.DAILY)).isEmpty();
    }

    @Test
    @DisplayName("Override wins even when it is lower than the default")
    void lowerOverrideWins() {
        AlertConfig config = AlertConfig.builder()
                .thresholdOverride("Billing", ThresholdTable.of(5, 50, 250))
                .build();
        store.addMany(60, "Billing", "Refunds", Severity.LOW, "", CURRENT);

        List<DetectionResult> results = detector(config).detect(TimeWindow.DAILY);

        assertThat(results).hasSize(1);
        assertThat(results.get(0).getThresholdValue()).isEqualTo(50);
    }

    @Test
    @DisplayName("Sorts by severity, then count")
    void sortsBySeverityThenCount() {
        store.addMany(160, "Retail", "Returns", Severity.LOW, "", CURRENT);   // 1.6x medium
        store.addMany(320, "Travel", "Delays", Severity.LOW, "", CURRENT);    // 3.2x critical
        store.addMany(180, "Energy", "Outages", Severity.LOW, "", CURRENT);   // 1.8x medium

        List<DetectionResult> results = detector(AlertConfig.defaults()).detect(TimeWindow.DAILY);

        assertThat(results).extracting(DetectionResult::getBusinessUnit)
                .containsExactly("Travel", "Energy", "Retail");
    }

    @Test
    @DisplayName("Missing threshold for a window is a configuration error, never zero")
    void missingThresholdFails() {
        Map<TimeWindow, Integer> dailyOnly = new EnumMap<>(TimeWindow.class);
        dailyOnly.put(TimeWindow.DAILY, 100);
        AlertConfig config = AlertConfig.builder()
                .defaultThresholds(ThresholdTable.of(dailyOnly))
                .clearThresholdOverrides()
                .build();
        store.addMany(3, "Billing", "Refunds", Severity.LOW, "", NOW.minus(Duration.ofMinutes(5)));

        assertThatThrownBy(() -> detector(config).detect(TimeWindow.HOURLY))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("hourly");
    }

    @Test
    @DisplayName("Empty store yields no results")
    void emptyStore() {
        assertThat(detector(AlertConfig.defaults()).detect(TimeWindow.WEEKLY)).isEmpty();
    }

    private ThresholdDetector detector(AlertConfig config) {
        return new ThresholdDetector(new CaseAggregator(store), config, CLOCK);
    }
}
