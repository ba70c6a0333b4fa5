package com.casesentinel.core.detection;

import com.casesentinel.core.aggregation.CaseAggregator;
import com.casesentinel.core.config.AlertConfig;
import com.casesentinel.core.model.AlertType;
import com.casesentinel.core.model.DetectionResult;
import com.casesentinel.core.model.Severity;
import com.casesentinel.core.model.TimeWindow;
import com.casesentinel.core.store.DataAccessException;
import com.casesentinel.core.store.InMemoryCaseStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SpikeDetector}.
 */
class SpikeDetectorTest {

    private static final Instant NOW = Instant.parse("2025-06-02T12:00:00Z");
    private static final Instant CURRENT = NOW.minus(Duration.ofHours(1));
    private static final Instant BASELINE = NOW.minus(Duration.ofHours(25));

    private InMemoryCaseStore store;
    private SpikeDetector detector;

    @BeforeEach
    void setUp() {
        store = new InMemoryCaseStore();
        detector = new SpikeDetector(new CaseAggregator(store), AlertConfig.defaults(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should NOT fire when current equals baseline times factor")
    void shouldNotFireAtExactFactor() {
        givenCounts("Billing", "Refunds", 15, 10);

        assertThat(detector.detect(TimeWindow.DAILY)).isEmpty();
    }

    @Test
    @DisplayName("Should fire just above the factor with low severity")
    void shouldFireJustAboveFactor() {
        givenCounts("Billing", "Refunds", 16, 10);

        List<DetectionResult> results = detector.detect(TimeWindow.DAILY);

        assertThat(results).hasSize(1);
        DetectionResult r = results.get(0);
        assertThat(r.getType()).isEqualTo(AlertType.SPIKE);
        assertThat(r.getBusinessUnit()).isEqualTo("Billing");
        assertThat(r.getCategory()).isEqualTo("Refunds");
        assertThat(r.getCurrentCount()).isEqualTo(16);
        assertThat(r.getBaselineCount()).isEqualTo(10);
        assertThat(r.getPercentageChange()).isEqualTo(60.0);
        assertThat(r.getSeverity()).isEqualTo(Severity.LOW);
    }

    @Test
    @DisplayName("Should skip groups whose baseline is below the minimum")
    void shouldSkipSmallBaseline() {
        givenCounts("Billing", "Refunds", 100, 4);

        assertThat(detector.detect(TimeWindow.DAILY)).isEmpty();
    }

    @Test
    @DisplayName("Should skip groups absent from the baseline")
    void shouldSkipNewGroups() {
        store.addMany(50, "Billing", "Refunds", Severity.LOW, "", CURRENT);

        assertThat(detector.detect(TimeWindow.DAILY)).isEmpty();
    }

    @Test
    @DisplayName("Should sort by percentage change descending")
    void shouldSortByPercentageChange() {
        givenCounts("Billing", "Refunds", 20, 10);   // +100%
        givenCounts("Retail", "Returns", 40, 10);    // +300%
        givenCounts("Travel", "Delays", 17, 10);     // +70%

        List<DetectionResult> results = detector.detect(TimeWindow.DAILY);

        assertThat(results).extracting(DetectionResult::getBusinessUnit)
                .containsExactly("Retail", "Billing", "Travel");
        assertThat(results).extracting(DetectionResult::getSeverity)
                .containsExactly(Severity.CRITICAL, Severity.HIGH, Severity.MEDIUM);
    }

    @Test
    @DisplayName("Severity buckets are closed on the left")
    void severityBuckets() {
        assertThat(SpikeDetector.severityFor(64.9)).isEqualTo(Severity.LOW);
        assertThat(SpikeDetector.severityFor(65)).isEqualTo(Severity.MEDIUM);
        assertThat(SpikeDetector.severityFor(100)).isEqualTo(Severity.HIGH);
        assertThat(SpikeDetector.severityFor(200)).isEqualTo(Severity.CRITICAL);
    }

    @Test
    @DisplayName("Repeated runs over unchanged data give equal results")
    void shouldBeIdempotent() {
        givenCounts("Billing", "Refunds", 30, 10);
        givenCounts("Retail", "Returns", 12, 6);

        assertThat(detector.detect(TimeWindow.DAILY)).isEqualTo(detector.detect(TimeWindow.DAILY));
    }

    @Test
    @DisplayName("Empty store yields no results")
    void emptyStore() {
        assertThat(detector.detect(TimeWindow.HOURLY)).isEmpty();
    }

    @Test
    @DisplayName("Store failures propagate")
    void storeFailurePropagates() {
        store.failWith(new DataAccessException("down"));

        assertThatThrownBy(() -> detector.detect(TimeWindow.DAILY))
                .isInstanceOf(DataAccessException.class);
    }

    @Test
    @DisplayName("Should keep groups apart when names contain separator characters")
    void shouldNotMixGroupsWithSeparatorsInNames() {
        store.addMany(100, "A|B", "C", Severity.LOW, "", CURRENT);
        store.addMany(10, "A", "B|C", Severity.LOW, "", BASELINE);

        assertThat(detector.detect(TimeWindow.DAILY)).isEmpty();
    }

    private void givenCounts(String bu, String category, int current, int baseline) {
        store.addMany(current, bu, category, Severity.LOW, "", CURRENT);
        store.addMany(baseline, bu, category, Severity.LOW, "", BASELINE);
    }
}
