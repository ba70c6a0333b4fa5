package com.casesentinel.core.detection;

import com.casesentinel.core.aggregation.CaseAggregator;
import com.casesentinel.core.config.AlertConfig;
import com.casesentinel.core.config.ConfigurationException;
import com.casesentinel.core.config.ThresholdTable;
import com.casesentinel.core.model.AlertType;
import com.casesentinel.core.model.CaseCount;
import com.casesentinel.core.model.DetectionResult;
import com.casesentinel.core.model.Severity;
import com.casesentinel.core.model.TimeWindow;
import com.casesentinel.core.model.WindowBounds;
import com.casesentinel.core.window.WindowCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Absolute-volume detector.
 *
 * <p>
 * Fires for every business unit whose case count in the current period
 * exceeds its threshold. A business unit's own override for the window takes
 * precedence over the default table, even when it is lower.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdDetector implements AlertDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdDetector.class);

    static final Comparator<DetectionResult> SEVERITY_THEN_COUNT =
            Comparator.comparing(DetectionResult::getSeverity, Severity.MOST_SEVERE_FIRST)
                    .thenComparing(Comparator.comparingInt(DetectionResult::getCurrentCount).reversed());

    private final CaseAggregator aggregator;
    private final AlertConfig config;
    private final Clock clock;

    public ThresholdDetector(CaseAggregator aggregator, AlertConfig config, Clock clock) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.config = Objects.requireNonNull(config, "AlertConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public List<DetectionResult> detect(TimeWindow window) {
        Objects.requireNonNull(window, "window must not be null");
        WindowBounds bounds = WindowCalculator.bounds(window, clock.instant());

        List<CaseCount> counts = aggregator.countByBusinessUnit(bounds.getCurrent());

        List<DetectionResult> results = new ArrayList<>();
        for (CaseCount count : counts) {
            int threshold = resolveThreshold(count.getBusinessUnit(), window);
            if (count.getCount() <= threshold) {
                continue;
            }

            Severity severity = severityFor(count.getCount(), threshold);
            double pctOver = (count.getCount() - threshold) * 100.0 / threshold;
            LOG.debug("Threshold exceeded in [{}]: count={} threshold={} severity={}",
                    count.getBusinessUnit(), count.getCount(), threshold, severity);

            results.add(DetectionResult.builder()
                    .type(AlertType.THRESHOLD)
                    .window(window)
                    .businessUnit(count.getBusinessUnit())
                    .thresholdValue(threshold)
                    .currentCount(count.getCount())
                    .percentageChange(pctOver)
                    .severity(severity)
                    .build());
        }

        results.sort(SEVERITY_THEN_COUNT);
        LOG.info("Threshold detection ({}): {} business unit(s) evaluated, {} breach(es)",
                window.wireName(), counts.size(), results.size());
        return results;
    }

    @Override
    public AlertType getType() {
        return AlertType.THRESHOLD;
    }

    /**
     * Per-unit override for the window if configured, else the default for
     * the window.
     *
     * @throws ConfigurationException if neither table has a value for
     *                                {@code window}
     */
    int resolveThreshold(String businessUnit, TimeWindow window) {
        Optional<ThresholdTable> override = config.thresholdOverride(businessUnit);
        if (override.isPresent()) {
            OptionalInt value = override.get().valueFor(window);
            if (value.isPresent()) {
                return value.getAsInt();
            }
        }
        OptionalInt fallback = config.getDefaultThresholds().valueFor(window);
        if (fallback.isEmpty()) {
            throw new ConfigurationException(
                    "No threshold configured for window '" + window.wireName()
                            + "' (business unit '" + businessUnit + "')");
        }
        return fallback.getAsInt();
    }

    /**
     * Buckets on {@code count / threshold}: 3.0 critical, 2.0 high, 1.5
     * medium.
     */
    static Severity severityFor(int count, int threshold) {
        double ratio = count / (double) threshold;
        if (ratio >= 3.0) {
            return Severity.CRITICAL;
        }
        if (ratio >= 2.0) {
            return Severity.HIGH;
        }
        if (ratio >= 1.5) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }
}
