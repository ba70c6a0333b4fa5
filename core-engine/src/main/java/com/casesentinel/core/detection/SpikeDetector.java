package com.casesentinel.core.detection;

import com.casesentinel.core.aggregation.CaseAggregator;
import com.casesentinel.core.config.AlertConfig;
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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Volume-spike detector.
 *
 * <p>
 * Compares case counts per (business unit, category) in the current period
 * against the immediately preceding baseline period and flags groups whose
 * volume grew by more than the configured spike factor.
 * </p>
 *
 * <h3>Rules</h3>
 * <ul>
 * <li>A group absent from the baseline has a baseline of 0.</li>
 * <li>Groups with a baseline below {@code minBaseline} are never evaluated,
 * which keeps tiny denominators from producing spurious spikes.</li>
 * <li>A spike requires {@code current > baseline * spikeFactor}
 * (strictly).</li>
 * </ul>
 *
 * <p>
 * Results are ordered by percentage change, largest first.
 * </p>
 *
 * @since 1.0.0
 */
public class SpikeDetector implements AlertDetector {

    private static final Logger LOG = LoggerFactory.getLogger(SpikeDetector.class);

    private final CaseAggregator aggregator;
    private final double spikeFactor;
    private final int minBaseline;
    private final Clock clock;

    /**
     * @throws NullPointerException if any argument is {@code null}
     */
    public SpikeDetector(CaseAggregator aggregator, AlertConfig config, Clock clock) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        Objects.requireNonNull(config, "AlertConfig must not be null");
        this.spikeFactor = config.getSpikeFactor();
        this.minBaseline = config.getMinBaseline();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public List<DetectionResult> detect(TimeWindow window) {
        Objects.requireNonNull(window, "window must not be null");
        WindowBounds bounds = WindowCalculator.bounds(window, clock.instant());

        List<CaseCount> current = aggregator.countByBusinessUnitAndCategory(bounds.getCurrent());
        List<CaseCount> baseline = aggregator.countByBusinessUnitAndCategory(bounds.getBaseline());

        Map<List<String>, Integer> baselineByGroup = new HashMap<>();
        for (CaseCount count : baseline) {
            baselineByGroup.put(count.groupKey(), count.getCount());
        }

        List<DetectionResult> results = new ArrayList<>();
        for (CaseCount count : current) {
            int baselineCount = baselineByGroup.getOrDefault(count.groupKey(), 0);
            int currentCount = count.getCount();

            if (baselineCount < minBaseline) {
                LOG.trace("Group [{}]: baseline {} below minimum {}, skipping",
                        count.groupKey(), baselineCount, minBaseline);
                continue;
            }
            if (currentCount <= baselineCount * spikeFactor) {
                continue;
            }

            double pct = percentageChange(currentCount, baselineCount);
            Severity severity = severityFor(pct);
            LOG.debug("Spike in [{}]: current={} baseline={} change={}% severity={}",
                    count.groupKey(), currentCount, baselineCount, pct, severity);

            results.add(DetectionResult.builder()
                    .type(AlertType.SPIKE)
                    .window(window)
                    .businessUnit(count.getBusinessUnit())
                    .category(count.getCategory())
                    .baselineCount(baselineCount)
                    .currentCount(currentCount)
                    .percentageChange(pct)
                    .severity(severity)
                    .build());
        }

        results.sort(Comparator.comparing(DetectionResult::getPercentageChange).reversed());
        LOG.info("Spike detection ({}): {} group(s) evaluated, {} spike(s)",
                window.wireName(), current.size(), results.size());
        return results;
    }

    @Override
    public AlertType getType() {
        return AlertType.SPIKE;
    }

    static double percentageChange(int current, int baseline) {
        return (current - baseline) * 100.0 / baseline;
    }

    /**
     * Left-closed buckets: 200 and above critical, 100 high, 65 medium.
     */
    static Severity severityFor(double percentageChange) {
        if (percentageChange >= 200) {
            return Severity.CRITICAL;
        }
        if (percentageChange >= 100) {
            return Severity.HIGH;
        }
        if (percentageChange >= 65) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }
}
