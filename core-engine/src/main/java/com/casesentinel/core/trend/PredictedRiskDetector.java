package com.casesentinel.core.trend;

import com.casesentinel.core.config.PredictionRules;
import com.casesentinel.core.model.CaseRecord;
import com.casesentinel.core.model.PredictedRisk;
import com.casesentinel.core.model.PredictionType;
import com.casesentinel.core.model.Severity;
import com.casesentinel.core.model.TimeRange;
import com.casesentinel.core.model.TimeWindow;
import com.casesentinel.core.model.TrendingTopic;
import com.casesentinel.core.store.CaseStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Forecasts which trending topics are likely to turn into alerts.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Take the top {@link #CANDIDATE_TOPICS} trending topics of the window
 * and drop those with fewer than {@code minCases} current cases.</li>
 * <li>Count, per UTC calendar day ending today, the cases whose summary
 * contains the topic's term. Four days are looked at for hourly and daily
 * windows, fourteen for weekly.</li>
 * <li>Report a sustained increase when the latest {@code consecutiveDays}
 * days each rose over the day before.</li>
 * <li>Report an approaching threshold when the current count is at least
 * {@code approachPercent} of the threshold but below it, with an estimate of
 * the days left at the latest growth rate.</li>
 * <li>Report accelerating growth when the latest day-over-day growth exceeds
 * 20% and {@code growthMultiplier} times the growth two days earlier.</li>
 * </ol>
 * <p>
 * A topic may produce several risks. Results are ordered most severe first,
 * then by current count, and truncated to the limit. Nothing is stored.
 * </p>
 *
 * @since 1.0.0
 */
public class PredictedRiskDetector {

    private static final Logger LOG = LoggerFactory.getLogger(PredictedRiskDetector.class);

    public static final int CANDIDATE_TOPICS = 10;
    static final double MIN_ACCELERATING_GROWTH = 0.2;
    private static final int SHORT_LOOKBACK_DAYS = 4;
    private static final int LONG_LOOKBACK_DAYS = 14;
    private static final int MAX_SLUG_LENGTH = 20;

    private static final Set<Severity> ALL_SEVERITIES = EnumSet.allOf(Severity.class);

    private final TrendingTopicAggregator trending;
    private final CaseStore caseStore;
    private final PredictionRules rules;
    private final Clock clock;

    public PredictedRiskDetector(TrendingTopicAggregator trending, CaseStore caseStore,
            PredictionRules rules, Clock clock) {
        this.trending = Objects.requireNonNull(trending, "trending must not be null");
        this.caseStore = Objects.requireNonNull(caseStore, "caseStore must not be null");
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Forecast against the configured alert threshold.
     */
    public List<PredictedRisk> compute(TimeWindow window, int limit) {
        return compute(window, limit, rules.getAlertThreshold());
    }

    /**
     * @param limit     maximum number of risks; must be &gt;= 1
     * @param threshold case count an alert fires at; must be &gt;= 1
     * @return risks, most severe first
     * @throws IllegalArgumentException if {@code limit} or {@code threshold}
     *                                  is below 1
     */
    public List<PredictedRisk> compute(TimeWindow window, int limit, int threshold) {
        Objects.requireNonNull(window, "window must not be null");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
        }
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1, got: " + threshold);
        }

        List<TrendingTopic> candidates = trending.compute(window, CANDIDATE_TOPICS).stream()
                .filter(t -> t.getCaseCount() >= rules.getMinCases())
                .toList();
        if (candidates.isEmpty()) {
            LOG.info("Predictions ({}): no trending topic with at least {} case(s)",
                    window.wireName(), rules.getMinCases());
            return List.of();
        }

        Instant now = clock.instant();
        int days = lookbackDays(window);
        Instant firstDay = now.truncatedTo(ChronoUnit.DAYS).minus(Duration.ofDays(days - 1L));
        List<DatedTerms> history = caseStore
                .findCases(new TimeRange(firstDay, firstDay.plus(Duration.ofDays(days))), ALL_SEVERITIES)
                .stream()
                .map(c -> new DatedTerms(c, firstDay))
                .toList();

        List<PredictedRisk> risks = new ArrayList<>();
        for (TrendingTopic topic : candidates) {
            int[] counts = dailyCounts(history, topic.getTopic(), days);
            evaluate(topic, counts, threshold, now, risks);
        }
        risks.sort(Comparator.comparing(PredictedRisk::getSeverity, Severity.MOST_SEVERE_FIRST)
                .thenComparing(Comparator.comparingInt(PredictedRisk::getCurrentCount).reversed()));

        List<PredictedRisk> result = risks.size() > limit ? List.copyOf(risks.subList(0, limit)) : risks;
        LOG.info("Predictions ({}): {} candidate topic(s), {} risk(s), threshold {}",
                window.wireName(), candidates.size(), result.size(), threshold);
        return result;
    }

    private void evaluate(TrendingTopic topic, int[] counts, int threshold, Instant now,
            List<PredictedRisk> risks) {
        String term = topic.getTopic();
        int current = topic.getCaseCount();

        int streak = risingStreak(counts);
        if (streak >= rules.getConsecutiveDays()) {
            risks.add(base(topic, PredictionType.CONSECUTIVE_INCREASE, now)
                    .severity(consecutiveSeverity(streak))
                    .title(term + " - Sustained Increase")
                    .explanation("\"" + term + "\" has increased for " + streak + " consecutive days, "
                            + "suggesting a sustained trend that may require attention.")
                    .consecutiveDays(streak)
                    .build());
        }

        double recent = recentGrowth(counts);
        double percent = percentOfThreshold(current, threshold);
        if (percent >= rules.getApproachPercent() && percent < 100.0) {
            Integer daysLeft = daysToThreshold(current, recent * 100.0, threshold);
            risks.add(base(topic, PredictionType.APPROACHING_THRESHOLD, now)
                    .severity(approachSeverity(percent))
                    .title(term + " - Approaching Alert Threshold")
                    .explanation("\"" + term + "\" is at " + current + " cases, approaching the alert threshold of "
                            + threshold + " (" + whole(percent) + "% of threshold). "
                            + (daysLeft != null
                                    ? "At current rate, will trigger spike alert in ~" + daysLeft + " days."
                                    : "Monitor closely for potential spike."))
                    .threshold(threshold)
                    .daysToThreshold(daysLeft)
                    .build());
        }

        if (isAccelerating(counts, rules.getGrowthMultiplier())) {
            double ratePercent = recent * 100.0;
            int projected = (int) Math.round(counts[counts.length - 1] * (1.0 + recent));
            risks.add(base(topic, PredictionType.ACCELERATING_GROWTH, now)
                    .severity(growthSeverity(ratePercent))
                    .title(term + " - Accelerating Growth")
                    .explanation("\"" + term + "\" shows accelerating growth at " + whole(ratePercent)
                            + "% daily rate. Projected to reach " + projected
                            + " cases tomorrow if trend continues.")
                    .projectedCount(projected)
                    .growthRate(ratePercent)
                    .build());
        }
    }

    private static PredictedRisk.Builder base(TrendingTopic topic, PredictionType type, Instant now) {
        return PredictedRisk.builder()
                .id(predictionId(topic.getTopic(), type, now))
                .term(topic.getTopic())
                .type(type)
                .currentCount(topic.getCaseCount())
                .impactedBusinessUnits(topic.getImpactedBusinessUnits())
                .sampleCaseIds(topic.getSampleCaseIds())
                .createdAt(now);
    }

    // ---------------------------------------------------------------
    // Pattern helpers
    // ---------------------------------------------------------------

    static int lookbackDays(TimeWindow window) {
        return window == TimeWindow.WEEKLY ? LONG_LOOKBACK_DAYS : SHORT_LOOKBACK_DAYS;
    }

    /**
     * @return days in the rising run that ends at the latest day, counting
     *         the day it started from; 1 when the latest day did not rise
     */
    public static int risingStreak(int[] dailyCounts) {
        if (dailyCounts.length == 0) {
            return 0;
        }
        int increases = 0;
        for (int i = dailyCounts.length - 1; i > 0 && dailyCounts[i] > dailyCounts[i - 1]; i--) {
            increases++;
        }
        return increases + 1;
    }

    public static double percentOfThreshold(int currentCount, int threshold) {
        return currentCount * 100.0 / threshold;
    }

    /**
     * @return growth from the previous day to the latest as a fraction, or 0
     *         with fewer than four days or a zero previous day
     */
    public static double recentGrowth(int[] dailyCounts) {
        int n = dailyCounts.length;
        return n < 4 ? 0.0 : growth(dailyCounts[n - 2], dailyCounts[n - 1]);
    }

    public static boolean isAccelerating(int[] dailyCounts, double multiplier) {
        int n = dailyCounts.length;
        if (n < 4) {
            return false;
        }
        double recent = growth(dailyCounts[n - 2], dailyCounts[n - 1]);
        double earlier = growth(dailyCounts[n - 4], dailyCounts[n - 3]);
        return recent > earlier * multiplier && recent > MIN_ACCELERATING_GROWTH;
    }

    /**
     * Days until {@code threshold} is reached at a constant daily growth
     * rate.
     *
     * @param growthRatePercent daily growth in percent
     * @return rounded-up day count, or {@code null} if the count is not
     *         growing or has already reached the threshold
     */
    public static Integer daysToThreshold(int currentCount, double growthRatePercent, int threshold) {
        if (growthRatePercent <= 0 || currentCount >= threshold || currentCount <= 0) {
            return null;
        }
        double days = Math.log((double) threshold / currentCount) / Math.log(1.0 + growthRatePercent / 100.0);
        return (int) Math.ceil(days);
    }

    static Severity consecutiveSeverity(int days) {
        return days >= 5 ? Severity.HIGH : days >= 4 ? Severity.MEDIUM : Severity.LOW;
    }

    static Severity approachSeverity(double percentOfThreshold) {
        return percentOfThreshold >= 95 ? Severity.HIGH : percentOfThreshold >= 90 ? Severity.MEDIUM : Severity.LOW;
    }

    static Severity growthSeverity(double growthRatePercent) {
        return growthRatePercent >= 50 ? Severity.HIGH : growthRatePercent >= 30 ? Severity.MEDIUM : Severity.LOW;
    }

    static String predictionId(String term, PredictionType type, Instant now) {
        String slug = term.toLowerCase(Locale.ROOT).replaceAll("\\s+", "-");
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = slug.substring(0, MAX_SLUG_LENGTH);
        }
        return "pred-" + type.wireName() + "-" + slug + "-" + now.toEpochMilli();
    }

    private static double growth(int from, int to) {
        return from > 0 ? (double) (to - from) / from : 0.0;
    }

    private static String whole(double value) {
        return String.format(Locale.ROOT, "%.0f", value);
    }

    private static int[] dailyCounts(List<DatedTerms> history, String term, int days) {
        int[] counts = new int[days];
        for (DatedTerms entry : history) {
            if (entry.day >= 0 && entry.day < days && entry.terms.contains(term)) {
                counts[entry.day]++;
            }
        }
        return counts;
    }

    private static final class DatedTerms {
        private final int day;
        private final Set<String> terms;

        DatedTerms(CaseRecord record, Instant firstDay) {
            this.day = (int) Duration.between(firstDay, record.getCreatedAt()).toDays();
            this.terms = TermExtractor.distinctTerms(record.getSummary());
        }
    }
}
