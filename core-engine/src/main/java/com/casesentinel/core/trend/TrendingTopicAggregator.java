package com.casesentinel.core.trend;

import com.casesentinel.core.model.CaseRecord;
import com.casesentinel.core.model.Severity;
import com.casesentinel.core.model.TimeWindow;
import com.casesentinel.core.model.TrendDirection;
import com.casesentinel.core.model.TrendingTopic;
import com.casesentinel.core.model.WindowBounds;
import com.casesentinel.core.store.CaseStore;
import com.casesentinel.core.store.TrendingTopicStore;
import com.casesentinel.core.window.WindowCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Computes rising topics from case summaries.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Fetch every case of the current and baseline ranges.</li>
 * <li>Count term document frequencies in each range.</li>
 * <li>Keep terms seen in at least {@link #MIN_OCCURRENCES} current cases and
 * score them with {@link TrendScorer}.</li>
 * <li>Sort by score, keep rising terms, truncate to the limit.</li>
 * <li>Attach the impacted business units and up to
 * {@link #MAX_SAMPLE_CASES} sample cases.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public class TrendingTopicAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(TrendingTopicAggregator.class);

    public static final int MIN_OCCURRENCES = 5;
    public static final int MAX_SAMPLE_CASES = 3;

    private static final Set<Severity> ALL_SEVERITIES = EnumSet.allOf(Severity.class);

    private final CaseStore caseStore;
    private final TrendingTopicStore topicStore;
    private final Clock clock;

    public TrendingTopicAggregator(CaseStore caseStore, TrendingTopicStore topicStore, Clock clock) {
        this.caseStore = Objects.requireNonNull(caseStore, "caseStore must not be null");
        this.topicStore = Objects.requireNonNull(topicStore, "topicStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Compute unsaved topics for {@code window}.
     *
     * @param limit maximum number of topics; must be &gt;= 1
     * @return rising topics, highest score first
     * @throws IllegalArgumentException if {@code limit} &lt; 1
     */
    public List<TrendingTopic> compute(TimeWindow window, int limit) {
        Objects.requireNonNull(window, "window must not be null");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
        }

        WindowBounds bounds = WindowCalculator.bounds(window, clock.instant());
        List<CaseRecord> currentCases = caseStore.findCases(bounds.getCurrent(), ALL_SEVERITIES);
        List<CaseRecord> baselineCases = caseStore.findCases(bounds.getBaseline(), ALL_SEVERITIES);

        Map<String, Integer> current = TermExtractor.documentFrequencies(summaries(currentCases));
        Map<String, Integer> baseline = TermExtractor.documentFrequencies(summaries(baselineCases));

        List<TermTrend> trends = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : current.entrySet()) {
            int currentCount = entry.getValue();
            if (currentCount < MIN_OCCURRENCES) {
                continue;
            }
            int baselineCount = baseline.getOrDefault(entry.getKey(), 0);
            trends.add(new TermTrend(entry.getKey(), currentCount, baselineCount));
        }
        trends.sort(Comparator.comparingDouble(TermTrend::score).reversed());

        List<TrendingTopic> topics = trends.stream()
                .filter(t -> t.direction == TrendDirection.RISING)
                .limit(limit)
                .map(t -> toTopic(t, currentCases))
                .toList();

        LOG.info("Trending ({}): {} current / {} baseline case(s), {} candidate term(s), {} topic(s)",
                window.wireName(), currentCases.size(), baselineCases.size(), trends.size(), topics.size());
        return topics;
    }

    /**
     * Compute topics and append them to the topic store, unless the current
     * thread has been interrupted in the meantime.
     *
     * @return the stored topics with identifiers and timestamps
     */
    public List<TrendingTopic> generateAndPersist(TimeWindow window, int limit) {
        return generateAndPersist(window, limit, () -> !Thread.currentThread().isInterrupted());
    }

    /**
     * @param mayWrite consulted right before the write; {@code false}
     *                 discards the computed topics
     * @throws CancellationException if {@code mayWrite} refused the write
     */
    public List<TrendingTopic> generateAndPersist(TimeWindow window, int limit, BooleanSupplier mayWrite) {
        Objects.requireNonNull(mayWrite, "mayWrite must not be null");
        List<TrendingTopic> drafts = compute(window, limit);
        if (drafts.isEmpty()) {
            return List.of();
        }
        if (!mayWrite.getAsBoolean()) {
            throw new CancellationException(
                    "Trending run for " + window.wireName() + " abandoned before writing "
                            + drafts.size() + " topic(s)");
        }

        Instant now = clock.instant();
        List<TrendingTopic> stored = drafts.stream()
                .map(t -> t.toBuilder()
                        .id(UUID.randomUUID().toString())
                        .createdAt(now)
                        .updatedAt(now)
                        .build())
                .toList();
        topicStore.insertTopics(stored);
        LOG.info("Stored {} trending topic(s) for window {}", stored.size(), window.wireName());
        return stored;
    }

    private static TrendingTopic toTopic(TermTrend trend, List<CaseRecord> currentCases) {
        Set<String> businessUnits = new LinkedHashSet<>();
        List<CaseRecord> samples = new ArrayList<>();
        for (CaseRecord record : currentCases) {
            if (!TermExtractor.distinctTerms(record.getSummary()).contains(trend.term)) {
                continue;
            }
            businessUnits.add(record.getBusinessUnit());
            if (samples.size() < MAX_SAMPLE_CASES) {
                samples.add(record);
            }
        }

        List<String> impacted = new ArrayList<>(businessUnits);
        return TrendingTopic.builder()
                .topic(trend.term)
                .description(trend.term + " is trending with " + trend.currentCount + " mentions")
                .caseCount(trend.currentCount)
                .baselineCount(trend.baselineCount)
                .direction(trend.direction)
                .percentageChange(trend.percentChange)
                .trendScore(trend.score)
                .businessUnit(impacted.isEmpty() ? null : impacted.get(0))
                .category(samples.isEmpty() ? null : samples.get(0).getCategory())
                .impactedBusinessUnits(impacted)
                .sampleCaseIds(samples.stream().map(CaseRecord::getId).toList())
                .build();
    }

    private static List<String> summaries(List<CaseRecord> cases) {
        return cases.stream().map(CaseRecord::getSummary).toList();
    }

    private static final class TermTrend {
        private final String term;
        private final int currentCount;
        private final int baselineCount;
        private final double percentChange;
        private final double score;
        private final TrendDirection direction;

        TermTrend(String term, int currentCount, int baselineCount) {
            this.term = term;
            this.currentCount = currentCount;
            this.baselineCount = baselineCount;
            this.percentChange = TrendScorer.percentChange(currentCount, baselineCount);
            this.score = TrendScorer.score(currentCount, baselineCount);
            this.direction = TrendScorer.direction(percentChange);
        }

        double score() {
            return score;
        }
    }
}
