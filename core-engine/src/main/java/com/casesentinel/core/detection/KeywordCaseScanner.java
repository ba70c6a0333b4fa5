package com.casesentinel.core.detection;

import com.casesentinel.core.config.KeywordRules;
import com.casesentinel.core.model.AlertType;
import com.casesentinel.core.model.CaseRecord;
import com.casesentinel.core.model.DetectionResult;
import com.casesentinel.core.model.Severity;
import com.casesentinel.core.model.TimeRange;
import com.casesentinel.core.model.TimeWindow;
import com.casesentinel.core.store.CaseStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * Shared scan behind the keyword detectors: fetch cases of the qualifying
 * severities, keep the ones whose summary matches, and group them by
 * business unit in first-seen order.
 *
 * @since 1.0.0
 */
final class KeywordCaseScanner {

    private static final Logger LOG = LoggerFactory.getLogger(KeywordCaseScanner.class);

    private final CaseStore caseStore;
    private final KeywordMatcher matcher;

    KeywordCaseScanner(CaseStore caseStore, KeywordMatcher matcher) {
        this.caseStore = Objects.requireNonNull(caseStore, "caseStore must not be null");
        this.matcher = Objects.requireNonNull(matcher, "matcher must not be null");
    }

    List<KeywordMatch> scan(TimeRange range, Set<Severity> severities, List<String> keywords) {
        List<CaseRecord> cases = caseStore.findCases(range, severities);
        List<KeywordMatch> matches = new ArrayList<>();
        for (CaseRecord record : cases) {
            if (!severities.contains(record.getSeverity())) {
                continue;
            }
            List<String> found = matcher.match(record.getSummary(), keywords);
            if (!found.isEmpty()) {
                matches.add(new KeywordMatch(record, found));
            }
        }
        LOG.debug("Scanned {} case(s) with severities {} over {}: {} match(es)",
                cases.size(), severities, range, matches.size());
        return matches;
    }

    static Map<String, List<KeywordMatch>> groupByBusinessUnit(List<KeywordMatch> matches) {
        Map<String, List<KeywordMatch>> groups = new LinkedHashMap<>();
        for (KeywordMatch match : matches) {
            groups.computeIfAbsent(match.getCaseRecord().getBusinessUnit(), bu -> new ArrayList<>())
                    .add(match);
        }
        return groups;
    }

    /**
     * Turn grouped matches into results. Groups smaller than the rules'
     * minimum case count are dropped.
     *
     * @param severityRule maps (case count, matched keywords) to a severity
     */
    static List<DetectionResult> toResults(AlertType type,
            TimeWindow window,
            Map<String, List<KeywordMatch>> groups,
            KeywordRules rules,
            BiFunction<Integer, Set<String>, Severity> severityRule) {
        List<DetectionResult> results = new ArrayList<>();
        for (Map.Entry<String, List<KeywordMatch>> group : groups.entrySet()) {
            List<KeywordMatch> members = group.getValue();
            if (members.size() < rules.getMinCaseCount()) {
                continue;
            }

            Set<String> keywords = new LinkedHashSet<>();
            List<String> sampleIds = new ArrayList<>();
            for (KeywordMatch member : members) {
                keywords.addAll(member.getMatchedKeywords());
                if (sampleIds.size() < DetectionResult.MAX_SAMPLE_CASES) {
                    sampleIds.add(member.getCaseRecord().getId());
                }
            }

            results.add(DetectionResult.builder()
                    .type(type)
                    .window(window)
                    .businessUnit(group.getKey())
                    .currentCount(members.size())
                    .matchedKeywords(new ArrayList<>(keywords))
                    .sampleCaseIds(sampleIds)
                    .severity(severityRule.apply(members.size(), keywords))
                    .build());
        }
        results.sort(ThresholdDetector.SEVERITY_THEN_COUNT);
        return results;
    }

    static List<KeywordMatch> limitToBusinessUnit(List<KeywordMatch> matches, String businessUnit, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
        }
        return matches.stream()
                .filter(m -> businessUnit.equals(m.getCaseRecord().getBusinessUnit()))
                .limit(limit)
                .toList();
    }
}
