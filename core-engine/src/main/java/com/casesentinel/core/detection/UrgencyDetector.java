package com.casesentinel.core.detection;

import com.casesentinel.core.config.AlertConfig;
import com.casesentinel.core.config.KeywordRules;
import com.casesentinel.core.model.AlertType;
import com.casesentinel.core.model.DetectionResult;
import com.casesentinel.core.model.Severity;
import com.casesentinel.core.model.TimeWindow;
import com.casesentinel.core.model.WindowBounds;
import com.casesentinel.core.store.CaseStore;
import com.casesentinel.core.window.WindowCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Urgency detector.
 *
 * <p>
 * Looks at high and critical severity cases from the current period and
 * reports, per business unit, those whose summaries mention risk keywords
 * such as legal threats or safety hazards.
 * </p>
 *
 * <h3>Severity</h3>
 * <p>
 * {@code critical} when a business unit has five or more matching cases or
 * any matched keyword is in the critical subset, {@code high} otherwise.
 * </p>
 *
 * @since 1.0.0
 */
public class UrgencyDetector implements AlertDetector {

    private static final Logger LOG = LoggerFactory.getLogger(UrgencyDetector.class);

    static final int ESCALATION_CASE_COUNT = 5;

    private final KeywordCaseScanner scanner;
    private final KeywordRules rules;
    private final Clock clock;

    public UrgencyDetector(CaseStore caseStore, AlertConfig config, KeywordMatcher matcher, Clock clock) {
        Objects.requireNonNull(config, "AlertConfig must not be null");
        this.scanner = new KeywordCaseScanner(caseStore, matcher);
        this.rules = config.getUrgency();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public List<DetectionResult> detect(TimeWindow window) {
        Objects.requireNonNull(window, "window must not be null");
        List<KeywordMatch> matches = matches(window);

        List<DetectionResult> results = KeywordCaseScanner.toResults(AlertType.URGENCY, window,
                KeywordCaseScanner.groupByBusinessUnit(matches), rules, this::severityFor);
        LOG.info("Urgency detection ({}): {} matching case(s), {} alert candidate(s)",
                window.wireName(), matches.size(), results.size());
        return results;
    }

    /**
     * Matching cases of one business unit, in creation order, with the
     * keywords each matched.
     *
     * @param limit maximum number of cases to return
     */
    public List<KeywordMatch> findSampleCases(String businessUnit, TimeWindow window, int limit) {
        Objects.requireNonNull(businessUnit, "businessUnit must not be null");
        Objects.requireNonNull(window, "window must not be null");
        return KeywordCaseScanner.limitToBusinessUnit(matches(window), businessUnit, limit);
    }

    @Override
    public AlertType getType() {
        return AlertType.URGENCY;
    }

    private List<KeywordMatch> matches(TimeWindow window) {
        WindowBounds bounds = WindowCalculator.bounds(window, clock.instant());
        return scanner.scan(bounds.getCurrent(), rules.getQualifyingSeverities(), rules.getKeywords());
    }

    Severity severityFor(int caseCount, Set<String> keywords) {
        if (caseCount >= ESCALATION_CASE_COUNT || rules.containsCritical(keywords)) {
            return Severity.CRITICAL;
        }
        return Severity.HIGH;
    }
}
