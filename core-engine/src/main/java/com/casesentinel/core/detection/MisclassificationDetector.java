package com.casesentinel.core.detection;

import com.casesentinel.core.config.AlertConfig;
import com.casesentinel.core.config.ConfigurationException;
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
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Misclassification detector.
 *
 * <p>
 * Flags low and medium severity cases whose summaries carry risk indicators,
 * suggesting the case was rated too low. High and critical cases belong to
 * {@link UrgencyDetector} and are excluded here even if the configuration
 * lists them.
 * </p>
 *
 * @since 1.0.0
 */
public class MisclassificationDetector implements AlertDetector {

    private static final Logger LOG = LoggerFactory.getLogger(MisclassificationDetector.class);

    private static final Set<Severity> OUT_OF_SCOPE = EnumSet.of(Severity.HIGH, Severity.CRITICAL);

    private final KeywordCaseScanner scanner;
    private final KeywordRules rules;
    private final Set<Severity> severities;
    private final Clock clock;

    /**
     * @throws ConfigurationException if no low or medium severity qualifies
     */
    public MisclassificationDetector(CaseStore caseStore, AlertConfig config, KeywordMatcher matcher, Clock clock) {
        Objects.requireNonNull(config, "AlertConfig must not be null");
        this.scanner = new KeywordCaseScanner(caseStore, matcher);
        this.rules = config.getMisclassification();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        EnumSet<Severity> scoped = EnumSet.copyOf(rules.getQualifyingSeverities());
        scoped.removeAll(OUT_OF_SCOPE);
        if (scoped.isEmpty()) {
            throw new ConfigurationException(
                    "Misclassification rules must qualify at least one of low or medium, got: "
                            + rules.getQualifyingSeverities());
        }
        this.severities = Collections.unmodifiableSet(scoped);
    }

    @Override
    public List<DetectionResult> detect(TimeWindow window) {
        Objects.requireNonNull(window, "window must not be null");
        List<KeywordMatch> matches = matches(window);

        List<DetectionResult> results = KeywordCaseScanner.toResults(AlertType.MISCLASSIFICATION, window,
                KeywordCaseScanner.groupByBusinessUnit(matches), rules, this::severityFor);
        LOG.info("Misclassification detection ({}): {} matching case(s), {} alert candidate(s)",
                window.wireName(), matches.size(), results.size());
        return results;
    }

    public List<KeywordMatch> findSampleCases(String businessUnit, TimeWindow window, int limit) {
        Objects.requireNonNull(businessUnit, "businessUnit must not be null");
        Objects.requireNonNull(window, "window must not be null");
        return KeywordCaseScanner.limitToBusinessUnit(matches(window), businessUnit, limit);
    }

    @Override
    public AlertType getType() {
        return AlertType.MISCLASSIFICATION;
    }

    private List<KeywordMatch> matches(TimeWindow window) {
        WindowBounds bounds = WindowCalculator.bounds(window, clock.instant());
        return scanner.scan(bounds.getCurrent(), severities, rules.getKeywords());
    }

    Severity severityFor(int caseCount, Set<String> keywords) {
        if (caseCount >= UrgencyDetector.ESCALATION_CASE_COUNT || rules.containsCritical(keywords)) {
            return Severity.HIGH;
        }
        return Severity.MEDIUM;
    }
}
