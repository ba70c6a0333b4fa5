package com.casesentinel.core.alert;

import com.casesentinel.core.model.Alert;
import com.casesentinel.core.model.AlertType;
import com.casesentinel.core.model.DetectionResult;
import com.casesentinel.core.model.TimeWindow;

import java.util.List;
import java.util.Objects;

/**
 * Renders detection results into unsaved {@link Alert} drafts.
 *
 * <h3>Templates</h3>
 * <ul>
 * <li>spike: {@code "Billing: Refunds +60% vs previous 24 hours"}</li>
 * <li>threshold: {@code "High volume: 150 cases in Billing"}</li>
 * <li>urgency: {@code "Urgent: 2 high-risk cases detected in Billing"}</li>
 * <li>misclassification:
 * {@code "Review needed: 1 potentially misclassified case in Billing"}</li>
 * </ul>
 *
 * <p>
 * Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertFormatter {

    static final int MAX_LISTED_KEYWORDS = 5;

    /**
     * @return a draft with no id, no timestamps and status {@code active}
     * @throws AlertFormattingException if a value the template needs is
     *                                  missing or blank
     */
    public Alert format(DetectionResult result) {
        Objects.requireNonNull(result, "DetectionResult must not be null");
        String businessUnit = requireText(result.getBusinessUnit(), "businessUnit", result);

        Alert.Builder draft = Alert.builder()
                .type(result.getType())
                .severity(result.getSeverity())
                .businessUnit(businessUnit)
                .category(result.getCategory())
                .currentValue(result.getCurrentCount());

        return switch (result.getType()) {
            case SPIKE -> spike(draft, result, businessUnit);
            case THRESHOLD -> threshold(draft, result, businessUnit);
            case URGENCY -> urgency(draft, result, businessUnit);
            case MISCLASSIFICATION -> misclassification(draft, result, businessUnit);
        };
    }

    /**
     * Format every result; the first malformed result fails the whole batch.
     */
    public List<Alert> formatAll(List<DetectionResult> results) {
        Objects.requireNonNull(results, "results must not be null");
        return results.stream().map(this::format).toList();
    }

    // ---------------------------------------------------------------
    // Templates
    // ---------------------------------------------------------------

    private static Alert spike(Alert.Builder draft, DetectionResult result, String businessUnit) {
        String category = requireText(result.getCategory(), "category", result);
        Integer baseline = require(result.getBaselineCount(), "baselineCount", result);
        long pct = Math.round(require(result.getPercentageChange(), "percentageChange", result));
        TimeWindow window = result.getWindow();

        return draft
                .title(businessUnit + ": " + category + " +" + pct + "% " + window.getLabel())
                .description(category + " case volume in " + businessUnit + " increased by " + pct
                        + "% in the last " + window.hoursDescription() + ". Current: "
                        + result.getCurrentCount() + " cases (baseline: " + baseline + ").")
                .baselineValue(baseline)
                .percentageChange(result.getPercentageChange())
                .build();
    }

    private static Alert threshold(Alert.Builder draft, DetectionResult result, String businessUnit) {
        int threshold = require(result.getThresholdValue(), "thresholdValue", result);
        if (threshold <= 0) {
            throw new AlertFormattingException("Threshold must be > 0 in " + result);
        }
        int count = result.getCurrentCount();
        int excess = count - threshold;
        double pctOver = excess * 100.0 / threshold;

        return draft
                .title("High volume: " + count + " cases in " + businessUnit)
                .description("Case volume in " + businessUnit + " has exceeded the threshold. Current: "
                        + count + " cases in the last " + result.getWindow().spanDescription()
                        + " (threshold: " + threshold + ", +" + excess + " cases / +"
                        + Math.round(pctOver) + "% over limit).")
                .baselineValue(threshold)
                .percentageChange(pctOver)
                .build();
    }

    private static Alert urgency(Alert.Builder draft, DetectionResult result, String businessUnit) {
        int n = result.getCurrentCount();
        return draft
                .title("Urgent: " + n + " high-risk " + plural("case", n) + " detected in " + businessUnit)
                .description(n + " high-severity " + plural("case", n) + " in " + businessUnit + " "
                        + verb("contain", n) + " risk indicators in the last "
                        + result.getWindow().spanDescription() + ". Keywords detected: "
                        + keywordList(result) + ". Immediate review recommended.")
                .build();
    }

    private static Alert misclassification(Alert.Builder draft, DetectionResult result, String businessUnit) {
        int n = result.getCurrentCount();
        return draft
                .title("Review needed: " + n + " potentially misclassified " + plural("case", n)
                        + " in " + businessUnit)
                .description(n + " low-severity " + plural("case", n) + " in " + businessUnit + " "
                        + verb("contain", n) + " risk indicators that may warrant reclassification. "
                        + "Found in the last " + result.getWindow().spanDescription()
                        + ". Keywords detected: " + keywordList(result)
                        + ". Review recommended to ensure proper severity assignment.")
                .build();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static String keywordList(DetectionResult result) {
        List<String> keywords = result.getMatchedKeywords();
        if (keywords.isEmpty()) {
            throw new AlertFormattingException("No matched keywords in " + result);
        }
        for (String keyword : keywords) {
            requireText(keyword, "matchedKeywords", result);
        }
        String listed = String.join(", ", keywords.subList(0, Math.min(MAX_LISTED_KEYWORDS, keywords.size())));
        if (keywords.size() > MAX_LISTED_KEYWORDS) {
            listed += " (+" + (keywords.size() - MAX_LISTED_KEYWORDS) + " more)";
        }
        return listed;
    }

    private static String plural(String noun, int n) {
        return n == 1 ? noun : noun + "s";
    }

    private static String verb(String verb, int n) {
        return n == 1 ? verb + "s" : verb;
    }

    private static String requireText(String value, String field, DetectionResult result) {
        if (value == null || value.isBlank()) {
            throw new AlertFormattingException(
                    "Missing " + field + " for " + result.getType().wireName() + " alert: " + result);
        }
        return value;
    }

    private static <T> T require(T value, String field, DetectionResult result) {
        if (value == null) {
            throw new AlertFormattingException(
                    "Missing " + field + " for " + result.getType().wireName() + " alert: " + result);
        }
        return value;
    }
}
