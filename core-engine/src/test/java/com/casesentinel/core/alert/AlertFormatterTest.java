package com.casesentinel.core.alert;

import com.casesentinel.core.model.Alert;
import com.casesentinel.core.model.AlertStatus;
import com.casesentinel.core.model.AlertType;
import com.casesentinel.core.model.DetectionResult;
import com.casesentinel.core.model.Severity;
import com.casesentinel.core.model.TimeWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertFormatter}.
 */
class AlertFormatterTest {

    private final AlertFormatter formatter = new AlertFormatter();

    @Test
    @DisplayName("Spike alert carries baseline, current and rounded change")
    void spike() {
        Alert alert = formatter.format(DetectionResult.builder()
                .type(AlertType.SPIKE)
                .window(TimeWindow.WEEKLY)
                .businessUnit("Billing")
                .category("Refunds")
                .baselineCount(10)
                .currentCount(16)
                .percentageChange(60.4)
                .severity(Severity.LOW)
                .build());

        assertThat(alert.getTitle()).isEqualTo("Billing: Refunds +60% vs last week");
        assertThat(alert.getDescription()).isEqualTo(
                "Refunds case volume in Billing increased by 60% in the last 168 hours. "
                        + "Current: 16 cases (baseline: 10).");
        assertThat(alert.getBaselineValue()).isEqualTo(10);
        assertThat(alert.getCurrentValue()).isEqualTo(16);
        assertThat(alert.getPercentageChange()).isEqualTo(60.4);
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.ACTIVE);
        assertThat(alert.getId()).isNull();
    }

    @Test
    @DisplayName("Threshold alert states excess and percent over limit")
    void threshold() {
        Alert alert = formatter.format(DetectionResult.builder()
                .type(AlertType.THRESHOLD)
                .window(TimeWindow.DAILY)
                .businessUnit("Billing")
                .thresholdValue(100)
                .currentCount(150)
                .percentageChange(50.0)
                .severity(Severity.MEDIUM)
                .build());

        assertThat(alert.getTitle()).isEqualTo("High volume: 150 cases in Billing");
        assertThat(alert.getDescription()).isEqualTo(
                "Case volume in Billing has exceeded the threshold. Current: 150 cases in the last 1 day "
                        + "(threshold: 100, +50 cases / +50% over limit).");
        assertThat(alert.getBaselineValue()).isEqualTo(100);
        assertThat(alert.getPercentageChange()).isEqualTo(50.0);
        assertThat(alert.getCategory()).isNull();
    }

    @Test
    @DisplayName("Urgency alert uses singular wording for one case")
    void urgencySingular() {
        Alert alert = formatter.format(keywordResult(AlertType.URGENCY, 1, List.of("lawsuit")));

        assertThat(alert.getTitle()).isEqualTo("Urgent: 1 high-risk case detected in Billing");
        assertThat(alert.getDescription()).isEqualTo(
                "1 high-severity case in Billing contains risk indicators in the last 4 hours. "
                        + "Keywords detected: lawsuit. Immediate review recommended.");
        assertThat(alert.getBaselineValue()).isNull();
        assertThat(alert.getPercentageChange()).isNull();
        assertThat(alert.getCurrentValue()).isEqualTo(1);
    }

    @Test
    @DisplayName("Keyword list is capped at five with a remainder note")
    void keywordCap() {
        Alert alert = formatter.format(keywordResult(AlertType.URGENCY, 3,
                List.of("a1", "b2", "c3", "d4", "e5", "f6", "g7")));

        assertThat(alert.getTitle()).isEqualTo("Urgent: 3 high-risk cases detected in Billing");
        assertThat(alert.getDescription())
                .contains("3 high-severity cases in Billing contain risk indicators")
                .contains("Keywords detected: a1, b2, c3, d4, e5 (+2 more).");
    }

    @Test
    @DisplayName("Misclassification alert recommends review")
    void misclassification() {
        Alert alert = formatter.format(keywordResult(AlertType.MISCLASSIFICATION, 2, List.of("refund")));

        assertThat(alert.getTitle()).isEqualTo("Review needed: 2 potentially misclassified cases in Billing");
        assertThat(alert.getDescription()).isEqualTo(
                "2 low-severity cases in Billing contain risk indicators that may warrant reclassification. "
                        + "Found in the last 4 hours. Keywords detected: refund. "
                        + "Review recommended to ensure proper severity assignment.");
    }

    @Test
    @DisplayName("Blank business unit fails formatting")
    void blankBusinessUnit() {
        DetectionResult result = DetectionResult.builder()
                .type(AlertType.THRESHOLD)
                .window(TimeWindow.DAILY)
                .businessUnit("  ")
                .thresholdValue(100)
                .currentCount(150)
                .severity(Severity.MEDIUM)
                .build();

        assertThatThrownBy(() -> formatter.format(result))
                .isInstanceOf(AlertFormattingException.class)
                .hasMessageContaining("businessUnit");
    }

    @Test
    @DisplayName("Spike without category fails formatting")
    void spikeWithoutCategory() {
        DetectionResult result = DetectionResult.builder()
                .type(AlertType.SPIKE)
                .window(TimeWindow.DAILY)
                .businessUnit("Billing")
                .baselineCount(10)
                .currentCount(16)
                .percentageChange(60.0)
                .severity(Severity.LOW)
                .build();

        assertThatThrownBy(() -> formatter.format(result)).isInstanceOf(AlertFormattingException.class);
    }

    @Test
    @DisplayName("One malformed result fails the whole batch")
    void batchFails() {
        List<DetectionResult> batch = List.of(
                keywordResult(AlertType.URGENCY, 1, List.of("lawsuit")),
                keywordResult(AlertType.URGENCY, 1, List.of()));

        assertThatThrownBy(() -> formatter.formatAll(batch)).isInstanceOf(AlertFormattingException.class);
    }

    private static DetectionResult keywordResult(AlertType type, int count, List<String> keywords) {
        return DetectionResult.builder()
                .type(type)
                .window(TimeWindow.HOURLY)
                .businessUnit("Billing")
                .currentCount(count)
                .matchedKeywords(keywords)
                .severity(Severity.HIGH)
                .build();
    }
}
