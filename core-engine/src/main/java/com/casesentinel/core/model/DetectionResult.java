package com.casesentinel.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One alert candidate produced by a detector, before formatting.
 *
 * <p>
 * Results are plain values: two detections over unchanged data compare equal,
 * which makes the read phase easy to verify and to preview without writing.
 * </p>
 *
 * <ul>
 * <li>Spike results carry {@code category}, {@code baselineCount} and
 * {@code percentageChange}.</li>
 * <li>Threshold results carry {@code thresholdValue} and
 * {@code percentageChange} (excess over the limit).</li>
 * <li>Keyword results carry {@code matchedKeywords} and
 * {@code sampleCaseIds}.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class DetectionResult {

    /** Maximum number of sample case identifiers retained per result. */
    public static final int MAX_SAMPLE_CASES = 5;

    private final AlertType type;
    private final TimeWindow window;
    private final String businessUnit;
    private final String category;
    private final Integer baselineCount;
    private final Integer thresholdValue;
    private final int currentCount;
    private final Double percentageChange;
    private final List<String> matchedKeywords;
    private final List<String> sampleCaseIds;
    private final Severity severity;

    private DetectionResult(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.window = Objects.requireNonNull(builder.window, "window must not be null");
        this.businessUnit = Objects.requireNonNull(builder.businessUnit, "businessUnit must not be null");
        this.category = builder.category;
        this.baselineCount = builder.baselineCount;
        this.thresholdValue = builder.thresholdValue;
        this.currentCount = builder.currentCount;
        this.percentageChange = builder.percentageChange;
        this.matchedKeywords = List.copyOf(builder.matchedKeywords);
        List<String> samples = builder.sampleCaseIds;
        this.sampleCaseIds = List.copyOf(samples.size() > MAX_SAMPLE_CASES
                ? samples.subList(0, MAX_SAMPLE_CASES)
                : samples);
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private AlertType type;
        private TimeWindow window;
        private String businessUnit;
        private String category;
        private Integer baselineCount;
        private Integer thresholdValue;
        private int currentCount;
        private Double percentageChange;
        private List<String> matchedKeywords = Collections.emptyList();
        private List<String> sampleCaseIds = Collections.emptyList();
        private Severity severity;

        public Builder type(AlertType type) {
            this.type = type;
            return this;
        }

        public Builder window(TimeWindow window) {
            this.window = window;
            return this;
        }

        public Builder businessUnit(String businessUnit) {
            this.businessUnit = businessUnit;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder baselineCount(Integer baselineCount) {
            this.baselineCount = baselineCount;
            return this;
        }

        public Builder thresholdValue(Integer thresholdValue) {
            this.thresholdValue = thresholdValue;
            return this;
        }

        public Builder currentCount(int currentCount) {
            this.currentCount = currentCount;
            return this;
        }

        public Builder percentageChange(Double percentageChange) {
            this.percentageChange = percentageChange;
            return this;
        }

        public Builder matchedKeywords(List<String> matchedKeywords) {
            this.matchedKeywords = Objects.requireNonNull(matchedKeywords, "matchedKeywords must not be null");
            return this;
        }

        public Builder sampleCaseIds(List<String> sampleCaseIds) {
            this.sampleCaseIds = Objects.requireNonNull(sampleCaseIds, "sampleCaseIds must not be null");
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        /**
         * @throws NullPointerException if type, window, business unit or
         *                              severity is missing
         */
        public DetectionResult build() {
            return new DetectionResult(this);
        }
    }

    public AlertType getType() {
        return type;
    }

    public TimeWindow getWindow() {
        return window;
    }

    public String getBusinessUnit() {
        return businessUnit;
    }

    public String getCategory() {
        return category;
    }

    public Integer getBaselineCount() {
        return baselineCount;
    }

    public Integer getThresholdValue() {
        return thresholdValue;
    }

    public int getCurrentCount() {
        return currentCount;
    }

    public Double getPercentageChange() {
        return percentageChange;
    }

    /**
     * @return unmodifiable keywords in first-seen order
     */
    public List<String> getMatchedKeywords() {
        return matchedKeywords;
    }

    /**
     * @return unmodifiable list of at most {@value #MAX_SAMPLE_CASES} case ids
     */
    public List<String> getSampleCaseIds() {
        return sampleCaseIds;
    }

    public Severity getSeverity() {
        return severity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionResult that))
            return false;
        return currentCount == that.currentCount
                && type == that.type
                && window == that.window
                && severity == that.severity
                && businessUnit.equals(that.businessUnit)
                && Objects.equals(category, that.category)
                && Objects.equals(baselineCount, that.baselineCount)
                && Objects.equals(thresholdValue, that.thresholdValue)
                && Objects.equals(percentageChange, that.percentageChange)
                && matchedKeywords.equals(that.matchedKeywords)
                && sampleCaseIds.equals(that.sampleCaseIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, window, businessUnit, category, baselineCount, thresholdValue,
                currentCount, percentageChange, matchedKeywords, sampleCaseIds, severity);
    }

    @Override
    public String toString() {
        return "DetectionResult{" +
                "type=" + type.wireName() +
                ", window=" + window.wireName() +
                ", businessUnit='" + businessUnit + '\'' +
                ", category='" + category + '\'' +
                ", baselineCount=" + baselineCount +
                ", thresholdValue=" + thresholdValue +
                ", currentCount=" + currentCount +
                ", percentageChange=" + percentageChange +
                ", matchedKeywords=" + matchedKeywords +
                ", severity=" + severity.wireName() +
                '}';
    }
}
