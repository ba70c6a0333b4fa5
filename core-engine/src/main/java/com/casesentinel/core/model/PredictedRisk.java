package com.casesentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A trending topic forecast to become an alert if its current pattern holds.
 *
 * <p>
 * Optional figures ({@code projectedCount}, {@code threshold},
 * {@code daysToThreshold}, {@code consecutiveDays}, {@code growthRate}) are
 * {@code null} when the pattern does not produce them.
 * </p>
 *
 * @since 1.0.0
 */
public final class PredictedRisk {

    private final String id;
    private final String term;
    private final PredictionType type;
    private final Severity severity;
    private final String title;
    private final String explanation;
    private final int currentCount;
    private final Integer projectedCount;
    private final Integer threshold;
    private final Integer daysToThreshold;
    private final Integer consecutiveDays;
    private final Double growthRate;
    private final List<String> impactedBusinessUnits;
    private final List<String> sampleCaseIds;
    private final Instant createdAt;

    private PredictedRisk(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.term = Objects.requireNonNull(builder.term, "term must not be null");
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.title = builder.title;
        this.explanation = builder.explanation;
        this.currentCount = builder.currentCount;
        this.projectedCount = builder.projectedCount;
        this.threshold = builder.threshold;
        this.daysToThreshold = builder.daysToThreshold;
        this.consecutiveDays = builder.consecutiveDays;
        this.growthRate = builder.growthRate;
        this.impactedBusinessUnits = List.copyOf(builder.impactedBusinessUnits);
        this.sampleCaseIds = List.copyOf(builder.sampleCaseIds);
        this.createdAt = builder.createdAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String term;
        private PredictionType type;
        private Severity severity;
        private String title;
        private String explanation;
        private int currentCount;
        private Integer projectedCount;
        private Integer threshold;
        private Integer daysToThreshold;
        private Integer consecutiveDays;
        private Double growthRate;
        private List<String> impactedBusinessUnits = Collections.emptyList();
        private List<String> sampleCaseIds = Collections.emptyList();
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder term(String term) {
            this.term = term;
            return this;
        }

        public Builder type(PredictionType type) {
            this.type = type;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder explanation(String explanation) {
            this.explanation = explanation;
            return this;
        }

        public Builder currentCount(int currentCount) {
            this.currentCount = currentCount;
            return this;
        }

        public Builder projectedCount(Integer projectedCount) {
            this.projectedCount = projectedCount;
            return this;
        }

        public Builder threshold(Integer threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder daysToThreshold(Integer daysToThreshold) {
            this.daysToThreshold = daysToThreshold;
            return this;
        }

        public Builder consecutiveDays(Integer consecutiveDays) {
            this.consecutiveDays = consecutiveDays;
            return this;
        }

        public Builder growthRate(Double growthRate) {
            this.growthRate = growthRate;
            return this;
        }

        public Builder impactedBusinessUnits(List<String> impactedBusinessUnits) {
            this.impactedBusinessUnits = Objects.requireNonNull(impactedBusinessUnits);
            return this;
        }

        public Builder sampleCaseIds(List<String> sampleCaseIds) {
            this.sampleCaseIds = Objects.requireNonNull(sampleCaseIds);
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public PredictedRisk build() {
            return new PredictedRisk(this);
        }
    }

    public String getId() {
        return id;
    }

    public String getTerm() {
        return term;
    }

    public PredictionType getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getTitle() {
        return title;
    }

    public String getExplanation() {
        return explanation;
    }

    public int getCurrentCount() {
        return currentCount;
    }

    public Integer getProjectedCount() {
        return projectedCount;
    }

    public Integer getThreshold() {
        return threshold;
    }

    public Integer getDaysToThreshold() {
        return daysToThreshold;
    }

    public Integer getConsecutiveDays() {
        return consecutiveDays;
    }

    public Double getGrowthRate() {
        return growthRate;
    }

    public List<String> getImpactedBusinessUnits() {
        return impactedBusinessUnits;
    }

    public List<String> getSampleCaseIds() {
        return sampleCaseIds;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PredictedRisk that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "PredictedRisk{" +
                "term='" + term + '\'' +
                ", type=" + type.wireName() +
                ", severity=" + severity.wireName() +
                ", currentCount=" + currentCount +
                '}';
    }
}
