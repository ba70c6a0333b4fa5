package com.casesentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A term whose case volume is rising, ranked by trend score.
 *
 * @since 1.0.0
 */
public final class TrendingTopic {

    private final String id;
    private final String topic;
    private final String description;
    private final int caseCount;
    private final int baselineCount;
    private final TrendDirection direction;
    private final double percentageChange;
    private final double trendScore;
    private final String businessUnit;
    private final String category;
    private final List<String> impactedBusinessUnits;
    private final List<String> sampleCaseIds;
    private final Instant createdAt;
    private final Instant updatedAt;

    private TrendingTopic(Builder builder) {
        this.id = builder.id;
        this.topic = Objects.requireNonNull(builder.topic, "topic must not be null");
        this.description = builder.description;
        this.caseCount = builder.caseCount;
        this.baselineCount = builder.baselineCount;
        this.direction = Objects.requireNonNull(builder.direction, "direction must not be null");
        this.percentageChange = builder.percentageChange;
        this.trendScore = builder.trendScore;
        this.businessUnit = builder.businessUnit;
        this.category = builder.category;
        this.impactedBusinessUnits = List.copyOf(builder.impactedBusinessUnits);
        this.sampleCaseIds = List.copyOf(builder.sampleCaseIds);
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .topic(topic)
                .description(description)
                .caseCount(caseCount)
                .baselineCount(baselineCount)
                .direction(direction)
                .percentageChange(percentageChange)
                .trendScore(trendScore)
                .businessUnit(businessUnit)
                .category(category)
                .impactedBusinessUnits(impactedBusinessUnits)
                .sampleCaseIds(sampleCaseIds)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static class Builder {
        private String id;
        private String topic;
        private String description;
        private int caseCount;
        private int baselineCount;
        private TrendDirection direction;
        private double percentageChange;
        private double trendScore;
        private String businessUnit;
        private String category;
        private List<String> impactedBusinessUnits = Collections.emptyList();
        private List<String> sampleCaseIds = Collections.emptyList();
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder topic(String topic) {
            this.topic = topic;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder caseCount(int caseCount) {
            this.caseCount = caseCount;
            return this;
        }

        public Builder baselineCount(int baselineCount) {
            this.baselineCount = baselineCount;
            return this;
        }

        public Builder direction(TrendDirection direction) {
            this.direction = direction;
            return this;
        }

        public Builder percentageChange(double percentageChange) {
            this.percentageChange = percentageChange;
            return this;
        }

        public Builder trendScore(double trendScore) {
            this.trendScore = trendScore;
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

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public TrendingTopic build() {
            return new TrendingTopic(this);
        }
    }

    public String getId() {
        return id;
    }

    public String getTopic() {
        return topic;
    }

    public String getDescription() {
        return description;
    }

    public int getCaseCount() {
        return caseCount;
    }

    public int getBaselineCount() {
        return baselineCount;
    }

    public TrendDirection getDirection() {
        return direction;
    }

    public double getPercentageChange() {
        return percentageChange;
    }

    public double getTrendScore() {
        return trendScore;
    }

    public String getBusinessUnit() {
        return businessUnit;
    }

    public String getCategory() {
        return category;
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

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrendingTopic that))
            return false;
        return caseCount == that.caseCount
                && baselineCount == that.baselineCount
                && Double.compare(trendScore, that.trendScore) == 0
                && Objects.equals(id, that.id)
                && topic.equals(that.topic)
                && direction == that.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, topic, caseCount, baselineCount, direction, trendScore);
    }

    @Override
    public String toString() {
        return "TrendingTopic{" +
                "topic='" + topic + '\'' +
                ", caseCount=" + caseCount +
                ", baselineCount=" + baselineCount +
                ", direction=" + direction.wireName() +
                ", trendScore=" + trendScore +
                '}';
    }
}
