package com.casesentinel.core.config;

import java.util.Objects;

/**
 * Settings for predicted-risk forecasting over trending topics.
 *
 * <ul>
 * <li>{@code consecutiveDays}: rising days in a row before a sustained
 * increase is reported</li>
 * <li>{@code approachPercent}: share of the alert threshold at which a topic
 * counts as approaching it</li>
 * <li>{@code alertThreshold}: case count used as the threshold when a request
 * names none</li>
 * <li>{@code growthMultiplier}: how much faster recent growth must be than
 * earlier growth to count as accelerating</li>
 * <li>{@code minCases}: topics with fewer current cases are not forecast</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class PredictionRules {

    private final int consecutiveDays;
    private final double approachPercent;
    private final int alertThreshold;
    private final double growthMultiplier;
    private final int minCases;

    /**
     * @throws ConfigurationException if any value is out of range
     */
    public PredictionRules(int consecutiveDays, double approachPercent, int alertThreshold,
            double growthMultiplier, int minCases) {
        if (consecutiveDays < 2) {
            throw new ConfigurationException("consecutiveDays must be >= 2, got: " + consecutiveDays);
        }
        if (!(approachPercent > 0.0) || approachPercent >= 100.0) {
            throw new ConfigurationException(
                    "approachPercent must be in (0, 100), got: " + approachPercent);
        }
        if (alertThreshold < 1) {
            throw new ConfigurationException("alertThreshold must be >= 1, got: " + alertThreshold);
        }
        if (!(growthMultiplier > 0.0) || Double.isInfinite(growthMultiplier)) {
            throw new ConfigurationException(
                    "growthMultiplier must be a positive number, got: " + growthMultiplier);
        }
        if (minCases < 1) {
            throw new ConfigurationException("minCases must be >= 1, got: " + minCases);
        }
        this.consecutiveDays = consecutiveDays;
        this.approachPercent = approachPercent;
        this.alertThreshold = alertThreshold;
        this.growthMultiplier = growthMultiplier;
        this.minCases = minCases;
    }

    public static PredictionRules defaults() {
        return new PredictionRules(3, 80.0, 100, 1.5, 5);
    }

    public int getConsecutiveDays() {
        return consecutiveDays;
    }

    public double getApproachPercent() {
        return approachPercent;
    }

    public int getAlertThreshold() {
        return alertThreshold;
    }

    public double getGrowthMultiplier() {
        return growthMultiplier;
    }

    public int getMinCases() {
        return minCases;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PredictionRules)) {
            return false;
        }
        PredictionRules that = (PredictionRules) o;
        return consecutiveDays == that.consecutiveDays
                && Double.compare(approachPercent, that.approachPercent) == 0
                && alertThreshold == that.alertThreshold
                && Double.compare(growthMultiplier, that.growthMultiplier) == 0
                && minCases == that.minCases;
    }

    @Override
    public int hashCode() {
        return Objects.hash(consecutiveDays, approachPercent, alertThreshold,
                growthMultiplier, minCases);
    }

    @Override
    public String toString() {
        return "PredictionRules{consecutiveDays=" + consecutiveDays
                + ", approachPercent=" + approachPercent
                + ", alertThreshold=" + alertThreshold
                + ", growthMultiplier=" + growthMultiplier
                + ", minCases=" + minCases + '}';
    }
}
