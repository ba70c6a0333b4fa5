package com.casesentinel.core.config;

import com.casesentinel.core.model.Severity;
import com.casesentinel.core.model.TimeWindow;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable mirror of the alert configuration YAML, populated by SnakeYAML and
 * converted to an immutable {@link AlertConfig} by {@link #toAlertConfig()}.
 *
 * <p>
 * Expected YAML structure (every section is optional; omitted sections keep
 * the built-in defaults):
 * </p>
 *
 * <pre>
 * spike:
 *   factor: 1.5
 *   minBaseline: 5
 * thresholds:
 *   defaults: { hourly: 20, daily: 100, weekly: 500 }
 *   byBusinessUnit:
 *     Customer Service: { hourly: 30, daily: 150, weekly: 750 }
 * urgency:
 *   keywords: [lawsuit, injury]
 *   criticalKeywords: [lawsuit]
 *   qualifyingSeverities: [high, critical]
 *   minCaseCount: 1
 * misclassification:
 *   keywords: [refund, supervisor]
 * prediction:
 *   consecutiveDays: 3
 *   approachPercent: 80
 *   alertThreshold: 100
 *   growthMultiplier: 1.5
 *   minCases: 5
 * </pre>
 *
 * @since 1.0.0
 */
public class AlertConfigDocument {

    private SpikeSection spike;
    private ThresholdSection thresholds;
    private KeywordSection urgency;
    private KeywordSection misclassification;
    private PredictionSection prediction;

    public SpikeSection getSpike() {
        return spike;
    }

    public void setSpike(SpikeSection spike) {
        this.spike = spike;
    }

    public ThresholdSection getThresholds() {
        return thresholds;
    }

    public void setThresholds(ThresholdSection thresholds) {
        this.thresholds = thresholds;
    }

    public KeywordSection getUrgency() {
        return urgency;
    }

    public void setUrgency(KeywordSection urgency) {
        this.urgency = urgency;
    }

    public KeywordSection getMisclassification() {
        return misclassification;
    }

    public void setMisclassification(KeywordSection misclassification) {
        this.misclassification = misclassification;
    }

    public PredictionSection getPrediction() {
        return prediction;
    }

    public void setPrediction(PredictionSection prediction) {
        this.prediction = prediction;
    }

    /**
     * Convert to a validated, immutable configuration.
     *
     * @return the alert configuration
     * @throws ConfigurationException if any value is invalid or names an
     *                                unknown window or severity
     */
    public AlertConfig toAlertConfig() {
        AlertConfig.Builder builder = AlertConfig.builder();

        if (spike != null) {
            if (spike.getFactor() != null) {
                builder.spikeFactor(spike.getFactor());
            }
            if (spike.getMinBaseline() != null) {
                builder.minBaseline(spike.getMinBaseline());
            }
        }

        if (thresholds != null) {
            if (thresholds.getDefaults() != null) {
                builder.defaultThresholds(toTable("defaults", thresholds.getDefaults()));
            }
            if (thresholds.getByBusinessUnit() != null) {
                builder.clearThresholdOverrides();
                for (Map.Entry<String, Map<String, Integer>> entry : thresholds.getByBusinessUnit().entrySet()) {
                    builder.thresholdOverride(entry.getKey(), toTable(entry.getKey(), entry.getValue()));
                }
            }
        }

        if (urgency != null) {
            builder.urgency(urgency.toRules(AlertConfig.defaultUrgencyRules()));
        }
        if (misclassification != null) {
            builder.misclassification(misclassification.toRules(AlertConfig.defaultMisclassificationRules()));
        }
        if (prediction != null) {
            builder.prediction(prediction.toRules(PredictionRules.defaults()));
        }
        return builder.build();
    }

    private static ThresholdTable toTable(String owner, Map<String, Integer> raw) {
        if (raw == null) {
            throw new ConfigurationException("Threshold table for '" + owner + "' must not be empty");
        }
        Map<TimeWindow, Integer> limits = new EnumMap<>(TimeWindow.class);
        for (Map.Entry<String, Integer> entry : raw.entrySet()) {
            try {
                limits.put(TimeWindow.fromWireName(entry.getKey()), entry.getValue());
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Threshold table for '" + owner + "': " + e.getMessage(), e);
            }
        }
        return ThresholdTable.of(limits);
    }

    // ---------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------

    public static class SpikeSection {
        private Double factor;
        private Integer minBaseline;

        public Double getFactor() {
            return factor;
        }

        public void setFactor(Double factor) {
            this.factor = factor;
        }

        public Integer getMinBaseline() {
            return minBaseline;
        }

        public void setMinBaseline(Integer minBaseline) {
            this.minBaseline = minBaseline;
        }
    }

    public static class ThresholdSection {
        private Map<String, Integer> defaults;
        private Map<String, Map<String, Integer>> byBusinessUnit;

        public Map<String, Integer> getDefaults() {
            return defaults;
        }

        public void setDefaults(Map<String, Integer> defaults) {
            this.defaults = defaults;
        }

        public Map<String, Map<String, Integer>> getByBusinessUnit() {
            return byBusinessUnit;
        }

        public void setByBusinessUnit(Map<String, Map<String, Integer>> byBusinessUnit) {
            this.byBusinessUnit = byBusinessUnit;
        }
    }

    public static class KeywordSection {
        private List<String> keywords;
        private List<String> criticalKeywords;
        private List<String> qualifyingSeverities;
        private Integer minCaseCount;

        public List<String> getKeywords() {
            return keywords;
        }

        public void setKeywords(List<String> keywords) {
            this.keywords = keywords;
        }

        public List<String> getCriticalKeywords() {
            return criticalKeywords;
        }

        public void setCriticalKeywords(List<String> criticalKeywords) {
            this.criticalKeywords = criticalKeywords;
        }

        public List<String> getQualifyingSeverities() {
            return qualifyingSeverities;
        }

        public void setQualifyingSeverities(List<String> qualifyingSeverities) {
            this.qualifyingSeverities = qualifyingSeverities;
        }

        public Integer getMinCaseCount() {
            return minCaseCount;
        }

        public void setMinCaseCount(Integer minCaseCount) {
            this.minCaseCount = minCaseCount;
        }

        KeywordRules toRules(KeywordRules fallback) {
            List<Severity> severities = new ArrayList<>();
            if (qualifyingSeverities != null) {
                for (String value : qualifyingSeverities) {
                    try {
                        severities.add(Severity.fromWireName(value));
                    } catch (IllegalArgumentException | NullPointerException e) {
                        throw new ConfigurationException("Invalid qualifying severity: " + e.getMessage(), e);
                    }
                }
            }
            return new KeywordRules(
                    keywords != null ? keywords : fallback.getKeywords(),
                    criticalKeywords != null ? criticalKeywords : fallback.getCriticalKeywords(),
                    qualifyingSeverities != null ? severities : fallback.getQualifyingSeverities(),
                    minCaseCount != null ? minCaseCount : fallback.getMinCaseCount());
        }
    }

    public static class PredictionSection {
        private Integer consecutiveDays;
        private Double approachPercent;
        private Integer alertThreshold;
        private Double growthMultiplier;
        private Integer minCases;

        public Integer getConsecutiveDays() {
            return consecutiveDays;
        }

        public void setConsecutiveDays(Integer consecutiveDays) {
            this.consecutiveDays = consecutiveDays;
        }

        public Double getApproachPercent() {
            return approachPercent;
        }

        public void setApproachPercent(Double approachPercent) {
            this.approachPercent = approachPercent;
        }

        public Integer getAlertThreshold() {
            return alertThreshold;
        }

        public void setAlertThreshold(Integer alertThreshold) {
            this.alertThreshold = alertThreshold;
        }

        public Double getGrowthMultiplier() {
            return growthMultiplier;
        }

        public void setGrowthMultiplier(Double growthMultiplier) {
            this.growthMultiplier = growthMultiplier;
        }

        public Integer getMinCases() {
            return minCases;
        }

        public void setMinCases(Integer minCases) {
            this.minCases = minCases;
        }

        PredictionRules toRules(PredictionRules fallback) {
            return new PredictionRules(
                    consecutiveDays != null ? consecutiveDays : fallback.getConsecutiveDays(),
                    approachPercent != null ? approachPercent : fallback.getApproachPercent(),
                    alertThreshold != null ? alertThreshold : fallback.getAlertThreshold(),
                    growthMultiplier != null ? growthMultiplier : fallback.getGrowthMultiplier(),
                    minCases != null ? minCases : fallback.getMinCases());
        }
    }
}
