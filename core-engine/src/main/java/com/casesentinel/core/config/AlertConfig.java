package com.casesentinel.core.config;

import com.casesentinel.core.model.Severity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed, immutable configuration for every detector.
 *
 * <p>
 * An instance is passed explicitly to each detector at construction; nothing
 * reads configuration from global state. Several configurations (per tenant,
 * per test) can therefore run side by side.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #defaults()} for the built-in values, {@link AlertConfigLoader}
 * to read YAML, or the {@link Builder}. The builder validates at
 * {@link Builder#build()} time and throws {@link ConfigurationException}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertConfig {

    public static final double DEFAULT_SPIKE_FACTOR = 1.5;
    public static final int DEFAULT_MIN_BASELINE = 5;
    public static final int DEFAULT_MIN_CASE_COUNT = 1;

    public static final List<String> DEFAULT_URGENCY_KEYWORDS = List.of(
            "safety", "legal", "threat", "lawsuit", "injury", "death",
            "dangerous", "hazard", "emergency", "urgent", "critical",
            "harm", "accident", "fatality", "attorney", "sue");

    public static final List<String> DEFAULT_URGENCY_CRITICAL_KEYWORDS = List.of(
            "death", "fatality", "lawsuit", "attorney", "emergency");

    public static final List<String> DEFAULT_MISCLASSIFICATION_KEYWORDS;

    public static final List<String> DEFAULT_MISCLASSIFICATION_CRITICAL_KEYWORDS = List.of(
            "death", "fatality", "lawsuit", "attorney", "emergency", "injury");

    static {
        List<String> broader = new ArrayList<>(DEFAULT_URGENCY_KEYWORDS);
        broader.addAll(List.of("complaint", "escalate", "supervisor", "manager", "refund"));
        DEFAULT_MISCLASSIFICATION_KEYWORDS = Collections.unmodifiableList(broader);
    }

    private final double spikeFactor;
    private final int minBaseline;
    private final ThresholdTable defaultThresholds;
    private final Map<String, ThresholdTable> thresholdsByBusinessUnit;
    private final KeywordRules urgency;
    private final KeywordRules misclassification;
    private final PredictionRules prediction;

    private AlertConfig(Builder b) {
        this.spikeFactor = b.spikeFactor;
        this.minBaseline = b.minBaseline;
        this.defaultThresholds = b.defaultThresholds;
        this.thresholdsByBusinessUnit = Collections.unmodifiableMap(new LinkedHashMap<>(b.thresholdsByBusinessUnit));
        this.urgency = b.urgency;
        this.misclassification = b.misclassification;
        this.prediction = b.prediction;
    }

    /**
     * @return configuration with every built-in default
     */
    public static AlertConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static KeywordRules defaultUrgencyRules() {
        return new KeywordRules(DEFAULT_URGENCY_KEYWORDS, DEFAULT_URGENCY_CRITICAL_KEYWORDS,
                EnumSet.of(Severity.HIGH, Severity.CRITICAL), DEFAULT_MIN_CASE_COUNT);
    }

    public static KeywordRules defaultMisclassificationRules() {
        return new KeywordRules(DEFAULT_MISCLASSIFICATION_KEYWORDS, DEFAULT_MISCLASSIFICATION_CRITICAL_KEYWORDS,
                EnumSet.of(Severity.LOW, Severity.MEDIUM), DEFAULT_MIN_CASE_COUNT);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return multiplier the current count must strictly exceed relative to
     *         the baseline
     */
    public double getSpikeFactor() {
        return spikeFactor;
    }

    /**
     * @return smallest baseline count a spike may be judged against
     */
    public int getMinBaseline() {
        return minBaseline;
    }

    public ThresholdTable getDefaultThresholds() {
        return defaultThresholds;
    }

    public Map<String, ThresholdTable> getThresholdsByBusinessUnit() {
        return thresholdsByBusinessUnit;
    }

    public Optional<ThresholdTable> thresholdOverride(String businessUnit) {
        return Optional.ofNullable(thresholdsByBusinessUnit.get(businessUnit));
    }

    public KeywordRules getUrgency() {
        return urgency;
    }

    public KeywordRules getMisclassification() {
        return misclassification;
    }

    public PredictionRules getPrediction() {
        return prediction;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AlertConfig}, pre-loaded with the built-in
     * defaults.
     */
    public static class Builder {
        private double spikeFactor = DEFAULT_SPIKE_FACTOR;
        private int minBaseline = DEFAULT_MIN_BASELINE;
        private ThresholdTable defaultThresholds = ThresholdTable.of(20, 100, 500);
        private final Map<String, ThresholdTable> thresholdsByBusinessUnit = new LinkedHashMap<>();
        private KeywordRules urgency = defaultUrgencyRules();
        private KeywordRules misclassification = defaultMisclassificationRules();
        private PredictionRules prediction = PredictionRules.defaults();

        Builder() {
            thresholdsByBusinessUnit.put("Customer Service", ThresholdTable.of(30, 150, 750));
            thresholdsByBusinessUnit.put("Technical Support", ThresholdTable.of(25, 120, 600));
        }

        public Builder spikeFactor(double v) {
            this.spikeFactor = v;
            return this;
        }

        public Builder minBaseline(int v) {
            this.minBaseline = v;
            return this;
        }

        public Builder defaultThresholds(ThresholdTable v) {
            this.defaultThresholds = v;
            return this;
        }

        public Builder thresholdOverride(String businessUnit, ThresholdTable table) {
            Objects.requireNonNull(businessUnit, "businessUnit must not be null");
            Objects.requireNonNull(table, "table must not be null");
            this.thresholdsByBusinessUnit.put(businessUnit, table);
            return this;
        }

        /**
         * Drop every per-business-unit override, including the built-in ones.
         */
        public Builder clearThresholdOverrides() {
            this.thresholdsByBusinessUnit.clear();
            return this;
        }

        public Builder urgency(KeywordRules v) {
            this.urgency = v;
            return this;
        }

        public Builder misclassification(KeywordRules v) {
            this.misclassification = v;
            return this;
        }

        public Builder prediction(PredictionRules v) {
            this.prediction = v;
            return this;
        }

        /**
         * @return a validated {@link AlertConfig}
         * @throws ConfigurationException if any value is out of range
         */
        public AlertConfig build() {
            if (!(spikeFactor > 0) || Double.isInfinite(spikeFactor)) {
                throw new ConfigurationException("spikeFactor must be a finite value > 0, got: " + spikeFactor);
            }
            if (minBaseline < 1) {
                throw new ConfigurationException("minBaseline must be >= 1, got: " + minBaseline);
            }
            if (defaultThresholds == null) {
                throw new ConfigurationException("defaultThresholds must not be null");
            }
            if (urgency == null || misclassification == null) {
                throw new ConfigurationException("urgency and misclassification rules are required");
            }
            if (prediction == null) {
                throw new ConfigurationException("prediction rules are required");
            }
            return new AlertConfig(this);
        }
    }

    @Override
    public String toString() {
        return "AlertConfig{" +
                "spikeFactor=" + spikeFactor +
                ", minBaseline=" + minBaseline +
                ", defaultThresholds=" + defaultThresholds +
                ", thresholdOverrides=" + thresholdsByBusinessUnit.keySet() +
                ", urgency=" + urgency +
                ", misclassification=" + misclassification +
                ", prediction=" + prediction +
                '}';
    }
}
