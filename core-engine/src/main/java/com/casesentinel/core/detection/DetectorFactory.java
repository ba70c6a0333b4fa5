package com.casesentinel.core.detection;

import com.casesentinel.core.aggregation.CaseAggregator;
import com.casesentinel.core.config.AlertConfig;
import com.casesentinel.core.model.AlertType;
import com.casesentinel.core.store.CaseStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Creates {@link AlertDetector} instances for {@link AlertType}s.
 *
 * <p>
 * This is the single point of extension when adding new alert types:
 * add the enum constant and wire the corresponding detector here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class — not instantiable
    }

    /**
     * Create a detector for the given type.
     *
     * @param type      alert type; must not be {@code null}
     * @param caseStore read access to cases
     * @param config    detection configuration
     * @param clock     source of "now" for window bounds
     * @return a detector producing {@code type} results
     * @throws NullPointerException if any argument is {@code null}
     */
    public static AlertDetector create(AlertType type, CaseStore caseStore, AlertConfig config, Clock clock) {
        Objects.requireNonNull(type, "AlertType must not be null");
        Objects.requireNonNull(caseStore, "caseStore must not be null");
        Objects.requireNonNull(config, "AlertConfig must not be null");
        Objects.requireNonNull(clock, "clock must not be null");

        return switch (type) {
            case SPIKE -> new SpikeDetector(new CaseAggregator(caseStore), config, clock);
            case THRESHOLD -> new ThresholdDetector(new CaseAggregator(caseStore), config, clock);
            case URGENCY -> new UrgencyDetector(caseStore, config, new SubstringKeywordMatcher(), clock);
            case MISCLASSIFICATION ->
                    new MisclassificationDetector(caseStore, config, new SubstringKeywordMatcher(), clock);
        };
    }

    /**
     * Create one detector per requested type, in iteration order.
     *
     * @return unmodifiable list of detectors
     */
    public static List<AlertDetector> createAll(Collection<AlertType> types,
            CaseStore caseStore,
            AlertConfig config,
            Clock clock) {
        Objects.requireNonNull(types, "types must not be null");
        LOG.info("Creating {} detector(s): {}", types.size(), types);
        List<AlertDetector> detectors = types.stream()
                .map(type -> create(type, caseStore, config, clock))
                .toList();
        return Collections.unmodifiableList(detectors);
    }
}
