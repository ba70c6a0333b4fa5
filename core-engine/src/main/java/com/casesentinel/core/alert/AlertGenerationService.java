package com.casesentinel.core.alert;

import com.casesentinel.core.detection.AlertDetector;
import com.casesentinel.core.model.Alert;
import com.casesentinel.core.model.AlertType;
import com.casesentinel.core.model.DetectionResult;
import com.casesentinel.core.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Entry point of the alert pipeline: detect, format, write.
 *
 * <p>
 * {@link #detect} is read-only and suitable for dry runs.
 * {@link #generateAndPersist} formats every result before writing anything,
 * so a formatting failure leaves the store untouched. The write is skipped,
 * and {@link CancellationException} thrown, when the caller has given up on
 * the run by the time the batch is ready.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertGenerationService {

    private static final Logger LOG = LoggerFactory.getLogger(AlertGenerationService.class);

    private final Map<AlertType, AlertDetector> detectors = new EnumMap<>(AlertType.class);
    private final AlertFormatter formatter;
    private final AlertWriter writer;

    /**
     * @throws IllegalArgumentException if two detectors share a type
     */
    public AlertGenerationService(Collection<AlertDetector> detectors, AlertFormatter formatter, AlertWriter writer) {
        Objects.requireNonNull(detectors, "detectors must not be null");
        for (AlertDetector detector : detectors) {
            if (this.detectors.put(detector.getType(), detector) != null) {
                throw new IllegalArgumentException("Duplicate detector for type " + detector.getType());
            }
        }
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
    }

    public List<DetectionResult> detect(AlertType type, TimeWindow window) {
        return detectorFor(type).detect(Objects.requireNonNull(window, "window must not be null"));
    }

    /**
     * Same as {@link #generateAndPersist(AlertType, TimeWindow, BooleanSupplier)}
     * with a guard that refuses the write once the current thread is
     * interrupted.
     */
    public List<Alert> generateAndPersist(AlertType type, TimeWindow window) {
        return generateAndPersist(type, window, () -> !Thread.currentThread().isInterrupted());
    }

    /**
     * @param mayWrite consulted once, after formatting and right before the
     *                 write; {@code false} abandons the batch
     * @return the alerts written; empty when nothing was detected
     * @throws CancellationException if {@code mayWrite} refused the write
     */
    public List<Alert> generateAndPersist(AlertType type, TimeWindow window, BooleanSupplier mayWrite) {
        Objects.requireNonNull(mayWrite, "mayWrite must not be null");
        List<DetectionResult> results = detect(type, window);
        List<Alert> drafts = formatter.formatAll(results);
        if (!mayWrite.getAsBoolean()) {
            LOG.warn("{} alerts ({}): run abandoned, discarding {} alert(s)",
                    type.wireName(), window.wireName(), drafts.size());
            throw new CancellationException(
                    "Run for " + type.wireName() + " abandoned before writing " + drafts.size() + " alert(s)");
        }
        List<Alert> written = writer.write(drafts);
        LOG.info("{} alerts ({}): {} detected, {} written",
                type.wireName(), window.wireName(), results.size(), written.size());
        return written;
    }

    public boolean supports(AlertType type) {
        return detectors.containsKey(type);
    }

    private AlertDetector detectorFor(AlertType type) {
        Objects.requireNonNull(type, "AlertType must not be null");
        AlertDetector detector = detectors.get(type);
        if (detector == null) {
            throw new IllegalArgumentException("No detector registered for type " + type.wireName());
        }
        return detector;
    }
}
