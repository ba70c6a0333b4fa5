package com.casesentinel.core.detection;

import com.casesentinel.core.model.AlertType;
import com.casesentinel.core.model.DetectionResult;
import com.casesentinel.core.model.TimeWindow;

import java.util.List;

/**
 * Contract for all alert detectors.
 * <p>
 * A detector reads case data for one {@link TimeWindow} and classifies it
 * into zero or more {@link DetectionResult}s. Detection never writes:
 * persisting results is the job of the alert pipeline.
 * </p>
 * <p>
 * Implementations hold only immutable configuration and a store handle, so a
 * single instance may be invoked concurrently.
 * </p>
 */
public interface AlertDetector {

    /**
     * Run the detector against the current state of the case store.
     *
     * @param window logical window to evaluate
     * @return results in the detector's documented order; empty when nothing
     *         qualifies
     * @throws com.casesentinel.core.store.DataAccessException      if the store
     *                                                             fails
     * @throws com.casesentinel.core.config.ConfigurationException if the
     *                                                             configuration
     *                                                             cannot serve
     *                                                             {@code window}
     */
    List<DetectionResult> detect(TimeWindow window);

    /**
     * @return the alert type this detector produces
     */
    AlertType getType();
}
