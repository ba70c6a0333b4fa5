package com.casesentinel.core.alert;

import com.casesentinel.core.model.Alert;
import com.casesentinel.core.model.AlertStatus;
import com.casesentinel.core.store.AlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Appends alert drafts to the {@link AlertStore}.
 *
 * <p>
 * Every draft becomes a new row with a fresh identifier, status
 * {@code active} and both timestamps set to the clock's current instant.
 * There is no deduplication: rerunning a detector over unchanged data
 * appends a second copy of each alert.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertWriter {

    private static final Logger LOG = LoggerFactory.getLogger(AlertWriter.class);

    private final AlertStore alertStore;
    private final Clock clock;

    public AlertWriter(AlertStore alertStore, Clock clock) {
        this.alertStore = Objects.requireNonNull(alertStore, "alertStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param drafts formatted alerts without ids
     * @return the alerts as written
     * @throws com.casesentinel.core.store.DataAccessException if the store
     *                                                         rejects the
     *                                                         batch
     */
    public List<Alert> write(List<Alert> drafts) {
        Objects.requireNonNull(drafts, "drafts must not be null");
        if (drafts.isEmpty()) {
            LOG.debug("No alerts to write");
            return List.of();
        }

        Instant now = clock.instant();
        List<Alert> alerts = drafts.stream()
                .map(draft -> draft.toBuilder()
                        .id(UUID.randomUUID().toString())
                        .status(AlertStatus.ACTIVE)
                        .createdAt(now)
                        .updatedAt(now)
                        .build())
                .toList();

        alertStore.insertAlerts(alerts);
        LOG.info("Wrote {} alert(s)", alerts.size());
        return alerts;
    }
}
