package com.casesentinel.core.store;

import com.casesentinel.core.model.Alert;

import java.util.List;

/**
 * Append-only sink for alerts.
 *
 * @since 1.0.0
 */
public interface AlertStore {

    /**
     * Insert every alert as a new row. Implementations should make the batch
     * atomic where the underlying store allows it.
     *
     * @param alerts fully populated alerts with identifiers
     * @throws DataAccessException if the batch could not be written
     */
    void insertAlerts(List<Alert> alerts);
}
