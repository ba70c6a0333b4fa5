package com.casesentinel.core.store;

import com.casesentinel.core.model.CaseCount;
import com.casesentinel.core.model.CaseRecord;
import com.casesentinel.core.model.GroupingKey;
import com.casesentinel.core.model.Severity;
import com.casesentinel.core.model.TimeRange;

import java.util.List;
import java.util.Set;

/**
 * Read-only query surface over case records.
 *
 * <p>
 * Implementations must be safe for concurrent use by several detectors.
 * Every method filters on {@code createdAt} within the half-open range
 * {@code [start, end)}.
 * </p>
 *
 * @since 1.0.0
 */
public interface CaseStore {

    /**
     * Count cases grouped by the given key.
     *
     * <p>
     * Groups without a matching case are omitted, never returned with a zero
     * count. Rows are returned in a stable order for unchanged data.
     * </p>
     *
     * @param range    creation-time range
     * @param grouping columns to group by
     * @return one row per non-empty group
     * @throws DataAccessException if the store cannot answer
     */
    List<CaseCount> countCases(TimeRange range, GroupingKey grouping);

    /**
     * Fetch cases whose severity is one of {@code severities}, oldest first.
     *
     * @param range      creation-time range
     * @param severities accepted severities; must not be empty
     * @return matching cases
     * @throws DataAccessException if the store cannot answer
     */
    List<CaseRecord> findCases(TimeRange range, Set<Severity> severities);
}
