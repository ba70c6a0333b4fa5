package com.casesentinel.core.aggregation;

import com.casesentinel.core.model.CaseCount;
import com.casesentinel.core.model.GroupingKey;
import com.casesentinel.core.model.TimeRange;
import com.casesentinel.core.store.CaseStore;
import com.casesentinel.core.store.DataAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Issues grouped counting queries against the {@link CaseStore}. Counting is
 * done by the store; this class only enforces the sparse-result contract.
 *
 * @since 1.0.0
 */
public class CaseAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(CaseAggregator.class);

    private final CaseStore caseStore;

    public CaseAggregator(CaseStore caseStore) {
        this.caseStore = Objects.requireNonNull(caseStore, "caseStore must not be null");
    }

    /**
     * @param range    creation-time range {@code [start, end)}
     * @param grouping business unit alone, or business unit and category
     * @return non-empty groups only
     * @throws DataAccessException if the store is unreachable
     */
    public List<CaseCount> countCases(TimeRange range, GroupingKey grouping) {
        Objects.requireNonNull(range, "range must not be null");
        Objects.requireNonNull(grouping, "grouping must not be null");

        List<CaseCount> counts = caseStore.countCases(range, grouping);
        if (counts == null) {
            throw new DataAccessException("Case store returned no result for " + grouping + " over " + range);
        }

        List<CaseCount> sparse = counts.stream()
                .filter(c -> c.getCount() > 0)
                .toList();
        LOG.debug("Counted {} group(s) by {} over {}", sparse.size(), grouping, range);
        return sparse;
    }

    public List<CaseCount> countByBusinessUnit(TimeRange range) {
        return countCases(range, GroupingKey.BUSINESS_UNIT);
    }

    public List<CaseCount> countByBusinessUnitAndCategory(TimeRange range) {
        return countCases(range, GroupingKey.BUSINESS_UNIT_AND_CATEGORY);
    }
}
