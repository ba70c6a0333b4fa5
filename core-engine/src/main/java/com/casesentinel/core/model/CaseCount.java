package com.casesentinel.core.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One row of a grouped case count. {@code category} is {@code null} when the
 * count was grouped by business unit only.
 *
 * @since 1.0.0
 */
public final class CaseCount {

    private final String businessUnit;
    private final String category;
    private final int count;

    public CaseCount(String businessUnit, String category, int count) {
        this.businessUnit = Objects.requireNonNull(businessUnit, "businessUnit must not be null");
        this.category = category;
        this.count = count;
    }

    public static CaseCount ofBusinessUnit(String businessUnit, int count) {
        return new CaseCount(businessUnit, null, count);
    }

    public String getBusinessUnit() {
        return businessUnit;
    }

    public String getCategory() {
        return category;
    }

    public int getCount() {
        return count;
    }

    /**
     * @return business unit and category as a map key
     */
    public List<String> groupKey() {
        return Collections.unmodifiableList(Arrays.asList(businessUnit, category));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CaseCount that))
            return false;
        return count == that.count
                && businessUnit.equals(that.businessUnit)
                && Objects.equals(category, that.category);
    }

    @Override
    public int hashCode() {
        return Objects.hash(businessUnit, category, count);
    }

    @Override
    public String toString() {
        return "CaseCount{" + businessUnit + (category == null ? "" : "/" + category) + "=" + count + '}';
    }
}
