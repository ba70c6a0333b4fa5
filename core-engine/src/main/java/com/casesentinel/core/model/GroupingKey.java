package com.casesentinel.core.model;

/**
 * Columns a grouped case count is keyed by.
 *
 * @since 1.0.0
 */
public enum GroupingKey {

    BUSINESS_UNIT,

    BUSINESS_UNIT_AND_CATEGORY
}
