/**
 * Grouped case counting.
 */
package com.casesentinel.core.aggregation;
