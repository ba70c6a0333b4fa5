/**
 * Domain model for Case Sentinel.
 *
 * <ul>
 * <li>{@link com.casesentinel.core.model.CaseRecord} and
 * {@link com.casesentinel.core.model.CaseCount}: read-side view of the case
 * store</li>
 * <li>{@link com.casesentinel.core.model.TimeWindow},
 * {@link com.casesentinel.core.model.TimeRange} and
 * {@link com.casesentinel.core.model.WindowBounds}: detection windows</li>
 * <li>{@link com.casesentinel.core.model.DetectionResult}: transient alert
 * candidate</li>
 * <li>{@link com.casesentinel.core.model.Alert} and
 * {@link com.casesentinel.core.model.TrendingTopic}: records written by the
 * engine</li>
 * <li>{@link com.casesentinel.core.model.PredictedRisk}: forecast computed on
 * request, never stored</li>
 * </ul>
 *
 * <p>
 * Closed vocabularies (severity, alert type, status, trend direction, window,
 * prediction type)
 * are enums serialised by their lowercase wire names.
 * </p>
 *
 * @since 1.0.0
 */
package com.casesentinel.core.model;
