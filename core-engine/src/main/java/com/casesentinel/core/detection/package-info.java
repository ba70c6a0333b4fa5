/**
 * Alert detectors.
 *
 * <p>
 * Each {@link com.casesentinel.core.detection.AlertDetector} reads a window
 * of case data and returns classified results without writing anything.
 * Volume detectors work on grouped counts; keyword detectors scan case
 * summaries through a {@link com.casesentinel.core.detection.KeywordMatcher}.
 * </p>
 */
package com.casesentinel.core.detection;
