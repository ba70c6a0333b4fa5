/**
 * Batch job that runs the alert detectors against a SQLite case database.
 *
 * <p>
 * {@link com.casesentinel.job.AlertComputeJob} is the entry point;
 * {@link com.casesentinel.job.DetectionRunner} executes detectors with
 * failure isolation; {@link com.casesentinel.job.TriggerServer} exposes
 * health checks, metrics, predictions and the recompute hook.
 * </p>
 */
package com.casesentinel.job;
