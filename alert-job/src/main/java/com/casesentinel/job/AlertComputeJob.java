package com.casesentinel.job;

import com.casesentinel.core.alert.AlertFormatter;
import com.casesentinel.core.alert.AlertGenerationService;
import com.casesentinel.core.alert.AlertWriter;
import com.casesentinel.core.config.AlertConfig;
import com.casesentinel.core.config.AlertConfigLoader;
import com.casesentinel.core.detection.AlertDetector;
import com.casesentinel.core.detection.DetectorFactory;
import com.casesentinel.core.trend.PredictedRiskDetector;
import com.casesentinel.core.trend.TrendingTopicAggregator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point for the alert computation job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   SQLite (cases)
 *     → detectors (spike, threshold, urgency, misclassification)
 *         → AlertFormatter → AlertWriter → SQLite (alerts)
 *     → trending pass → SQLite (trending_topics)
 *   (every branch runs in parallel under one deadline)
 * </pre>
 * <p>
 * Predicted risks are computed on request only, through
 * {@link TriggerServer}; they are never stored.
 * </p>
 *
 * <h3>Modes</h3>
 * <p>
 * With {@code SCHEDULE_INTERVAL_MINUTES=0} the job runs once and exits with
 * status 1 if any detector failed. Otherwise it reruns on a fixed delay and
 * serves {@link TriggerServer} (health, metrics, predictions, recompute)
 * until the process is stopped.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertComputeJob {

    private static final Logger LOG = LoggerFactory.getLogger(AlertComputeJob.class);

    private AlertComputeJob() {
        // entry-point class — not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting alert computation with config: {}", config);

        AlertConfig alertConfig = loadAlertConfig(config);
        LOG.info("Loaded alert configuration: {}", alertConfig);

        // 2. Wire stores and runner
        Clock clock = Clock.systemUTC();
        SqliteDatabase database = new SqliteDatabase(Paths.get(config.getCaseDbPath()));
        JobMetrics metrics = new JobMetrics(new SimpleMeterRegistry());
        try (DetectionRunner runner = createRunner(database, config, alertConfig, metrics, clock)) {
            if (!config.isScheduled()) {
                RunReport report = runner.run(config.getTimeWindow());
                System.exit(report.hasFailures() ? 1 : 0);
                return;
            }
            TriggerServer triggerServer = new TriggerServer(runner::run,
                    createPredictor(database, alertConfig, clock)::compute,
                    metrics,
                    config.getTimeWindow(),
                    alertConfig.getPrediction().getAlertThreshold());
            runScheduled(config, runner, triggerServer);
        }
    }

    /**
     * Assemble the detection pipeline for {@code config}.
     */
    static DetectionRunner createRunner(SqliteDatabase database, JobConfig config, AlertConfig alertConfig,
            JobMetrics metrics, Clock clock) {
        SqliteCaseStore caseStore = new SqliteCaseStore(database);
        SqliteAlertStore alertStore = new SqliteAlertStore(database);

        List<AlertDetector> detectors = DetectorFactory.createAll(
                config.getAlertTypes(), caseStore, alertConfig, clock);
        AlertGenerationService service = new AlertGenerationService(
                detectors, new AlertFormatter(), new AlertWriter(alertStore, clock));
        TrendingTopicAggregator trending = config.isComputeTrending()
                ? new TrendingTopicAggregator(caseStore, alertStore, clock)
                : null;

        return new DetectionRunner(service, trending, metrics, config, clock);
    }

    /**
     * Assemble the read-only predicted-risk pipeline.
     */
    static PredictedRiskDetector createPredictor(SqliteDatabase database, AlertConfig alertConfig, Clock clock) {
        SqliteCaseStore caseStore = new SqliteCaseStore(database);
        TrendingTopicAggregator trending = new TrendingTopicAggregator(
                caseStore, new SqliteAlertStore(database), clock);
        return new PredictedRiskDetector(trending, caseStore, alertConfig.getPrediction(), clock);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AlertConfig loadAlertConfig(JobConfig config) {
        String path = config.getAlertConfigPath();
        if (path != null && !path.isBlank()) {
            return AlertConfigLoader.fromFile(path);
        }
        return AlertConfigLoader.load();
    }

    private static void runScheduled(JobConfig config, DetectionRunner runner, TriggerServer triggerServer)
            throws InterruptedException {
        triggerServer.start(config.getTriggerPort());

        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "alert-scheduler");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                runner.run(config.getTimeWindow());
            } catch (RuntimeException e) {
                // keep the schedule alive; the next run retries from scratch
                LOG.error("Scheduled run failed: {}", e.getMessage(), e);
            }
        }, 0, config.getScheduleIntervalMinutes(), TimeUnit.MINUTES);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            triggerServer.stop();
            scheduler.shutdownNow();
        }, "alert-job-shutdown"));

        LOG.info("Scheduled every {} minute(s); trigger on port {}",
                config.getScheduleIntervalMinutes(), triggerServer.getPort());
        scheduler.awaitTermination(Long.MAX_VALUE, TimeUnit.DAYS);
    }
}
