package com.casesentinel.job;

import com.casesentinel.core.alert.AlertGenerationService;
import com.casesentinel.core.model.Alert;
import com.casesentinel.core.model.AlertType;
import com.casesentinel.core.model.DetectionResult;
import com.casesentinel.core.model.TimeWindow;
import com.casesentinel.core.model.TrendingTopic;
import com.casesentinel.core.trend.TrendingTopicAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the selected detectors for one window.
 *
 * <h3>Execution</h3>
 * <p>
 * Each detector, and the optional trending pass, is submitted as its own task
 * and given {@code detectorTimeoutMs} from the start of the run. A task that
 * throws or misses its deadline is logged, counted as a failure and reported;
 * the others are unaffected. Failed tasks are not retried.
 * </p>
 *
 * <h3>Writes</h3>
 * <p>
 * A task must claim its write before touching the store. A task that missed
 * its deadline is abandoned first, so its claim fails and it writes nothing,
 * even when it ignores interruption. A task that claimed its write before the
 * deadline is waited for, and its rows are reported.
 * </p>
 *
 * <p>
 * Runs are serialised, so a scheduled run and a triggered run never
 * overlap.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionRunner implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionRunner.class);

    static final String TRENDING = "trending";
    private static final long SHUTDOWN_WAIT_MS = 5_000;

    private final AlertGenerationService service;
    private final TrendingTopicAggregator trending;
    private final JobMetrics metrics;
    private final Set<AlertType> alertTypes;
    private final boolean dryRun;
    private final boolean computeTrending;
    private final int trendingLimit;
    private final long timeoutMs;
    private final Clock clock;
    private final ExecutorService executor;

    /**
     * @param trending trending aggregator; may be {@code null} when the job
     *                 configuration disables trending
     */
    public DetectionRunner(AlertGenerationService service,
            TrendingTopicAggregator trending,
            JobMetrics metrics,
            JobConfig config,
            Clock clock) {
        this.service = Objects.requireNonNull(service, "service must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        Objects.requireNonNull(config, "JobConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.alertTypes = config.getAlertTypes();
        this.dryRun = config.isDryRun();
        this.computeTrending = config.isComputeTrending();
        this.trendingLimit = config.getTrendingLimit();
        this.timeoutMs = config.getDetectorTimeoutMs();
        if (computeTrending) {
            this.trending = Objects.requireNonNull(trending, "trending aggregator required when trending is enabled");
        } else {
            this.trending = trending;
        }

        AtomicInteger threadIndex = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(alertTypes.size() + (computeTrending ? 1 : 0), r -> {
            Thread t = new Thread(r, "detector-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run every selected detector for {@code window}.
     *
     * @return one outcome per detector, in selection order, followed by the
     *         trending outcome when enabled
     */
    public synchronized RunReport run(TimeWindow window) {
        Objects.requireNonNull(window, "window must not be null");
        Instant startedAt = clock.instant();
        long start = System.nanoTime();
        long deadline = start + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        LOG.info("Starting {} run for window {} with detectors {}",
                dryRun ? "dry" : "live", window.wireName(), alertTypes);

        List<RunTask> tasks = new ArrayList<>();
        for (AlertType type : alertTypes) {
            RunTask task = new RunTask(type.wireName());
            task.future = executor.submit(() -> runDetector(type, window, task));
            tasks.add(task);
        }
        if (computeTrending) {
            RunTask task = new RunTask(TRENDING);
            task.future = executor.submit(() -> runTrending(window, task));
            tasks.add(task);
        }

        List<DetectorOutcome> outcomes = new ArrayList<>();
        for (RunTask task : tasks) {
            outcomes.add(await(task, deadline, start));
        }

        RunReport report = new RunReport(window, dryRun, startedAt, clock.instant(), outcomes);
        if (report.hasFailures()) {
            LOG.warn("Run for window {} finished with failed detector(s): {}",
                    window.wireName(), report.getFailedDetectors());
        } else {
            LOG.info("Run for window {} finished: {} row(s) written", window.wireName(), report.getTotalWritten());
        }
        return report;
    }

    /**
     * Interrupt running tasks and wait briefly for them to stop.
     */
    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS)) {
                LOG.warn("Detector tasks still running {}ms after shutdown", SHUTDOWN_WAIT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for detector tasks to stop");
        }
    }

    // ---------------------------------------------------------------
    // Tasks
    // ---------------------------------------------------------------

    private DetectorOutcome runDetector(AlertType type, TimeWindow window, RunTask task) {
        long start = System.nanoTime();
        if (dryRun) {
            List<DetectionResult> results = service.detect(type, window);
            results.forEach(r -> LOG.info("[dry-run] {}", r));
            return DetectorOutcome.success(type.wireName(), results.size(), 0, elapsedMs(start));
        }
        List<Alert> written = service.generateAndPersist(type, window, task::claimWrite);
        return DetectorOutcome.success(type.wireName(), written.size(), written.size(), elapsedMs(start));
    }

    private DetectorOutcome runTrending(TimeWindow window, RunTask task) {
        long start = System.nanoTime();
        if (dryRun) {
            List<TrendingTopic> topics = trending.compute(window, trendingLimit);
            return DetectorOutcome.success(TRENDING, topics.size(), 0, elapsedMs(start));
        }
        List<TrendingTopic> topics = trending.generateAndPersist(window, trendingLimit, task::claimWrite);
        return DetectorOutcome.success(TRENDING, topics.size(), topics.size(), elapsedMs(start));
    }

    private DetectorOutcome await(RunTask task, long deadline, long start) {
        String detector = task.name;
        Future<DetectorOutcome> future = task.future;
        try {
            DetectorOutcome outcome;
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                outcome = future.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                if (task.abandon()) {
                    future.cancel(true);
                    return fail(detector, start, "timed out after " + timeoutMs + "ms", e);
                }
                LOG.warn("Detector [{}] passed its deadline while writing, waiting for the write to finish", detector);
                outcome = future.get();
            }
            metrics.recordSuccess(detector, outcome.getDurationMs());
            if (TRENDING.equals(detector)) {
                metrics.recordTopicsWritten(outcome.getWritten());
            } else {
                metrics.recordAlertsWritten(detector, outcome.getWritten());
            }
            LOG.info("Detector [{}] finished: {}", detector, outcome);
            return outcome;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return fail(detector, start, cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
        } catch (CancellationException e) {
            return fail(detector, start, "cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.abandon();
            future.cancel(true);
            return fail(detector, start, "interrupted", e);
        }
    }

    private DetectorOutcome fail(String detector, long start, String reason, Throwable cause) {
        long duration = elapsedMs(start);
        metrics.recordFailure(detector, duration);
        LOG.error("Detector [{}] failed: {}", detector, reason, cause);
        return DetectorOutcome.failure(detector, duration, reason);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    /**
     * One submitted task and its write claim. The claim and the abandonment
     * race on a single state change, so exactly one of them wins.
     */
    private static final class RunTask {
        private static final int PENDING = 0;
        private static final int WRITING = 1;
        private static final int ABANDONED = 2;

        private final String name;
        private final AtomicInteger state = new AtomicInteger(PENDING);
        private volatile Future<DetectorOutcome> future;

        RunTask(String name) {
            this.name = name;
        }

        boolean claimWrite() {
            return state.compareAndSet(PENDING, WRITING);
        }

        boolean abandon() {
            return state.compareAndSet(PENDING, ABANDONED);
        }
    }
}
