// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.log;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.metrics.runtime.Controller;
import org.hiero.metrics.runtime.Snapshot;

/**
 * Exporter that periodically takes a snapshot, renders it and writes the text to a log4j2 logger.
 * <p>
 * Each export uses a fresh {@link SnapshotRenderer} from the given factory. Periodic exporting is scheduled on
 * an external {@link ScheduledExecutorService} via {@link #start(ScheduledExecutorService)}. Errors of a single
 * export are logged and the schedule keeps running. See {@link ExportRunnable}.
 */
public final class LogExporter implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(LogExporter.class);

    private final Controller controller;
    private final Supplier<? extends SnapshotRenderer> rendererFactory;
    private final Level level;
    private final Duration interval;
    private final Logger output;

    private ScheduledFuture<?> scheduledExportFuture;

    /**
     * Create an exporter writing to this class' logger.
     *
     * @param controller      controller to take snapshots from
     * @param rendererFactory factory of a renderer per export
     * @param level           level to log rendered snapshots at
     * @param interval        interval between exports, must be positive
     */
    public LogExporter(
            @NonNull Controller controller,
            @NonNull Supplier<? extends SnapshotRenderer> rendererFactory,
            @NonNull Level level,
            @NonNull Duration interval) {
        this(controller, rendererFactory, level, interval, logger);
    }

    /**
     * Create an exporter writing to the given logger.
     *
     * @param controller      controller to take snapshots from
     * @param rendererFactory factory of a renderer per export
     * @param level           level to log rendered snapshots at
     * @param interval        interval between exports, must be positive
     * @param output          logger rendered snapshots are written to
     */
    public LogExporter(
            @NonNull Controller controller,
            @NonNull Supplier<? extends SnapshotRenderer> rendererFactory,
            @NonNull Level level,
            @NonNull Duration interval,
            @NonNull Logger output) {
        this.controller = Objects.requireNonNull(controller, "controller must not be null");
        this.rendererFactory = Objects.requireNonNull(rendererFactory, "renderer factory must not be null");
        this.level = Objects.requireNonNull(level, "level must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        this.output = Objects.requireNonNull(output, "output logger must not be null");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Export interval must be positive, but was: " + interval);
        }
    }

    /**
     * Take one snapshot, render it and log the result.
     */
    public void exportOnce() {
        Snapshot snapshot = controller.snapshot();
        SnapshotRenderer renderer = Objects.requireNonNull(rendererFactory.get(), "renderer must not be null");
        snapshot.observe(renderer);
        output.log(level, "{}", renderer.render());
    }

    /**
     * Schedule periodic exports at the configured interval, first export after one interval.
     *
     * @param executor executor to schedule exports on
     * @throws IllegalStateException if already started
     */
    public synchronized void start(@NonNull ScheduledExecutorService executor) {
        Objects.requireNonNull(executor, "executor must not be null");
        if (scheduledExportFuture != null) {
            throw new IllegalStateException("Log exporter is already started");
        }
        long intervalNanos = interval.toNanos();
        logger.info("Scheduling periodic log export with interval of {}", interval);
        scheduledExportFuture =
                executor.scheduleAtFixedRate(new ExportRunnable(), intervalNanos, intervalNanos, TimeUnit.NANOSECONDS);
    }

    public synchronized boolean isStarted() {
        return scheduledExportFuture != null;
    }

    /**
     * Cancel periodic exports. The executor is not shut down.
     */
    @Override
    public synchronized void close() {
        if (scheduledExportFuture != null) {
            scheduledExportFuture.cancel(false);
            scheduledExportFuture = null;
            logger.info("Stopped periodic log export");
        }
    }

    /**
     * A runnable performing one export, logging failures so that the schedule is not cancelled.
     */
    private class ExportRunnable implements Runnable {

        @Override
        public void run() {
            try {
                exportOnce();
            } catch (RuntimeException e) {
                logger.warn("Error while exporting metrics snapshot to log", e);
            }
        }
    }
}
