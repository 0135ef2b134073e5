// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.metrics.runtime.core.InvalidTimingException;
import org.hiero.metrics.runtime.core.Labels;
import org.hiero.metrics.runtime.core.MetricIdentity;
import org.hiero.metrics.runtime.core.Scope;

/**
 * Process-wide default receiver for recording metrics without holding a sink or handle.
 * <p>
 * The default receiver is installed exactly once, usually at startup. Until then all recording methods are no-ops.
 * Metrics recorded here live in the root scope of the installed receiver.
 */
public final class GlobalMetrics {

    private static final Logger logger = LogManager.getLogger(GlobalMetrics.class);

    private static final AtomicReference<Receiver> DEFAULT = new AtomicReference<>();

    private GlobalMetrics() {}

    /**
     * Install the process-wide default receiver.
     *
     * @param receiver the receiver
     * @throws IllegalStateException if a default receiver is already installed
     */
    public static void install(@NonNull Receiver receiver) {
        Objects.requireNonNull(receiver, "receiver must not be null");
        if (!DEFAULT.compareAndSet(null, receiver)) {
            throw new IllegalStateException("Default metrics receiver is already installed");
        }
        logger.info("Installed default metrics receiver");
    }

    public static boolean isInstalled() {
        return DEFAULT.get() != null;
    }

    /**
     * @return the installed receiver, if any
     */
    @NonNull
    public static Optional<Receiver> receiver() {
        return Optional.ofNullable(DEFAULT.get());
    }

    public static void incrementCounter(@NonNull String name, long delta, @NonNull String... keysAndValues) {
        Receiver receiver = DEFAULT.get();
        if (receiver != null) {
            receiver.registry().counter(identity(name, keysAndValues)).increment(delta);
        }
    }

    public static void updateGauge(@NonNull String name, long value, @NonNull String... keysAndValues) {
        Receiver receiver = DEFAULT.get();
        if (receiver != null) {
            receiver.registry().gauge(identity(name, keysAndValues)).set(value);
        }
    }

    public static void recordValue(@NonNull String name, long value, @NonNull String... keysAndValues) {
        Receiver receiver = DEFAULT.get();
        if (receiver != null) {
            receiver.registry().histogram(identity(name, keysAndValues)).record(value);
        }
    }

    /**
     * Record elapsed nanoseconds between two timestamps.
     *
     * @throws InvalidTimingException if {@code end} is earlier than {@code start} or the span exceeds
     *                                {@link Long#MAX_VALUE} nanoseconds, even when nothing is installed
     */
    public static void recordTiming(@NonNull String name, long start, long end, @NonNull String... keysAndValues) {
        long elapsed = HistogramHandle.elapsedNanos(start, end);
        Receiver receiver = DEFAULT.get();
        if (receiver != null) {
            receiver.registry().histogram(identity(name, keysAndValues)).record(elapsed);
        }
    }

    /**
     * @return current timestamp of the installed receiver's time source, or {@link System#nanoTime()}
     */
    public static long now() {
        Receiver receiver = DEFAULT.get();
        return receiver != null ? receiver.timeSource().nanoTime() : System.nanoTime();
    }

    private static MetricIdentity identity(String name, String... keysAndValues) {
        return new MetricIdentity(name, Scope.root(), Labels.of(keysAndValues));
    }

    /**
     * Remove the installed receiver. Tests only.
     */
    static void reset() {
        DEFAULT.set(null);
    }
}
