// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import org.hiero.metrics.runtime.core.InvalidTimingException;
import org.hiero.metrics.runtime.core.Labels;
import org.hiero.metrics.runtime.core.MetricIdentity;
import org.hiero.metrics.runtime.core.MetricProducer;
import org.hiero.metrics.runtime.core.MetricRegistry;
import org.hiero.metrics.runtime.core.Scope;
import org.hiero.metrics.runtime.core.TimeSource;

/**
 * Per-caller facade for recording metrics.
 * <p>
 * A sink carries a {@link Scope} and a set of default {@link Labels}, which are combined with the names and labels
 * passed to each call to build a {@link MetricIdentity}. Handles obtained from the registry are cached locally by
 * identity, so repeated calls for the same metric skip the registry. Call-site labels override default labels
 * with the same key.
 * <p>
 * A sink is not thread-safe. Give each thread its own sink via {@link #copy()} or {@link #scoped(String...)};
 * all sinks derived from one receiver share the same registry, and handles are safe to share.
 */
public final class Sink {

    private final MetricRegistry registry;
    private final TimeSource timeSource;
    private final Scope scope;
    private Labels defaultLabels;

    private final Map<MetricIdentity, CounterHandle> counters;
    private final Map<MetricIdentity, GaugeHandle> gauges;
    private final Map<MetricIdentity, HistogramHandle> histograms;

    Sink(
            @NonNull MetricRegistry registry,
            @NonNull TimeSource timeSource,
            @NonNull Scope scope,
            @NonNull Labels defaultLabels) {
        this(registry, timeSource, scope, defaultLabels, new HashMap<>(), new HashMap<>(), new HashMap<>());
    }

    private Sink(
            MetricRegistry registry,
            TimeSource timeSource,
            Scope scope,
            Labels defaultLabels,
            Map<MetricIdentity, CounterHandle> counters,
            Map<MetricIdentity, GaugeHandle> gauges,
            Map<MetricIdentity, HistogramHandle> histograms) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource must not be null");
        this.scope = Objects.requireNonNull(scope, "scope must not be null");
        this.defaultLabels = Objects.requireNonNull(defaultLabels, "defaultLabels must not be null");
        this.counters = counters;
        this.gauges = gauges;
        this.histograms = histograms;
    }

    /**
     * Create a sink with the given segments appended to this sink's scope.
     * The new sink inherits the current default labels. This sink is not modified.
     *
     * @param segments scope segments to append
     * @return new sink
     */
    @NonNull
    public Sink scoped(@NonNull String... segments) {
        return new Sink(registry, timeSource, scope.append(segments), defaultLabels);
    }

    /**
     * @see #scoped(String...)
     */
    @NonNull
    public Sink scoped(@NonNull Collection<String> segments) {
        return new Sink(registry, timeSource, scope.append(segments), defaultLabels);
    }

    /**
     * Create an independent copy of this sink with the same scope, default labels and cached handles.
     *
     * @return new sink
     */
    @NonNull
    public Sink copy() {
        return new Sink(
                registry,
                timeSource,
                scope,
                defaultLabels,
                new HashMap<>(counters),
                new HashMap<>(gauges),
                new HashMap<>(histograms));
    }

    /**
     * Add default labels to this sink. Additive across calls, later values win for the same key.
     * Affects metrics resolved through this sink and sinks derived from it afterward only.
     *
     * @param keysAndValues label keys and values as flat pairs
     * @return this sink
     */
    @NonNull
    public Sink addDefaultLabels(@NonNull String... keysAndValues) {
        return addDefaultLabels(Labels.of(keysAndValues));
    }

    /**
     * @see #addDefaultLabels(String...)
     */
    @NonNull
    public Sink addDefaultLabels(@NonNull Labels labels) {
        defaultLabels = defaultLabels.merge(labels);
        return this;
    }

    @NonNull
    public Scope scope() {
        return scope;
    }

    @NonNull
    public Labels defaultLabels() {
        return defaultLabels;
    }

    @NonNull
    public CounterHandle counter(@NonNull String name, @NonNull String... keysAndValues) {
        return counter(name, Labels.of(keysAndValues));
    }

    /**
     * Get or create the counter for the given name and labels in this sink's scope.
     *
     * @param name   metric name
     * @param labels call-site labels, merged over default labels
     * @return counter handle
     * @throws org.hiero.metrics.runtime.core.KindMismatchException if the identity is bound to another kind
     */
    @NonNull
    public CounterHandle counter(@NonNull String name, @NonNull Labels labels) {
        MetricIdentity identity = identity(name, labels);
        CounterHandle handle = counters.get(identity);
        if (handle == null) {
            handle = new CounterHandle(identity, registry.counter(identity));
            counters.put(identity, handle);
        }
        return handle;
    }

    @NonNull
    public GaugeHandle gauge(@NonNull String name, @NonNull String... keysAndValues) {
        return gauge(name, Labels.of(keysAndValues));
    }

    /**
     * Get or create the gauge for the given name and labels in this sink's scope.
     *
     * @param name   metric name
     * @param labels call-site labels, merged over default labels
     * @return gauge handle
     * @throws org.hiero.metrics.runtime.core.KindMismatchException if the identity is bound to another kind
     */
    @NonNull
    public GaugeHandle gauge(@NonNull String name, @NonNull Labels labels) {
        MetricIdentity identity = identity(name, labels);
        GaugeHandle handle = gauges.get(identity);
        if (handle == null) {
            handle = new GaugeHandle(identity, registry.gauge(identity));
            gauges.put(identity, handle);
        }
        return handle;
    }

    @NonNull
    public HistogramHandle histogram(@NonNull String name, @NonNull String... keysAndValues) {
        return histogram(name, Labels.of(keysAndValues));
    }

    /**
     * Get or create the histogram for the given name and labels in this sink's scope.
     *
     * @param name   metric name
     * @param labels call-site labels, merged over default labels
     * @return histogram handle
     * @throws org.hiero.metrics.runtime.core.KindMismatchException if the identity is bound to another kind
     */
    @NonNull
    public HistogramHandle histogram(@NonNull String name, @NonNull Labels labels) {
        MetricIdentity identity = identity(name, labels);
        HistogramHandle handle = histograms.get(identity);
        if (handle == null) {
            handle = new HistogramHandle(identity, registry.histogram(identity));
            histograms.put(identity, handle);
        }
        return handle;
    }

    public void incrementCounter(@NonNull String name, long delta, @NonNull String... keysAndValues) {
        counter(name, keysAndValues).increment(delta);
    }

    public void updateGauge(@NonNull String name, long value, @NonNull String... keysAndValues) {
        gauge(name, keysAndValues).set(value);
    }

    public void incrementGauge(@NonNull String name, long delta, @NonNull String... keysAndValues) {
        gauge(name, keysAndValues).increment(delta);
    }

    public void decrementGauge(@NonNull String name, long delta, @NonNull String... keysAndValues) {
        gauge(name, keysAndValues).decrement(delta);
    }

    public void recordValue(@NonNull String name, long value, @NonNull String... keysAndValues) {
        histogram(name, keysAndValues).recordValue(value);
    }

    /**
     * Record the elapsed nanoseconds between two timestamps, usually obtained from {@link #now()}.
     *
     * @param name          histogram name
     * @param start         start timestamp in nanoseconds
     * @param end           end timestamp in nanoseconds
     * @param keysAndValues label keys and values as flat pairs
     * @throws InvalidTimingException if {@code end} is earlier than {@code start} or the span exceeds
     *                                {@link Long#MAX_VALUE} nanoseconds, nothing is recorded
     */
    public void recordTiming(@NonNull String name, long start, long end, @NonNull String... keysAndValues) {
        long elapsed = HistogramHandle.elapsedNanos(start, end);
        histogram(name, keysAndValues).recordValue(elapsed);
    }

    /**
     * Record the elapsed nanoseconds between two instants.
     *
     * @throws InvalidTimingException if {@code end} is before {@code start} or the span exceeds
     *                                {@link Long#MAX_VALUE} nanoseconds (about 292 years), nothing is recorded
     */
    public void recordTiming(
            @NonNull String name, @NonNull Instant start, @NonNull Instant end, @NonNull String... keysAndValues) {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (end.isBefore(start)) {
            throw new InvalidTimingException(
                    "Timing end must not be earlier than start, but was: start=" + start + ", end=" + end);
        }
        long elapsed;
        try {
            elapsed = Duration.between(start, end).toNanos();
        } catch (ArithmeticException e) {
            throw new InvalidTimingException(
                    "Timing span must not exceed " + Long.MAX_VALUE + " nanoseconds, but was: start=" + start
                            + ", end=" + end,
                    e);
        }
        histogram(name, keysAndValues).recordValue(elapsed);
    }

    /**
     * Register a proxy whose measurements are reported as {@code scope.name.subName}.
     *
     * @param name     name prefix
     * @param producer producer invoked once per snapshot
     */
    public void proxy(@NonNull String name, @NonNull MetricProducer producer) {
        registry.registerProxy(scope, name, producer);
    }

    /**
     * @return current monotonic timestamp in nanoseconds, never touches the registry
     */
    public long now() {
        return timeSource.nanoTime();
    }

    int cachedHandles() {
        return counters.size() + gauges.size() + histograms.size();
    }

    private MetricIdentity identity(String name, Labels labels) {
        return new MetricIdentity(name, scope, defaultLabels.merge(labels));
    }
}
