// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import org.hiero.metrics.runtime.core.Gauge;
import org.hiero.metrics.runtime.core.MetricIdentity;

/**
 * Reference to a gauge cell. Safe to share across threads.
 */
public final class GaugeHandle {

    private final MetricIdentity identity;
    private final Gauge gauge;

    GaugeHandle(@NonNull MetricIdentity identity, @NonNull Gauge gauge) {
        this.identity = Objects.requireNonNull(identity, "identity must not be null");
        this.gauge = Objects.requireNonNull(gauge, "gauge must not be null");
    }

    /**
     * Sets the gauge to the given value, same as {@link #set(long)}.
     */
    public void record(long value) {
        gauge.set(value);
    }

    public void set(long value) {
        gauge.set(value);
    }

    public void increment(long delta) {
        gauge.increment(delta);
    }

    public void decrement(long delta) {
        gauge.decrement(delta);
    }

    public long value() {
        return gauge.get();
    }

    @NonNull
    public MetricIdentity identity() {
        return identity;
    }

    @Override
    public String toString() {
        return "GaugeHandle{" + identity + '}';
    }
}
