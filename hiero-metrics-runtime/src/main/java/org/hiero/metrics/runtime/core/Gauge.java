// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Signed 64-bit last known value. Concurrent writers are ordered only by the underlying atomic store,
 * the value is whichever write lands last.
 */
public final class Gauge implements MetricCell {

    private final AtomicLong value = new AtomicLong();

    public void set(long newValue) {
        value.set(newValue);
    }

    public void increment(long delta) {
        value.addAndGet(delta);
    }

    public void decrement(long delta) {
        value.addAndGet(-delta);
    }

    public long get() {
        return value.get();
    }

    @NonNull
    @Override
    public MetricKind kind() {
        return MetricKind.GAUGE;
    }

    @NonNull
    @Override
    public Measurement measure() {
        return new Measurement.Gauge(value.get());
    }
}
