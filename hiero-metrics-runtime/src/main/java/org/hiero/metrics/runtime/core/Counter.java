// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonically increasing unsigned 64-bit counter.
 * <p>
 * The value is stored in a single {@link AtomicLong} whose bits are interpreted as unsigned,
 * so every read returns a previously applied cumulative total. When the total exceeds {@code 2^64 - 1}
 * the counter wraps around modulo {@code 2^64}.
 */
public final class Counter implements MetricCell {

    private final AtomicLong value = new AtomicLong();

    /**
     * Increments the counter by {@code 1}.
     */
    public void increment() {
        value.incrementAndGet();
    }

    /**
     * Increments the counter by the given non-negative delta.
     *
     * @param delta the value to increment by
     * @throws IllegalArgumentException if the given delta is negative
     */
    public void increment(long delta) {
        MetricUtils.throwArgNegative(delta, "Increment value");
        if (delta != 0L) {
            value.addAndGet(delta);
        }
    }

    /**
     * @return raw counter bits, to be interpreted as unsigned
     */
    public long get() {
        return value.get();
    }

    /**
     * @return counter value rendered as unsigned decimal
     */
    @NonNull
    public String getAsString() {
        return Long.toUnsignedString(value.get());
    }

    @NonNull
    @Override
    public MetricKind kind() {
        return MetricKind.COUNTER;
    }

    @NonNull
    @Override
    public Measurement measure() {
        return new Measurement.Counter(value.get());
    }
}
