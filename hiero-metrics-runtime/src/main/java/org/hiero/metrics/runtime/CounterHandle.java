// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import org.hiero.metrics.runtime.core.Counter;
import org.hiero.metrics.runtime.core.MetricIdentity;

/**
 * Reference to a counter cell. Handles are views: every copy observes the same cell,
 * whose lifetime is tied to the registry. Safe to share across threads.
 */
public final class CounterHandle {

    private final MetricIdentity identity;
    private final Counter counter;

    CounterHandle(@NonNull MetricIdentity identity, @NonNull Counter counter) {
        this.identity = Objects.requireNonNull(identity, "identity must not be null");
        this.counter = Objects.requireNonNull(counter, "counter must not be null");
    }

    /**
     * Increments the counter by {@code 1}.
     */
    public void increment() {
        counter.increment();
    }

    /**
     * Increments the counter by the given non-negative delta.
     *
     * @param delta the value to increment by
     * @throws IllegalArgumentException if the delta is negative
     */
    public void increment(long delta) {
        counter.increment(delta);
    }

    /**
     * Same as {@link #increment(long)}.
     */
    public void record(long delta) {
        counter.increment(delta);
    }

    /**
     * @return raw counter bits, to be interpreted as unsigned
     */
    public long value() {
        return counter.get();
    }

    /**
     * @return counter value as unsigned decimal
     */
    @NonNull
    public String valueAsString() {
        return counter.getAsString();
    }

    @NonNull
    public MetricIdentity identity() {
        return identity;
    }

    @Override
    public String toString() {
        return "CounterHandle{" + identity + '}';
    }
}
