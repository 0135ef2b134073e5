// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import java.util.Objects;
import org.hiero.metrics.runtime.core.Histogram;
import org.hiero.metrics.runtime.core.HistogramSummary;
import org.hiero.metrics.runtime.core.InvalidTimingException;
import org.hiero.metrics.runtime.core.MetricIdentity;

/**
 * Reference to a histogram cell. Safe to share across threads.
 */
public final class HistogramHandle {

    private final MetricIdentity identity;
    private final Histogram histogram;

    HistogramHandle(@NonNull MetricIdentity identity, @NonNull Histogram histogram) {
        this.identity = Objects.requireNonNull(identity, "identity must not be null");
        this.histogram = Objects.requireNonNull(histogram, "histogram must not be null");
    }

    /**
     * Records one sample.
     *
     * @param value non-negative sample
     * @throws IllegalArgumentException if the sample is negative
     */
    public void recordValue(long value) {
        histogram.record(value);
    }

    /**
     * Records the elapsed time between two timestamps in nanoseconds.
     *
     * @param start start timestamp in nanoseconds
     * @param end   end timestamp in nanoseconds
     * @throws InvalidTimingException if {@code end} is earlier than {@code start} or the span exceeds
     *                                {@link Long#MAX_VALUE} nanoseconds, nothing is recorded
     */
    public void recordTiming(long start, long end) {
        histogram.record(elapsedNanos(start, end));
    }

    /**
     * Records a duration in nanoseconds.
     *
     * @param duration non-negative duration
     * @throws InvalidTimingException if the duration is negative
     */
    public void recordTiming(@NonNull Duration duration) {
        Objects.requireNonNull(duration, "duration must not be null");
        if (duration.isNegative()) {
            throw new InvalidTimingException("Timing duration must not be negative, but was: " + duration);
        }
        histogram.record(duration.toNanos());
    }

    /**
     * @return current summary of the histogram
     */
    @NonNull
    public HistogramSummary summarize() {
        return histogram.summarize();
    }

    @NonNull
    public MetricIdentity identity() {
        return identity;
    }

    @Override
    public String toString() {
        return "HistogramHandle{" + identity + '}';
    }

    static long elapsedNanos(long start, long end) {
        if (end < start) {
            throw new InvalidTimingException(start, end);
        }
        long elapsed = end - start;
        if (elapsed < 0L) {
            throw new InvalidTimingException("Timing span must not exceed " + Long.MAX_VALUE
                    + " nanoseconds, but was: start=" + start + ", end=" + end);
        }
        return elapsed;
    }
}
