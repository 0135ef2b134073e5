// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * Immutable value of a metric at snapshot time.
 */
public sealed interface Measurement permits Measurement.Counter, Measurement.Gauge, Measurement.Histogram {

    /**
     * @return kind of the metric this value was read from
     */
    @NonNull
    MetricKind kind();

    /**
     * Create a counter measurement.
     *
     * @param value counter bits, interpreted as unsigned
     */
    @NonNull
    static Measurement counter(long value) {
        return new Counter(value);
    }

    /**
     * Create a gauge measurement.
     *
     * @param value gauge value
     */
    @NonNull
    static Measurement gauge(long value) {
        return new Gauge(value);
    }

    /**
     * Create a histogram measurement.
     *
     * @param summary histogram summary
     */
    @NonNull
    static Measurement histogram(@NonNull HistogramSummary summary) {
        return new Histogram(summary);
    }

    /**
     * Counter total, the bits are interpreted as unsigned 64-bit integer.
     */
    record Counter(long value) implements Measurement {

        @NonNull
        @Override
        public MetricKind kind() {
            return MetricKind.COUNTER;
        }

        @Override
        public String toString() {
            return Long.toUnsignedString(value);
        }
    }

    /**
     * Gauge value.
     */
    record Gauge(long value) implements Measurement {

        @NonNull
        @Override
        public MetricKind kind() {
            return MetricKind.GAUGE;
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    /**
     * Histogram summary.
     */
    record Histogram(@NonNull HistogramSummary summary) implements Measurement {

        public Histogram {
            Objects.requireNonNull(summary, "summary must not be null");
        }

        @NonNull
        @Override
        public MetricKind kind() {
            return MetricKind.HISTOGRAM;
        }

        @Override
        public String toString() {
            return summary.toString();
        }
    }
}
