// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigDecimal;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Point-in-time summary of a {@link Histogram}.
 * All values are zero for an empty histogram. The sum is unsigned and wraps modulo {@code 2^64}.
 *
 * @param count     number of recorded samples
 * @param sum       sum of recorded samples
 * @param min       smallest recorded sample
 * @param max       largest recorded sample
 * @param quantiles quantile estimates, sorted by quantile
 */
public record HistogramSummary(long count, long sum, long min, long max, @NonNull List<Quantile> quantiles) {

    public HistogramSummary {
        Objects.requireNonNull(quantiles, "quantiles must not be null");
        quantiles = List.copyOf(quantiles);
    }

    /**
     * Get the estimate of the given quantile.
     *
     * @param quantile the quantile, as configured for the histogram
     * @return the estimated value
     * @throws NoSuchElementException if the quantile was not computed
     */
    public long quantile(double quantile) {
        for (Quantile q : quantiles) {
            if (Double.compare(q.quantile(), quantile) == 0) {
                return q.value();
            }
        }
        throw new NoSuchElementException("Quantile " + quantile + " is not computed, available: " + quantiles);
    }

    /**
     * @return arithmetic mean of recorded samples, {@code 0.0} if empty
     */
    public double mean() {
        return count == 0L ? 0.0 : MetricUtils.unsignedToDouble(sum) / count;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(64);
        sb.append("count=")
                .append(count)
                .append(", sum=")
                .append(Long.toUnsignedString(sum))
                .append(", min=")
                .append(min)
                .append(", max=")
                .append(max);
        for (Quantile q : quantiles) {
            sb.append(", ").append(q.label()).append('=').append(q.value());
        }
        return sb.toString();
    }

    /**
     * Estimated value of one quantile.
     *
     * @param quantile the quantile in {@code [0, 1]}
     * @param value    the estimated value
     */
    public record Quantile(double quantile, long value) {

        /**
         * @return short label of the quantile, e.g. {@code p50} for {@code 0.5} and {@code p999} for {@code 0.999}
         */
        @NonNull
        public String label() {
            String percent = BigDecimal.valueOf(quantile)
                    .movePointRight(2)
                    .stripTrailingZeros()
                    .toPlainString();
            return "p" + percent.replace(".", "");
        }
    }
}
