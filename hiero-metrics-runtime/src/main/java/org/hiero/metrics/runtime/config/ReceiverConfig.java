// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.config;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.hiero.metrics.runtime.core.HistogramSummary;
import org.hiero.metrics.runtime.core.InvalidConfigurationException;

/**
 * Startup options of a receiver, fixed at construction time.
 * Properties are read with prefix {@value #PREFIX}.
 *
 * @param capacityHint           initial capacity of the metric registry (default: 64, min: 0)
 * @param histogramPrecisionBits sub-bucket bits per magnitude, relative error below {@code 2^-bits} (default: 7, range: 1-10)
 * @param histogramShards        writer shards per histogram, power of two (default: next power of two of available
 *                               processors, max 16, range: 1-64)
 * @param quantiles              quantiles estimated for histograms, sorted and distinct, with distinct labels such as
 *                               {@code p99} (default: 0.5,0.9,0.99,0.999)
 * @param installAsDefault       whether the receiver installs itself as process-wide default (default: false)
 */
public record ReceiverConfig(
        int capacityHint,
        int histogramPrecisionBits,
        int histogramShards,
        @NonNull List<Double> quantiles,
        boolean installAsDefault) {

    /** Prefix of all receiver properties. */
    public static final String PREFIX = "metrics.runtime.";

    public static final String CAPACITY_HINT = PREFIX + "capacityHint";
    public static final String HISTOGRAM_PRECISION_BITS = PREFIX + "histogram.precisionBits";
    public static final String HISTOGRAM_SHARDS = PREFIX + "histogram.shards";
    public static final String HISTOGRAM_QUANTILES = PREFIX + "histogram.quantiles";
    public static final String INSTALL_AS_DEFAULT = PREFIX + "installAsDefault";

    public static final int DEFAULT_CAPACITY_HINT = 64;
    public static final int DEFAULT_PRECISION_BITS = 7;
    public static final int MAX_DEFAULT_SHARDS = 16;
    public static final List<Double> DEFAULT_QUANTILES = List.of(0.5, 0.9, 0.99, 0.999);

    /**
     * @throws InvalidConfigurationException if any option is out of range
     */
    public ReceiverConfig {
        if (capacityHint < 0) {
            throw new InvalidConfigurationException("capacityHint must be non-negative, but was: " + capacityHint);
        }
        if (histogramPrecisionBits < 1 || histogramPrecisionBits > 10) {
            throw new InvalidConfigurationException(
                    "histogramPrecisionBits must be in [1, 10], but was: " + histogramPrecisionBits);
        }
        if (histogramShards < 1 || histogramShards > 64 || Integer.bitCount(histogramShards) != 1) {
            throw new InvalidConfigurationException(
                    "histogramShards must be a power of two in [1, 64], but was: " + histogramShards);
        }
        Objects.requireNonNull(quantiles, "quantiles must not be null");
        if (quantiles.isEmpty()) {
            throw new InvalidConfigurationException("at least one quantile must be configured");
        }
        for (Double quantile : quantiles) {
            if (quantile == null || !(quantile >= 0.0 && quantile <= 1.0)) {
                throw new InvalidConfigurationException("quantile must be in [0, 1], but was: " + quantile);
            }
        }
        quantiles = quantiles.stream().distinct().sorted().toList();
        Map<String, Double> labels = new HashMap<>();
        for (Double quantile : quantiles) {
            Double previous = labels.put(new HistogramSummary.Quantile(quantile, 0L).label(), quantile);
            if (previous != null) {
                throw new InvalidConfigurationException("quantiles " + previous + " and " + quantile
                        + " share the same label: " + new HistogramSummary.Quantile(quantile, 0L).label());
            }
        }
    }

    /**
     * @return configuration with all default values
     */
    @NonNull
    public static ReceiverConfig defaults() {
        return new ReceiverConfig(
                DEFAULT_CAPACITY_HINT, DEFAULT_PRECISION_BITS, defaultShards(), DEFAULT_QUANTILES, false);
    }

    /**
     * @return next power of two of available processors, at most {@value #MAX_DEFAULT_SHARDS}
     */
    public static int defaultShards() {
        int processors = Math.max(1, Runtime.getRuntime().availableProcessors());
        int shards = Integer.highestOneBit(processors);
        if (shards < processors) {
            shards <<= 1;
        }
        return Math.min(shards, MAX_DEFAULT_SHARDS);
    }

    /**
     * Read configuration from properties. Missing properties take default values.
     *
     * @param properties the properties
     * @return the configuration
     * @throws InvalidConfigurationException if a property value is malformed or out of range
     */
    @NonNull
    public static ReceiverConfig fromProperties(@NonNull Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        ReceiverConfig defaults = defaults();
        return new ReceiverConfig(
                intProperty(properties, CAPACITY_HINT, defaults.capacityHint()),
                intProperty(properties, HISTOGRAM_PRECISION_BITS, defaults.histogramPrecisionBits()),
                intProperty(properties, HISTOGRAM_SHARDS, defaults.histogramShards()),
                quantilesProperty(properties, defaults.quantiles()),
                booleanProperty(properties, INSTALL_AS_DEFAULT, defaults.installAsDefault()));
    }

    /**
     * @return quantiles as primitive array
     */
    @NonNull
    public double[] quantilesArray() {
        return quantiles.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private static int intProperty(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Property " + key + " must be an integer, but was: " + value, e);
        }
    }

    private static boolean booleanProperty(Properties properties, String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        throw new InvalidConfigurationException("Property " + key + " must be true or false, but was: " + value);
    }

    private static List<Double> quantilesProperty(Properties properties, List<Double> defaultValue) {
        String value = properties.getProperty(HISTOGRAM_QUANTILES);
        if (value == null) {
            return defaultValue;
        }
        List<Double> quantiles = new ArrayList<>();
        for (String part : value.split(",")) {
            if (part.isBlank()) {
                continue;
            }
            try {
                quantiles.add(Double.parseDouble(part.trim()));
            } catch (NumberFormatException e) {
                throw new InvalidConfigurationException(
                        "Property " + HISTOGRAM_QUANTILES + " must be a comma separated list of numbers, but was: "
                                + value,
                        e);
            }
        }
        return quantiles;
    }
}
