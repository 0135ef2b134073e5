// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.metrics.runtime.config.ReceiverConfig;
import org.hiero.metrics.runtime.core.Labels;
import org.hiero.metrics.runtime.core.MetricRegistry;
import org.hiero.metrics.runtime.core.Scope;
import org.hiero.metrics.runtime.core.TimeSource;

/**
 * Owner of a metric registry. Hands out {@link Sink}s for recording and {@link Controller}s for snapshots.
 * New receiver can be created via {@link #builder()} using builder pattern.
 */
public final class Receiver {

    private static final Logger logger = LogManager.getLogger(Receiver.class);

    private final ReceiverConfig config;
    private final TimeSource timeSource;
    private final MetricRegistry registry;

    private Receiver(@NonNull ReceiverConfig config, @NonNull TimeSource timeSource) {
        this.config = config;
        this.timeSource = timeSource;
        this.registry = new MetricRegistry(config);
        logger.info(
                "Created metrics receiver. histogramPrecisionBits={}, histogramShards={}, quantiles={}",
                config.histogramPrecisionBits(),
                config.histogramShards(),
                config.quantiles());
    }

    /**
     * @return a new {@link Builder} for constructing {@link Receiver} instance.
     */
    @NonNull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return new sink in root scope without default labels
     */
    @NonNull
    public Sink sink() {
        return new Sink(registry, timeSource, Scope.root(), Labels.empty());
    }

    /**
     * @return controller taking snapshots of this receiver's registry
     */
    @NonNull
    public Controller controller() {
        return new Controller(registry);
    }

    /**
     * Install this receiver as the process-wide default used by {@link GlobalMetrics}.
     *
     * @throws IllegalStateException if a default receiver is already installed
     */
    public void install() {
        GlobalMetrics.install(this);
    }

    @NonNull
    public ReceiverConfig config() {
        return config;
    }

    @NonNull
    MetricRegistry registry() {
        return registry;
    }

    @NonNull
    TimeSource timeSource() {
        return timeSource;
    }

    /**
     * Builder for {@link Receiver}. Options are validated on {@link #build()}.
     */
    public static final class Builder {

        private int capacityHint;
        private int histogramPrecisionBits;
        private int histogramShards;
        private List<Double> quantiles;
        private boolean installAsDefault;
        private TimeSource timeSource = TimeSource.system();

        private Builder() {
            setConfig(ReceiverConfig.defaults());
        }

        /**
         * Apply all options of the given configuration, replacing previously set values.
         *
         * @param config the configuration
         * @return this builder
         */
        @NonNull
        public Builder setConfig(@NonNull ReceiverConfig config) {
            Objects.requireNonNull(config, "config must not be null");
            this.capacityHint = config.capacityHint();
            this.histogramPrecisionBits = config.histogramPrecisionBits();
            this.histogramShards = config.histogramShards();
            this.quantiles = config.quantiles();
            this.installAsDefault = config.installAsDefault();
            return this;
        }

        /**
         * @param capacityHint initial capacity of the registry, must not be negative
         * @return this builder
         */
        @NonNull
        public Builder setCapacityHint(int capacityHint) {
            this.capacityHint = capacityHint;
            return this;
        }

        /**
         * @param histogramPrecisionBits sub-bucket bits per magnitude in {@code [1, 10]}
         * @return this builder
         */
        @NonNull
        public Builder setHistogramPrecisionBits(int histogramPrecisionBits) {
            this.histogramPrecisionBits = histogramPrecisionBits;
            return this;
        }

        /**
         * @param histogramShards writer shards per histogram, power of two in {@code [1, 64]}
         * @return this builder
         */
        @NonNull
        public Builder setHistogramShards(int histogramShards) {
            this.histogramShards = histogramShards;
            return this;
        }

        /**
         * @param quantiles quantiles estimated for histograms, each in {@code [0, 1]}, at least one
         * @return this builder
         */
        @NonNull
        public Builder setQuantiles(@NonNull double... quantiles) {
            Objects.requireNonNull(quantiles, "quantiles must not be null");
            List<Double> values = new ArrayList<>(quantiles.length);
            for (double quantile : quantiles) {
                values.add(quantile);
            }
            this.quantiles = values;
            return this;
        }

        @NonNull
        public Builder setTimeSource(@NonNull TimeSource timeSource) {
            this.timeSource = Objects.requireNonNull(timeSource, "timeSource must not be null");
            return this;
        }

        /**
         * @param installAsDefault whether {@link #build()} installs the receiver as process-wide default
         * @return this builder
         */
        @NonNull
        public Builder setInstallAsDefault(boolean installAsDefault) {
            this.installAsDefault = installAsDefault;
            return this;
        }

        /**
         * Build the receiver.
         *
         * @return new receiver
         * @throws org.hiero.metrics.runtime.core.InvalidConfigurationException if any option is invalid
         * @throws IllegalStateException if installing as default while another receiver is installed
         */
        @NonNull
        public Receiver build() {
            ReceiverConfig config = new ReceiverConfig(
                    capacityHint, histogramPrecisionBits, histogramShards, quantiles, installAsDefault);
            Receiver receiver = new Receiver(config, timeSource);
            if (config.installAsDefault()) {
                receiver.install();
            }
            return receiver;
        }
    }
}
