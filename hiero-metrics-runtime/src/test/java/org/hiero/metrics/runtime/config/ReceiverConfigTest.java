// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Properties;
import org.hiero.metrics.runtime.core.InvalidConfigurationException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class ReceiverConfigTest {

    @Test
    void testDefaults() {
        ReceiverConfig config = ReceiverConfig.defaults();

        assertThat(config.capacityHint()).isEqualTo(64);
        assertThat(config.histogramPrecisionBits()).isEqualTo(7);
        assertThat(config.histogramShards()).isBetween(1, 16);
        assertThat(Integer.bitCount(config.histogramShards())).isEqualTo(1);
        assertThat(config.quantiles()).containsExactly(0.5, 0.9, 0.99, 0.999);
        assertThat(config.installAsDefault()).isFalse();
    }

    @Test
    void testDefaultShardsCoverProcessors() {
        int processors = Runtime.getRuntime().availableProcessors();

        assertThat(ReceiverConfig.defaultShards()).isGreaterThanOrEqualTo(Math.min(processors, 16));
    }

    @Test
    void testQuantilesSortedAndDistinct() {
        ReceiverConfig config = new ReceiverConfig(0, 3, 1, List.of(0.99, 0.5, 0.99), false);

        assertThat(config.quantiles()).containsExactly(0.5, 0.99);
        assertThat(config.quantilesArray()).containsExactly(0.5, 0.99);
    }

    @Nested
    class Validation {

        @Test
        void testNegativeCapacity() {
            assertThatThrownBy(() -> new ReceiverConfig(-1, 7, 1, List.of(0.5), false))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("capacityHint");
        }

        @ParameterizedTest
        @ValueSource(ints = {0, 11, -3})
        void testPrecisionBitsOutOfRange(int bits) {
            assertThatThrownBy(() -> new ReceiverConfig(0, bits, 1, List.of(0.5), false))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("histogramPrecisionBits");
        }

        @ParameterizedTest
        @ValueSource(ints = {0, 6, 128})
        void testShardsNotPowerOfTwoInRange(int shards) {
            assertThatThrownBy(() -> new ReceiverConfig(0, 7, shards, List.of(0.5), false))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("histogramShards");
        }

        @Test
        void testNoQuantiles() {
            assertThatThrownBy(() -> new ReceiverConfig(0, 7, 1, List.of(), false))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("at least one quantile");
        }

        @Test
        void testQuantileOutOfRange() {
            assertThatThrownBy(() -> new ReceiverConfig(0, 7, 1, List.of(0.5, -0.1), false))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("quantile must be in [0, 1]");
        }

        @Test
        void testQuantilesWithSameLabel() {
            assertThatThrownBy(() -> new ReceiverConfig(0, 7, 1, List.of(0.999, 0.0999), false))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("share the same label: p999");
        }
    }

    @Nested
    class FromProperties {

        @Test
        void testEmptyPropertiesGiveDefaults() {
            assertThat(ReceiverConfig.fromProperties(new Properties())).isEqualTo(ReceiverConfig.defaults());
        }

        @Test
        void testAllProperties() {
            Properties properties = new Properties();
            properties.setProperty("metrics.runtime.capacityHint", "1024");
            properties.setProperty("metrics.runtime.histogram.precisionBits", " 5 ");
            properties.setProperty("metrics.runtime.histogram.shards", "32");
            properties.setProperty("metrics.runtime.histogram.quantiles", "0.99, 0.5,0.75");
            properties.setProperty("metrics.runtime.installAsDefault", "TRUE");

            ReceiverConfig config = ReceiverConfig.fromProperties(properties);

            assertThat(config).isEqualTo(new ReceiverConfig(1024, 5, 32, List.of(0.5, 0.75, 0.99), true));
        }

        @Test
        void testMalformedInteger() {
            Properties properties = new Properties();
            properties.setProperty(ReceiverConfig.HISTOGRAM_SHARDS, "many");

            assertThatThrownBy(() -> ReceiverConfig.fromProperties(properties))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining(ReceiverConfig.HISTOGRAM_SHARDS)
                    .hasCauseInstanceOf(NumberFormatException.class);
        }

        @Test
        void testMalformedBoolean() {
            Properties properties = new Properties();
            properties.setProperty(ReceiverConfig.INSTALL_AS_DEFAULT, "yes");

            assertThatThrownBy(() -> ReceiverConfig.fromProperties(properties))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining(ReceiverConfig.INSTALL_AS_DEFAULT);
        }

        @Test
        void testMalformedQuantiles() {
            Properties properties = new Properties();
            properties.setProperty(ReceiverConfig.HISTOGRAM_QUANTILES, "0.5,p99");

            assertThatThrownBy(() -> ReceiverConfig.fromProperties(properties))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining(ReceiverConfig.HISTOGRAM_QUANTILES);
        }

        @Test
        void testOutOfRangePropertyIsNotDefaulted() {
            Properties properties = new Properties();
            properties.setProperty(ReceiverConfig.HISTOGRAM_PRECISION_BITS, "20");

            assertThatThrownBy(() -> ReceiverConfig.fromProperties(properties))
                    .isInstanceOf(InvalidConfigurationException.class);
        }
    }
}
