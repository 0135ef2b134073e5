// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Properties;
import org.hiero.metrics.runtime.config.ReceiverConfig;
import org.hiero.metrics.runtime.core.HistogramSummary;
import org.hiero.metrics.runtime.core.InvalidConfigurationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

public class ReceiverTest {

    @AfterEach
    void tearDown() {
        GlobalMetrics.reset();
    }

    @Test
    void testDefaultBuild() {
        Receiver receiver = Receiver.builder().build();

        assertThat(receiver.config()).isEqualTo(ReceiverConfig.defaults());
        assertThat(GlobalMetrics.isInstalled()).isFalse();
    }

    @Test
    void testSinksShareRegistry() {
        Receiver receiver = Receiver.builder().build();

        receiver.sink().incrementCounter("widgets", 2);
        receiver.sink().incrementCounter("widgets", 3);

        assertThat(receiver.sink().counter("widgets").value()).isEqualTo(5L);
        assertThat(receiver.controller().snapshot().size()).isEqualTo(1);
    }

    @Test
    void testSeparateReceiversAreIsolated() {
        Receiver first = Receiver.builder().build();
        Receiver second = Receiver.builder().build();

        first.sink().incrementCounter("widgets", 1);

        assertThat(second.controller().snapshot().isEmpty()).isTrue();
    }

    @Nested
    class BuilderTests {

        @Test
        void testCustomOptions() {
            Receiver receiver = Receiver.builder()
                    .setCapacityHint(8)
                    .setHistogramPrecisionBits(3)
                    .setHistogramShards(2)
                    .setQuantiles(0.25, 0.75)
                    .build();

            assertThat(receiver.config()).isEqualTo(new ReceiverConfig(8, 3, 2, List.of(0.25, 0.75), false));

            receiver.sink().recordValue("rows", 4);
            HistogramSummary summary = receiver.sink().histogram("rows").summarize();
            assertThat(summary.quantiles())
                    .extracting(HistogramSummary.Quantile::quantile)
                    .containsExactly(0.25, 0.75);
        }

        @Test
        void testInvalidOptionsFailBuild() {
            assertThatThrownBy(() -> Receiver.builder().setHistogramShards(3).build())
                    .isInstanceOf(InvalidConfigurationException.class);
            assertThatThrownBy(() -> Receiver.builder().setHistogramPrecisionBits(0).build())
                    .isInstanceOf(InvalidConfigurationException.class);
            assertThatThrownBy(() -> Receiver.builder().setCapacityHint(-1).build())
                    .isInstanceOf(InvalidConfigurationException.class);
            assertThatThrownBy(() -> Receiver.builder().setQuantiles().build())
                    .isInstanceOf(InvalidConfigurationException.class);
            assertThatThrownBy(() -> Receiver.builder().setQuantiles(2.0).build())
                    .isInstanceOf(InvalidConfigurationException.class);
        }

        @Test
        void testNullArgumentsThrow() {
            assertThatThrownBy(() -> Receiver.builder().setTimeSource(null))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessage("timeSource must not be null");
            assertThatThrownBy(() -> Receiver.builder().setConfig(null))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessage("config must not be null");
        }

        @Test
        void testSetConfigFromProperties() {
            Properties properties = new Properties();
            properties.setProperty(ReceiverConfig.HISTOGRAM_PRECISION_BITS, "4");
            properties.setProperty(ReceiverConfig.HISTOGRAM_SHARDS, "1");

            Receiver receiver = Receiver.builder()
                    .setConfig(ReceiverConfig.fromProperties(properties))
                    .build();

            assertThat(receiver.config().histogramPrecisionBits()).isEqualTo(4);
            assertThat(receiver.config().histogramShards()).isEqualTo(1);
        }

        @Test
        void testInstallAsDefault() {
            Receiver receiver = Receiver.builder().setInstallAsDefault(true).build();

            assertThat(GlobalMetrics.isInstalled()).isTrue();
            assertThat(GlobalMetrics.receiver()).containsSame(receiver);
            assertThatThrownBy(() -> Receiver.builder().setInstallAsDefault(true).build())
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
