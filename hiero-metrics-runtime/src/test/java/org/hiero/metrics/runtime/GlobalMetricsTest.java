// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.atomic.AtomicLong;
import org.hiero.metrics.runtime.core.InvalidTimingException;
import org.hiero.metrics.runtime.core.KindMismatchException;
import org.hiero.metrics.runtime.core.Labels;
import org.hiero.metrics.runtime.core.Measurement;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public class GlobalMetricsTest {

    @AfterEach
    void tearDown() {
        GlobalMetrics.reset();
    }

    @Test
    void testNoOpWhileNotInstalled() {
        assertThat(GlobalMetrics.isInstalled()).isFalse();
        assertThat(GlobalMetrics.receiver()).isEmpty();

        GlobalMetrics.incrementCounter("widgets", 5);
        GlobalMetrics.updateGauge("red_balloons", 99);
        GlobalMetrics.recordValue("rows", 46);
        GlobalMetrics.recordTiming("latency", 1, 2);

        Receiver receiver = Receiver.builder().build();
        receiver.install();
        assertThat(receiver.controller().snapshot().isEmpty()).isTrue();
    }

    @Test
    void testRecordsIntoInstalledReceiver() {
        Receiver receiver = Receiver.builder().build();
        receiver.install();

        GlobalMetrics.incrementCounter("widgets", 5);
        GlobalMetrics.incrementCounter("widgets", 1);
        GlobalMetrics.updateGauge("red_balloons", 99, "color", "red");
        GlobalMetrics.recordValue("rows", 46);
        GlobalMetrics.recordTiming("latency", 100, 350);

        Snapshot snapshot = receiver.controller().snapshot();
        assertThat(snapshot.find("widgets")).contains(Measurement.counter(6));
        assertThat(snapshot.find("red_balloons", Labels.of("color", "red"))).contains(Measurement.gauge(99));
        assertThat(receiver.sink().histogram("rows").summarize().sum()).isEqualTo(46L);
        assertThat(receiver.sink().histogram("latency").summarize().max()).isEqualTo(250L);
    }

    @Test
    void testSharesCellsWithRootSink() {
        Receiver receiver = Receiver.builder().build();
        receiver.install();
        CounterHandle handle = receiver.sink().counter("widgets");

        GlobalMetrics.incrementCounter("widgets", 3);

        assertThat(handle.value()).isEqualTo(3L);
    }

    @Test
    void testSecondInstallThrows() {
        Receiver first = Receiver.builder().build();
        Receiver second = Receiver.builder().build();
        first.install();

        assertThatThrownBy(second::install)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already installed");
        assertThat(GlobalMetrics.receiver()).containsSame(first);
    }

    @Test
    void testErrorsAreReportedToCaller() {
        Receiver.builder().build().install();
        GlobalMetrics.incrementCounter("widgets", 1);

        assertThatThrownBy(() -> GlobalMetrics.recordValue("widgets", 1)).isInstanceOf(KindMismatchException.class);
        assertThatThrownBy(() -> GlobalMetrics.recordTiming("latency", 10, 5))
                .isInstanceOf(InvalidTimingException.class);
        assertThatThrownBy(() -> GlobalMetrics.incrementCounter("widgets", -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testNowUsesInstalledTimeSource() {
        AtomicLong clock = new AtomicLong(123L);
        Receiver.builder().setTimeSource(clock::get).build().install();

        assertThat(GlobalMetrics.now()).isEqualTo(123L);
    }
}
