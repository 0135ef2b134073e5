// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.hiero.metrics.runtime.ThreadUtils;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class CounterTest {

    @Test
    void testInitialValueIsZero() {
        Counter counter = new Counter();

        assertThat(counter.get()).isZero();
        assertThat(counter.kind()).isEqualTo(MetricKind.COUNTER);
        assertThat(counter.measure()).isEqualTo(new Measurement.Counter(0L));
    }

    @Test
    void testIncrement() {
        Counter counter = new Counter();

        counter.increment();
        counter.increment(2);
        counter.increment(0);

        assertThat(counter.get()).isEqualTo(3L);
        assertThat(counter.getAsString()).isEqualTo("3");
    }

    @ParameterizedTest
    @ValueSource(longs = {-1, -100, Long.MIN_VALUE})
    void testNegativeIncrementThrows(long delta) {
        Counter counter = new Counter();
        counter.increment(5);

        assertThatThrownBy(() -> counter.increment(delta))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Increment value must be non-negative");
        assertThat(counter.get()).isEqualTo(5L);
    }

    @Nested
    class Overflow {

        @Test
        void testValuesAboveSignedRangeAreUnsigned() {
            Counter counter = new Counter();

            counter.increment(Long.MAX_VALUE);
            counter.increment(Long.MAX_VALUE);

            assertThat(counter.get()).isEqualTo(-2L);
            assertThat(counter.getAsString()).isEqualTo("18446744073709551614");
        }

        @Test
        void testWrapsModuloTwoToThe64() {
            Counter counter = new Counter();

            counter.increment(Long.MAX_VALUE);
            counter.increment(Long.MAX_VALUE);
            counter.increment(2);

            assertThat(counter.get()).isZero();

            counter.increment(7);
            assertThat(counter.get()).isEqualTo(7L);
        }
    }

    @Test
    void testConcurrentIncrementsAreNotLost() throws InterruptedException {
        Counter counter = new Counter();
        int threads = 8;
        int incrementsPerThread = 20_000;
        AtomicLong expected = new AtomicLong();

        ThreadUtils.runConcurrentAndWait(threads, Duration.ofSeconds(10), threadIndex -> () -> {
            long delta = threadIndex + 1L;
            for (int i = 0; i < incrementsPerThread; i++) {
                counter.increment(delta);
                expected.addAndGet(delta);
            }
        });

        assertThat(counter.get()).isEqualTo(expected.get());
        assertThat(counter.get()).isEqualTo(36L * incrementsPerThread);
    }
}
