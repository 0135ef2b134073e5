// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.log;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.stream.Stream;
import org.hiero.metrics.runtime.Receiver;
import org.hiero.metrics.runtime.Sink;
import org.hiero.metrics.runtime.core.HistogramSummary;
import org.hiero.metrics.runtime.core.Measurement;
import org.hiero.metrics.runtime.core.MetricIdentity;
import org.hiero.metrics.runtime.core.ProxyMeasurement;
import org.hiero.metrics.runtime.core.Scope;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

public class OpenMetricsSnapshotRendererTest {

    private static String render(Receiver receiver) {
        OpenMetricsSnapshotRenderer renderer = new OpenMetricsSnapshotRenderer();
        receiver.controller().snapshot().observe(renderer);
        return renderer.render();
    }

    @Test
    void testEmptyDocument() {
        assertThat(new OpenMetricsSnapshotRenderer().render()).isEqualTo("# EOF\n");
    }

    @Test
    void testAllKinds() {
        Receiver receiver = Receiver.builder().setQuantiles(0.5, 0.99).build();
        Sink sink = receiver.sink();
        sink.incrementCounter("widgets", 5);
        sink.updateGauge("red_balloons", 99);
        sink.recordValue("rows", 46);

        assertThat(render(receiver)).isEqualTo("""
                # TYPE red_balloons gauge
                red_balloons 99
                # TYPE rows summary
                rows{quantile="0.5"} 46
                rows{quantile="0.99"} 46
                rows_sum 46
                rows_count 1
                # TYPE widgets counter
                widgets_total 5
                # EOF
                """);
    }

    @Test
    void testScopedNamesAndLabels() {
        Receiver receiver = Receiver.builder().setQuantiles(1.0).build();
        Sink sink = receiver.sink().scoped("os");
        sink.proxy("load_stat", () -> List.of(ProxyMeasurement.of("avg_1min", Measurement.gauge(3))));
        sink.incrementCounter("requests", 4, "method", "get");
        sink.incrementCounter("requests", 1, "method", "put");
        sink.recordValue("latency", 7, "op", "read");

        assertThat(render(receiver)).isEqualTo("""
                # TYPE os_latency summary
                os_latency{op="read",quantile="1"} 7
                os_latency_sum{op="read"} 7
                os_latency_count{op="read"} 1
                # TYPE os_requests counter
                os_requests_total{method="get"} 4
                os_requests_total{method="put"} 1
                # TYPE os_load_stat_avg_1min gauge
                os_load_stat_avg_1min 3
                # EOF
                """);
    }

    @Test
    void testCounterRenderedUnsigned() {
        OpenMetricsSnapshotRenderer renderer = new OpenMetricsSnapshotRenderer();

        renderer.observeCounter(MetricIdentity.of("big"), -1L);

        assertThat(renderer.render()).isEqualTo("""
                # TYPE big counter
                big_total 18446744073709551615
                # EOF
                """);
    }

    @Test
    void testNameClashWithOtherKindIsSkipped() {
        OpenMetricsSnapshotRenderer renderer = new OpenMetricsSnapshotRenderer();

        renderer.observeGauge(MetricIdentity.of("a_b"), 1);
        renderer.observeCounter(MetricIdentity.of("b", Scope.of("a")), 2);
        renderer.observeHistogram(MetricIdentity.of("a-b"), new HistogramSummary(0, 0, 0, 0, List.of()));

        assertThat(renderer.render()).isEqualTo("""
                # TYPE a_b gauge
                a_b 1
                # EOF
                """);
    }

    @Nested
    class Sanitizing {

        private static Stream<Arguments> labelValues() {
            return Stream.of(
                    Arguments.of("\n Newline", "\\n Newline"),
                    Arguments.of("\" Double Quote", "\\\" Double Quote"),
                    Arguments.of("\\ Backslash", "\\\\ Backslash"),
                    Arguments.of("\t Tab", "\t Tab"),
                    Arguments.of("#$%^&*()_+-=[]{}|;':,.<>/?`~", "#$%^&*()_+-=[]{}|;':,.<>/?`~"),
                    Arguments.of("測試指標", "測試指標"));
        }

        @ParameterizedTest
        @MethodSource("labelValues")
        void testLabelValueEscape(String labelValue, String expectedLabelValue) {
            OpenMetricsSnapshotRenderer renderer = new OpenMetricsSnapshotRenderer();

            renderer.observeGauge(MetricIdentity.of("test_metric", Scope.root(), "label", labelValue), 1);

            assertThat(renderer.render()).isEqualTo("""
                    # TYPE test_metric gauge
                    test_metric{label="%s"} 1
                    # EOF
                    """.formatted(expectedLabelValue));
        }

        @Test
        void testMetricAndLabelNames() {
            assertThat(OpenMetricsSnapshotRenderer.metricName("db.pool-size:max")).isEqualTo("db_pool_size:max");
            assertThat(OpenMetricsSnapshotRenderer.metricName("9lives")).isEqualTo("_9lives");
            assertThat(OpenMetricsSnapshotRenderer.labelName("http.status:code")).isEqualTo("http_status_code");
        }
    }
}
