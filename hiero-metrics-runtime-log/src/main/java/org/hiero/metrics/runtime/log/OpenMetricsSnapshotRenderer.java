// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.log;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.metrics.runtime.core.HistogramSummary;
import org.hiero.metrics.runtime.core.Label;
import org.hiero.metrics.runtime.core.Labels;
import org.hiero.metrics.runtime.core.MetricIdentity;
import org.hiero.metrics.runtime.core.MetricKind;

/**
 * A renderer that writes snapshot entries in the OpenMetrics text format, as scraped by Prometheus.
 * <p>
 * The qualified name becomes the metric name with every character outside {@code [a-zA-Z0-9_:]} replaced by
 * {@code _}, so {@code os.load_stat.avg_1min} is written as {@code os_load_stat_avg_1min}. Counters get the
 * {@code _total} suffix and are written unsigned. Histograms are written as summaries with one sample per
 * quantile and {@code _sum} and {@code _count} samples. Entries of the same metric name are grouped under one
 * {@code # TYPE} line. An entry whose name is already used by a metric of another kind is skipped.
 * <p>
 * This class is not thread-safe.
 *
 * <p>See <a href="https://github.com/prometheus/OpenMetrics/blob/main/specification/OpenMetrics.md">OpenMetrics</a> for details.
 */
public final class OpenMetricsSnapshotRenderer implements SnapshotRenderer {

    private static final Logger logger = LogManager.getLogger(OpenMetricsSnapshotRenderer.class);

    private static final EnumMap<MetricKind, String> METRIC_TYPES = new EnumMap<>(MetricKind.class);

    static {
        METRIC_TYPES.put(MetricKind.COUNTER, "counter");
        METRIC_TYPES.put(MetricKind.GAUGE, "gauge");
        METRIC_TYPES.put(MetricKind.HISTOGRAM, "summary");
    }

    private static final String COUNTER_SUFFIX = "_total";
    private static final String SUM_SUFFIX = "_sum";
    private static final String COUNT_SUFFIX = "_count";
    private static final String QUANTILE_LABEL = "quantile";
    private static final String TYPE = "# TYPE ";
    private static final String END = "# EOF\n";

    private final Map<String, Family> families = new LinkedHashMap<>();

    @Override
    public void observeCounter(@NonNull MetricIdentity identity, long value) {
        Family family = family(identity, MetricKind.COUNTER);
        if (family != null) {
            writeSample(family.samples, family.name + COUNTER_SUFFIX, identity.labels(), null);
            family.samples.append(Long.toUnsignedString(value)).append('\n');
        }
    }

    @Override
    public void observeGauge(@NonNull MetricIdentity identity, long value) {
        Family family = family(identity, MetricKind.GAUGE);
        if (family != null) {
            writeSample(family.samples, family.name, identity.labels(), null);
            family.samples.append(value).append('\n');
        }
    }

    @Override
    public void observeHistogram(@NonNull MetricIdentity identity, @NonNull HistogramSummary summary) {
        Objects.requireNonNull(summary, "summary must not be null");
        Family family = family(identity, MetricKind.HISTOGRAM);
        if (family == null) {
            return;
        }
        StringBuilder samples = family.samples;
        for (HistogramSummary.Quantile quantile : summary.quantiles()) {
            writeSample(samples, family.name, identity.labels(), formatQuantile(quantile.quantile()));
            samples.append(quantile.value()).append('\n');
        }
        writeSample(samples, family.name + SUM_SUFFIX, identity.labels(), null);
        samples.append(Long.toUnsignedString(summary.sum())).append('\n');
        writeSample(samples, family.name + COUNT_SUFFIX, identity.labels(), null);
        samples.append(summary.count()).append('\n');
    }

    @NonNull
    @Override
    public String render() {
        StringBuilder output = new StringBuilder();
        for (Family family : families.values()) {
            output.append(TYPE)
                    .append(family.name)
                    .append(' ')
                    .append(METRIC_TYPES.get(family.kind))
                    .append('\n');
            output.append(family.samples);
        }
        return output.append(END).toString();
    }

    private Family family(MetricIdentity identity, MetricKind kind) {
        Objects.requireNonNull(identity, "identity must not be null");
        String name = metricName(identity.qualifiedName());
        Family family = families.computeIfAbsent(name, n -> new Family(n, kind));
        if (family.kind != kind) {
            logger.warn("Skipping {} {}, metric name {} is already used by a {}", kind, identity, name, family.kind);
            return null;
        }
        return family;
    }

    private static void writeSample(StringBuilder output, String name, Labels labels, String quantile) {
        output.append(name);
        if (!labels.isEmpty() || quantile != null) {
            output.append('{');
            boolean first = true;
            for (Label label : labels.asList()) {
                if (!first) {
                    output.append(',');
                }
                first = false;
                appendLabel(output, labelName(label.key()), label.value());
            }
            if (quantile != null) {
                if (!first) {
                    output.append(',');
                }
                appendLabel(output, QUANTILE_LABEL, quantile);
            }
            output.append('}');
        }
        output.append(' ');
    }

    private static void appendLabel(StringBuilder output, String name, String value) {
        output.append(name).append("=\"").append(escape(value)).append('"');
    }

    static String metricName(String qualifiedName) {
        StringBuilder sb = new StringBuilder(qualifiedName.length() + 1);
        if (Character.isDigit(qualifiedName.charAt(0))) {
            sb.append('_');
        }
        for (int i = 0; i < qualifiedName.length(); i++) {
            char c = qualifiedName.charAt(i);
            sb.append(isNameChar(c, true) ? c : '_');
        }
        return sb.toString();
    }

    static String labelName(String key) {
        StringBuilder sb = new StringBuilder(key.length() + 1);
        if (Character.isDigit(key.charAt(0))) {
            sb.append('_');
        }
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            sb.append(isNameChar(c, false) ? c : '_');
        }
        return sb.toString();
    }

    private static boolean isNameChar(char c, boolean allowColon) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_'
                || (allowColon && c == ':');
    }

    private static String formatQuantile(double quantile) {
        return BigDecimal.valueOf(quantile).stripTrailingZeros().toPlainString();
    }

    /**
     * Escape newline {@code \n}, double quote {@code "} and backslash {@code \} characters in label values.
     *
     * @param value the label value to escape
     * @return the escaped string
     */
    private static String escape(final String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    private static final class Family {
        private final String name;
        private final MetricKind kind;
        private final StringBuilder samples = new StringBuilder();

        private Family(String name, MetricKind kind) {
            this.name = name;
            this.kind = kind;
        }
    }
}
