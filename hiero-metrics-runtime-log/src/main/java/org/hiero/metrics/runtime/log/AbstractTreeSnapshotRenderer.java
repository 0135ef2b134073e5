// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.log;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.hiero.metrics.runtime.core.HistogramSummary;
import org.hiero.metrics.runtime.core.MetricIdentity;

/**
 * Base of renderers that arrange snapshot entries into a nested map and serialize it with a Jackson
 * {@link ObjectMapper}.
 * <p>
 * Scope segments become nested keys, sorted alphabetically. Labels are appended to the leaf key as
 * {@code name{key=value,...}}. Counters and gauges are numbers, counters unsigned. Histograms are nested maps
 * with {@code count}, {@code sum}, {@code min}, {@code max} and one key per quantile such as {@code p99}.
 * A key holding both a value and children keeps the value under {@value #VALUE_KEY}.
 * When two entries share the same key, the later one wins.
 */
abstract class AbstractTreeSnapshotRenderer implements SnapshotRenderer {

    static final String VALUE_KEY = "value";

    private final ObjectMapper mapper;
    private final Node root = new Node();

    protected AbstractTreeSnapshotRenderer(@NonNull ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public void observeCounter(@NonNull MetricIdentity identity, long value) {
        leaf(identity).setScalar(unsigned(value));
    }

    @Override
    public void observeGauge(@NonNull MetricIdentity identity, long value) {
        leaf(identity).setScalar(value);
    }

    @Override
    public void observeHistogram(@NonNull MetricIdentity identity, @NonNull HistogramSummary summary) {
        Objects.requireNonNull(summary, "summary must not be null");
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("count", summary.count());
        fields.put("sum", unsigned(summary.sum()));
        fields.put("min", summary.min());
        fields.put("max", summary.max());
        for (HistogramSummary.Quantile quantile : summary.quantiles()) {
            fields.put(quantile.label(), quantile.value());
        }
        leaf(identity).setFields(fields);
    }

    @NonNull
    @Override
    public String render() {
        if (root.children.isEmpty()) {
            return emptyDocument();
        }
        try {
            return mapper.writeValueAsString(toMap(root));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException("Error rendering metrics snapshot", e));
        }
    }

    /**
     * @return text rendered when nothing was observed
     */
    @NonNull
    protected abstract String emptyDocument();

    private Node leaf(MetricIdentity identity) {
        Objects.requireNonNull(identity, "identity must not be null");
        Node node = root;
        for (String segment : identity.scope().segments()) {
            node = node.child(segment);
        }
        String leafKey = identity.labels().isEmpty() ? identity.name() : identity.name() + identity.labels();
        return node.child(leafKey);
    }

    private static Number unsigned(long value) {
        return value >= 0L ? Long.valueOf(value) : new BigInteger(Long.toUnsignedString(value));
    }

    private static Map<String, Object> toMap(Node node) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (node.scalar != null) {
            map.put(VALUE_KEY, node.scalar);
        }
        if (node.fields != null) {
            map.putAll(node.fields);
        }
        for (Map.Entry<String, Node> child : node.children.entrySet()) {
            Node childNode = child.getValue();
            if (childNode.children.isEmpty()) {
                map.put(child.getKey(), childNode.scalar != null ? childNode.scalar : childNode.fields);
            } else {
                map.put(child.getKey(), toMap(childNode));
            }
        }
        return map;
    }

    private static final class Node {
        private final Map<String, Node> children = new TreeMap<>();
        private Object scalar;
        private Map<String, Object> fields;

        private void setScalar(Object value) {
            scalar = value;
            fields = null;
        }

        private void setFields(Map<String, Object> value) {
            scalar = null;
            fields = value;
        }

        private Node child(String key) {
            return children.computeIfAbsent(key, k -> new Node());
        }
    }
}
