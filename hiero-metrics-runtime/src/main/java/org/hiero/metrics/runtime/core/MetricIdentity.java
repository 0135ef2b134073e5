// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Canonical key of a metric: name, scope and labels.
 * Two identities are equal iff all three components are equal; label order never matters
 * since {@link Labels} are canonical.
 * <p>
 * A dotted name is split on construction and all but its last part are appended to the scope, so two identities
 * are equal iff their qualified names and labels are equal: {@code ("b.widgets", [a])} becomes
 * {@code ("widgets", [a, b])}.
 *
 * @param name   metric name, must not be blank, dotted parts must not be blank either
 * @param scope  scope of the metric
 * @param labels labels of the metric
 */
public record MetricIdentity(@NonNull String name, @NonNull Scope scope, @NonNull Labels labels)
        implements Comparable<MetricIdentity> {

    private static final Comparator<MetricIdentity> ORDER = Comparator.comparing(MetricIdentity::scope)
            .thenComparing(MetricIdentity::name)
            .thenComparing(MetricIdentity::labels);

    public MetricIdentity {
        List<String> parts = MetricUtils.splitPath(name, "name");
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(labels, "labels must not be null");
        if (parts.size() > 1) {
            scope = scope.append(parts.subList(0, parts.size() - 1));
            name = parts.get(parts.size() - 1);
        }
    }

    /**
     * @param name metric name
     * @return identity in root scope without labels
     */
    @NonNull
    public static MetricIdentity of(@NonNull String name) {
        return new MetricIdentity(name, Scope.root(), Labels.empty());
    }

    /**
     * @param name          metric name
     * @param scope         metric scope
     * @param keysAndValues label keys and values as flat pairs
     * @return canonical identity
     */
    @NonNull
    public static MetricIdentity of(@NonNull String name, @NonNull Scope scope, @NonNull String... keysAndValues) {
        return new MetricIdentity(name, scope, Labels.of(keysAndValues));
    }

    /**
     * @return fully qualified name, i.e. scope segments and name joined with {@value MetricUtils#SCOPE_DELIMITER}
     */
    @NonNull
    public String qualifiedName() {
        return scope.qualify(name);
    }

    @Override
    public int compareTo(MetricIdentity other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return labels.isEmpty() ? qualifiedName() : qualifiedName() + labels;
    }
}
