// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Immutable ordered path of scope segments, rendered by joining segments with {@value MetricUtils#SCOPE_DELIMITER}.
 * Appending segments always produces a new instance. A dotted segment is split, so {@code append("a.b")} equals
 * {@code append("a", "b")}.
 */
public final class Scope implements Comparable<Scope> {

    private static final Scope ROOT = new Scope(List.of());

    private final List<String> segments;
    private final String rendered;
    private final int hashCode;

    private Scope(List<String> segments) {
        this.segments = segments;
        this.rendered = String.join(MetricUtils.SCOPE_DELIMITER, segments);
        this.hashCode = segments.hashCode();
    }

    /**
     * @return scope without any segments
     */
    @NonNull
    public static Scope root() {
        return ROOT;
    }

    /**
     * @param segments scope segments, each must not be blank
     * @return scope with the given segments
     */
    @NonNull
    public static Scope of(@NonNull String... segments) {
        return ROOT.append(segments);
    }

    /**
     * Create a new scope with the given segments appended to this scope.
     *
     * @param additional segments to append, each must not be blank
     * @return new scope, or {@code this} if nothing is appended
     * @throws NullPointerException if any segment is {@code null}
     * @throws IllegalArgumentException if any segment or any dotted part of it is blank
     */
    @NonNull
    public Scope append(@NonNull String... additional) {
        Objects.requireNonNull(additional, "segments must not be null");
        return append(Arrays.asList(additional));
    }

    /**
     * Create a new scope with the given segments appended to this scope.
     *
     * @param additional segments to append, each must not be blank
     * @return new scope, or {@code this} if nothing is appended
     */
    @NonNull
    public Scope append(@NonNull Collection<String> additional) {
        Objects.requireNonNull(additional, "segments must not be null");
        if (additional.isEmpty()) {
            return this;
        }
        List<String> combined = new ArrayList<>(segments.size() + additional.size());
        combined.addAll(segments);
        for (String segment : additional) {
            combined.addAll(MetricUtils.splitPath(segment, "scope segment"));
        }
        return new Scope(List.copyOf(combined));
    }

    @NonNull
    public List<String> segments() {
        return segments;
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    /**
     * Render the fully qualified name of a metric within this scope.
     *
     * @param name metric name
     * @return {@code scope.name}, or just {@code name} for the root scope
     */
    @NonNull
    public String qualify(@NonNull String name) {
        return isRoot() ? name : rendered + MetricUtils.SCOPE_DELIMITER + name;
    }

    @Override
    public int compareTo(Scope other) {
        int common = Math.min(segments.size(), other.segments.size());
        for (int i = 0; i < common; i++) {
            int cmp = segments.get(i).compareTo(other.segments.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(segments.size(), other.segments.size());
    }

    @Override
    public boolean equals(Object other) {
        return this == other || (other instanceof Scope that && segments.equals(that.segments));
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return rendered;
    }
}
