// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Canonical, immutable set of {@link Label}s.
 * <p>
 * Labels are sorted by key and each key appears at most once. When the same key is supplied more than once,
 * the last supplied value wins. Two instances built from the same pairs in any order are equal and have the
 * same hash code.
 */
public final class Labels implements Comparable<Labels> {

    private static final Labels EMPTY = new Labels(new Label[0]);

    private final Label[] labels;

    private int hashCode = 0;

    private Labels(Label[] sorted) {
        this.labels = sorted;
    }

    /**
     * @return empty label set
     */
    @NonNull
    public static Labels empty() {
        return EMPTY;
    }

    /**
     * Create labels from a flat list of key/value pairs: {@code key1, value1, key2, value2, ...}.
     *
     * @param keysAndValues the keys and values
     * @return canonical labels
     * @throws NullPointerException if the array or any of its elements is {@code null}
     * @throws InvalidLabelsException if a key is unpaired or blank
     */
    @NonNull
    public static Labels of(@NonNull String... keysAndValues) {
        Objects.requireNonNull(keysAndValues, "keysAndValues must not be null");
        if (keysAndValues.length == 0) {
            return EMPTY;
        }
        if (keysAndValues.length % 2 != 0) {
            throw new InvalidLabelsException("Labels must be provided as key/value pairs, but key '"
                    + keysAndValues[keysAndValues.length - 1] + "' has no value");
        }
        Map<String, String> canonical = new TreeMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            Label label = new Label(keysAndValues[i], keysAndValues[i + 1]);
            canonical.put(label.key(), label.value());
        }
        return fromSortedMap(canonical);
    }

    /**
     * Create labels from a collection of labels, applying last-wins for duplicate keys in iteration order.
     *
     * @param labels the labels
     * @return canonical labels
     */
    @NonNull
    public static Labels of(@NonNull Collection<Label> labels) {
        Objects.requireNonNull(labels, "labels must not be null");
        if (labels.isEmpty()) {
            return EMPTY;
        }
        Map<String, String> canonical = new TreeMap<>();
        for (Label label : labels) {
            Objects.requireNonNull(label, "label must not be null");
            canonical.put(label.key(), label.value());
        }
        return fromSortedMap(canonical);
    }

    private static Labels fromSortedMap(Map<String, String> canonical) {
        Label[] sorted = new Label[canonical.size()];
        int i = 0;
        for (Map.Entry<String, String> entry : canonical.entrySet()) {
            sorted[i++] = new Label(entry.getKey(), entry.getValue());
        }
        return new Labels(sorted);
    }

    /**
     * Merge these labels with the given ones. Values of {@code overrides} win for keys present in both.
     *
     * @param overrides labels to add
     * @return merged labels, {@code this} if overrides are empty
     */
    @NonNull
    public Labels merge(@NonNull Labels overrides) {
        Objects.requireNonNull(overrides, "overrides must not be null");
        if (overrides.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return overrides;
        }
        Map<String, String> canonical = new TreeMap<>();
        for (Label label : labels) {
            canonical.put(label.key(), label.value());
        }
        for (Label label : overrides.labels) {
            canonical.put(label.key(), label.value());
        }
        return fromSortedMap(canonical);
    }

    public int size() {
        return labels.length;
    }

    public boolean isEmpty() {
        return labels.length == 0;
    }

    /**
     * @param index label index in key order
     * @return the label at the given index
     */
    @NonNull
    public Label get(int index) {
        return labels[index];
    }

    /**
     * @return immutable list of labels sorted by key
     */
    @NonNull
    public List<Label> asList() {
        return List.of(labels);
    }

    @Override
    public int compareTo(Labels other) {
        int common = Math.min(labels.length, other.labels.length);
        for (int i = 0; i < common; i++) {
            int cmp = labels[i].compareTo(other.labels[i]);
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(labels.length, other.labels.length);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other instanceof Labels that) {
            if (labels.length != that.labels.length) {
                return false;
            }
            for (int i = 0; i < labels.length; i++) {
                if (!labels[i].equals(that.labels[i])) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    @Override
    public int hashCode() {
        if (hashCode == 0) {
            int result = 1;
            for (Label label : labels) {
                result = 31 * result + label.hashCode();
            }
            hashCode = result;
        }
        return hashCode;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(labels.length * 16);
        sb.append('{');
        for (int i = 0; i < labels.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(labels[i]);
        }
        return sb.append('}').toString();
    }
}
