// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * A label is an immutable key-value pair used to differentiate metrics with the same name and scope.
 */
public record Label(@NonNull String key, @NonNull String value) implements Comparable<Label> {

    /**
     * Constructs a new label with the specified key and value.
     *
     * @param key   the key of the label, must not be blank
     * @param value the value of the label, may be empty
     * @throws NullPointerException if key or value is {@code null}
     * @throws InvalidLabelsException if key is blank
     */
    public Label {
        Objects.requireNonNull(key, "label key must not be null");
        Objects.requireNonNull(value, "label value must not be null");
        if (key.isBlank()) {
            throw new InvalidLabelsException("label key must not be blank");
        }
    }

    @Override
    public String toString() {
        return key + "=" + value;
    }

    @Override
    public int compareTo(Label other) {
        int keyCompare = key.compareTo(other.key);
        return keyCompare != 0 ? keyCompare : value.compareTo(other.value);
    }
}
