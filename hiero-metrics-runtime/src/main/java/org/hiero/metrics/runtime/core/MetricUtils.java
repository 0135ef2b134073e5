// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Utility class for metrics-related argument checks and number formatting.
 */
public final class MetricUtils {

    /** Delimiter used to join scope segments and metric names. */
    public static final String SCOPE_DELIMITER = ".";

    private static final Pattern DELIMITER_PATTERN = Pattern.compile(Pattern.quote(SCOPE_DELIMITER));

    private MetricUtils() {}

    /**
     * Validates that provided argument is not null or blank.
     *
     * @param argument     the argument checked
     * @param argumentName the name of the argument
     * @throws NullPointerException of passed argument is {@code null}
     * @throws IllegalArgumentException of passed argument is blank using {@link String#isBlank()}
     */
    @NonNull
    public static String throwArgBlank(@NonNull final String argument, @NonNull final String argumentName)
            throws NullPointerException, IllegalArgumentException {
        Objects.requireNonNull(argument, argumentName + " must not be null");
        if (argument.isBlank()) {
            throw new IllegalArgumentException(argumentName + " must not be blank");
        }
        return argument;
    }

    /**
     * Splits a dotted path into its parts, validating that none of them is blank.
     *
     * @param path         the path, e.g. {@code a.b.widgets}
     * @param argumentName the name of the argument used in the exception message
     * @return parts of the path in order
     * @throws IllegalArgumentException if the path or any of its parts is blank
     */
    @NonNull
    public static List<String> splitPath(@NonNull final String path, @NonNull final String argumentName) {
        throwArgBlank(path, argumentName);
        if (!path.contains(SCOPE_DELIMITER)) {
            return List.of(path);
        }
        String[] parts = DELIMITER_PATTERN.split(path, -1);
        for (String part : parts) {
            throwArgBlank(part, argumentName);
        }
        return List.of(parts);
    }

    /**
     * Validates that provided value is non-negative.
     *
     * @param value     the value checked
     * @param valueName the name of the value used in the exception message
     * @return the value
     * @throws IllegalArgumentException if the value is negative
     */
    public static long throwArgNegative(long value, @NonNull String valueName) {
        if (value < 0L) {
            throw new IllegalArgumentException(valueName + " must be non-negative, but was: " + value);
        }
        return value;
    }

    /**
     * Converts a {@code long} interpreted as unsigned 64-bit integer to {@code double}.
     */
    public static double unsignedToDouble(long value) {
        if (value >= 0L) {
            return value;
        }
        // halve, keeping the lowest bit so rounding stays correct
        return ((value >>> 1) | (value & 1L)) * 2.0;
    }
}
