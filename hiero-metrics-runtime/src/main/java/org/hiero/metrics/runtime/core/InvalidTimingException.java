// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.core;

/**
 * Thrown when a timing is recorded with an end timestamp earlier than its start timestamp,
 * or with a span too long to be expressed as a {@code long} of nanoseconds.
 * Nothing is recorded in that case.
 */
public class InvalidTimingException extends IllegalArgumentException {

    /**
     * @param start the start timestamp in nanoseconds
     * @param end   the end timestamp in nanoseconds
     */
    public InvalidTimingException(long start, long end) {
        this("Timing end must not be earlier than start, but was: start=" + start + ", end=" + end);
    }

    /**
     * @param message the detail message
     */
    public InvalidTimingException(String message) {
        super(message);
    }

    /**
     * @param message the detail message
     * @param cause   the cause
     */
    public InvalidTimingException(String message, Throwable cause) {
        super(message, cause);
    }
}
