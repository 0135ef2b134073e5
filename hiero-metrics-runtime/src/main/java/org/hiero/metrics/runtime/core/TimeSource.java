// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.core;

/**
 * Monotonic high-resolution clock in nanoseconds. Values are only meaningful relative to each other.
 */
@FunctionalInterface
public interface TimeSource {

    /**
     * @return current timestamp in nanoseconds
     */
    long nanoTime();

    /**
     * @return time source backed by {@link System#nanoTime()}
     */
    static TimeSource system() {
        return System::nanoTime;
    }
}
