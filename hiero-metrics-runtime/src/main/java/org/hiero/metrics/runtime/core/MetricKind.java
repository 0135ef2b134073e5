// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.core;

/**
 * Kind of the storage cell bound to a metric identity.
 */
public enum MetricKind {
    /** Monotonically increasing unsigned 64-bit value. */
    COUNTER,
    /** Signed 64-bit last known value. */
    GAUGE,
    /** Distribution of non-negative samples. */
    HISTOGRAM
}
