// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Concurrently mutable storage behind one metric identity.
 * All operations of implementations are thread-safe and require no caller-side locking.
 */
public interface MetricCell {

    /**
     * @return kind of this cell, never changes after creation
     */
    @NonNull
    MetricKind kind();

    /**
     * Read the current value of this cell without modifying it.
     *
     * @return the current measurement
     */
    @NonNull
    Measurement measure();
}
