// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.hiero.metrics.runtime.core.HistogramSummary;
import org.hiero.metrics.runtime.core.MetricIdentity;

/**
 * Callback interface for consumers of a {@link Snapshot}, e.g. renderers of text formats.
 * Entries are visited in snapshot order.
 */
public interface SnapshotObserver {

    /**
     * @param identity metric identity
     * @param value    counter bits, to be interpreted as unsigned
     */
    void observeCounter(@NonNull MetricIdentity identity, long value);

    void observeGauge(@NonNull MetricIdentity identity, long value);

    void observeHistogram(@NonNull MetricIdentity identity, @NonNull HistogramSummary summary);
}
