// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * Identity of a metric together with its value at snapshot time.
 *
 * @param identity    the metric identity
 * @param measurement the value
 */
public record SnapshotEntry(@NonNull MetricIdentity identity, @NonNull Measurement measurement) {

    public SnapshotEntry {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(measurement, "measurement must not be null");
    }

    @Override
    public String toString() {
        return identity + " " + measurement.kind() + " " + measurement;
    }
}
