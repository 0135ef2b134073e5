// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * One measurement yielded by a {@link MetricProducer}.
 *
 * @param name        sub-name appended to the proxy name prefix
 * @param labels      labels of the measurement, may be empty
 * @param measurement the value
 */
public record ProxyMeasurement(@NonNull String name, @NonNull Labels labels, @NonNull Measurement measurement) {

    public ProxyMeasurement {
        MetricUtils.throwArgBlank(name, "name");
        Objects.requireNonNull(labels, "labels must not be null");
        Objects.requireNonNull(measurement, "measurement must not be null");
    }

    /**
     * @return measurement without labels
     */
    @NonNull
    public static ProxyMeasurement of(@NonNull String name, @NonNull Measurement measurement) {
        return new ProxyMeasurement(name, Labels.empty(), measurement);
    }
}
