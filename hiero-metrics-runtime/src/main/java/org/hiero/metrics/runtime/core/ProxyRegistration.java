// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Registered proxy: a producer together with the scope and name prefix its measurements are reported under.
 *
 * @param scope    scope the proxy was registered in
 * @param prefix   name prefix of produced measurements
 * @param producer the producer
 */
public record ProxyRegistration(@NonNull Scope scope, @NonNull String prefix, @NonNull MetricProducer producer) {

    public ProxyRegistration {
        Objects.requireNonNull(scope, "scope must not be null");
        MetricUtils.throwArgBlank(prefix, "prefix");
        Objects.requireNonNull(producer, "producer must not be null");
    }

    /**
     * Invoke the producer once and resolve its output to identities {@code scope.prefix.name}.
     *
     * @return resolved identities with their measurements, in production order
     * @throws RuntimeException whatever the producer throws
     */
    @NonNull
    public List<SnapshotEntry> invoke() {
        List<ProxyMeasurement> produced = Objects.requireNonNull(producer.produce(), "produced list must not be null");
        List<SnapshotEntry> resolved = new ArrayList<>(produced.size());
        for (ProxyMeasurement measurement : produced) {
            MetricIdentity identity = new MetricIdentity(
                    prefix + MetricUtils.SCOPE_DELIMITER + measurement.name(), scope, measurement.labels());
            resolved.add(new SnapshotEntry(identity, measurement.measurement()));
        }
        return resolved;
    }
}
