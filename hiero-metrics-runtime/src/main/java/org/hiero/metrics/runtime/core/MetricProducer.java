// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;

/**
 * Producer of ad-hoc measurements computed lazily at snapshot time.
 * A producer is invoked exactly once per snapshot and holds no storage cell in the registry.
 */
@FunctionalInterface
public interface MetricProducer {

    /**
     * @return measurements to include in the snapshot, may be empty
     */
    @NonNull
    List<ProxyMeasurement> produce();
}
