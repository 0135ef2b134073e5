// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a metric identity already bound to one {@link MetricKind} is requested as another.
 * The existing cell is left untouched.
 */
public class KindMismatchException extends IllegalStateException {

    private final MetricIdentity identity;
    private final MetricKind existingKind;
    private final MetricKind requestedKind;

    /**
     * @param identity      the identity requested
     * @param existingKind  the kind the identity is bound to
     * @param requestedKind the kind requested by the caller
     */
    public KindMismatchException(
            @NonNull MetricIdentity identity, @NonNull MetricKind existingKind, @NonNull MetricKind requestedKind) {
        super("Metric " + identity + " is already registered as " + existingKind + ", requested as " + requestedKind);
        this.identity = identity;
        this.existingKind = existingKind;
        this.requestedKind = requestedKind;
    }

    @NonNull
    public MetricIdentity getIdentity() {
        return identity;
    }

    @NonNull
    public MetricKind getExistingKind() {
        return existingKind;
    }

    @NonNull
    public MetricKind getRequestedKind() {
        return requestedKind;
    }
}
