// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.core;

/**
 * Thrown at the call site when label input is malformed, e.g. a key without a value or a blank key.
 */
public class InvalidLabelsException extends IllegalArgumentException {

    /**
     * @param message the detail message
     */
    public InvalidLabelsException(String message) {
        super(message);
    }
}
