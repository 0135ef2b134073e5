// SPDX-License-Identifier: Apache-2.0
package org.hiero.metrics.runtime.core;

/**
 * Thrown when receiver options are invalid. Construction fails, options are never silently defaulted.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    /**
     * @param message the detail message
     */
    public InvalidConfigurationException(String message) {
        super(message);
    }

    /**
     * @param message the detail message
     * @param cause   the cause, usually a parsing failure
     */
    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
