/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.operator.common;

/**
 * Thrown when the agent configuration is invalid
 */
public class InvalidConfigurationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor
     *
     * @param message   Error message
     */
    public InvalidConfigurationException(String message) {
        super(message);
    }

    /**
     * Constructor
     *
     * @param message   Error message
     * @param cause     Cause of the error
     */
    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
