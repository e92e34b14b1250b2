/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.common.model;

/**
 * Exception thrown when the custom resource is invalid
 */
public class InvalidResourceException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor
     *
     * @param message Message describing the issue
     */
    public InvalidResourceException(String message) {
        super(message);
    }

    /**
     * Constructor
     *
     * @param message   Message describing the issue
     * @param cause     Cause of the issue
     */
    public InvalidResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
