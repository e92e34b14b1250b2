/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.rbac.model;

/**
 * Thrown when a namespace selection cannot be evaluated because the selector is malformed
 */
public class SelectorException extends Exception {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor
     *
     * @param message   Description of the problem
     */
    public SelectorException(String message) {
        super(message);
    }
}
