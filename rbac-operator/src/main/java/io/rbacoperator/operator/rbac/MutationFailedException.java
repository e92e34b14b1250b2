/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.rbac;

/**
 * Thrown when creating, updating or deleting one of the objects generated for an RbacRule failed. The
 * reconciliation is then retried after a short fixed delay instead of the exponential back-off.
 */
class MutationFailedException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    MutationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
