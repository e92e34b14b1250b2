/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.common.controller;

import java.time.Duration;

/**
 * Outcome of a successful reconciliation. The reconciliation is either done, or it asks to be run again after a
 * delay (for example when it waits for a point in time or when it should retry a failed operation).
 *
 * @param requeueAfter  Delay after which the resource should be reconciled again or null when it is done
 */
public record ReconcileResult(Duration requeueAfter) {
    private static final ReconcileResult DONE = new ReconcileResult(null);

    /**
     * @return  Result of a reconciliation which does not need to be repeated
     */
    public static ReconcileResult done() {
        return DONE;
    }

    /**
     * @param delay     Delay after which the reconciliation should run again
     *
     * @return  Result of a reconciliation which should be repeated. Negative delays are treated as zero.
     */
    public static ReconcileResult requeueAfter(Duration delay) {
        return new ReconcileResult(delay.isNegative() ? Duration.ZERO : delay);
    }

    /**
     * @return  True if the resource should be reconciled again
     */
    public boolean isRequeue() {
        return requeueAfter != null;
    }
}
