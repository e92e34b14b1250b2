/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.rbac;

import io.rbacoperator.operator.common.Reconciliation;
import io.rbacoperator.operator.common.ReconciliationLogger;
import io.rbacoperator.operator.common.controller.AbstractControllerLoop;
import io.rbacoperator.operator.common.controller.ControllerQueue;
import io.rbacoperator.operator.common.controller.ReconcileResult;
import io.rbacoperator.operator.common.controller.ReconciliationLockManager;
import io.rbacoperator.operator.common.metrics.ControllerMetricsHolder;

import java.util.concurrent.ScheduledExecutorService;

/**
 * RbacRule controller loop takes the RbacRules from the work queue and reconciles them.
 */
public class RbacRuleControllerLoop extends AbstractControllerLoop {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(RbacRuleControllerLoop.class);

    private final RbacRuleReconciler reconciler;
    private final ControllerMetricsHolder metrics;

    /**
     * Constructor of the RbacRule controller loop
     *
     * @param name                  Name of the controller loop. It should identify the resource it reconciles and the
     *                              number of the loop.
     * @param workQueue             ControllerQueue from which the reconciliation events should be taken
     * @param lockManager           LockManager which is used to avoid the same resource being reconciled in multiple
     *                              loops in parallel
     * @param scheduledExecutor     Scheduled executor service used to run the progress warnings
     * @param reconciler            The reconciler of the RbacRules
     * @param metrics               The metrics holder for providing metrics about the reconciliation
     */
    public RbacRuleControllerLoop(
            String name,
            ControllerQueue workQueue,
            ReconciliationLockManager lockManager,
            ScheduledExecutorService scheduledExecutor,
            RbacRuleReconciler reconciler,
            ControllerMetricsHolder metrics
    ) {
        super(name, workQueue, lockManager, scheduledExecutor);

        this.reconciler = reconciler;
        this.metrics = metrics;
    }

    @Override
    protected ReconcileResult reconcile(Reconciliation reconciliation) {
        LOGGER.infoCr(reconciliation, "{} will be reconciled", reconciliation.kind());
        return reconciler.reconcile(reconciliation);
    }

    @Override
    protected ControllerMetricsHolder metrics() {
        return metrics;
    }
}
