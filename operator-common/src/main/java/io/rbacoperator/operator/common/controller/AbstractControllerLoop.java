/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.common.controller;

import io.micrometer.core.instrument.Timer;
import io.rbacoperator.operator.common.Reconciliation;
import io.rbacoperator.operator.common.ReconciliationLogger;
import io.rbacoperator.operator.common.metrics.ControllerMetricsHolder;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Abstract controller loop provides the shared functionality for reconciling resources. It takes an event from the
 * work queue, reconciles it under the lock of the resource and schedules the next reconciliation when the result
 * asks for it. Reconciliations which throw an exception are retried with an exponential back-off, except for
 * {@link IllegalStateException} which indicates a defect that a retry would not fix.
 */
public abstract class AbstractControllerLoop {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(AbstractControllerLoop.class);
    private static final long PROGRESS_WARNING_MS = 60_000L;

    private final String name;
    private final Thread controllerThread;
    private final ControllerQueue workQueue;
    private final ReconciliationLockManager lockManager;
    private final ScheduledExecutorService scheduledExecutor;

    private volatile boolean stop = false;
    private volatile boolean running = false;

    /**
     * Creates the controller loop
     *
     * @param name                  The name of this controller loop. It should identify the kind of resource it
     *                              reconciles and the number of the loop.
     * @param workQueue             Queue from which events should be consumed
     * @param lockManager           Lock manager for making sure no parallel reconciliations for a given resource can happen
     * @param scheduledExecutor     Scheduled executor service used to run the progress warnings
     */
    public AbstractControllerLoop(String name, ControllerQueue workQueue, ReconciliationLockManager lockManager, ScheduledExecutorService scheduledExecutor) {
        this.name = name;
        this.workQueue = workQueue;
        this.lockManager = lockManager;
        this.scheduledExecutor = scheduledExecutor;
        this.controllerThread = new Thread(new Runner(), name);
    }

    /**
     * The main reconciliation logic which handles the reconciliations.
     *
     * @param reconciliation    Reconciliation identifier used for logging
     *
     * @return  Result indicating whether the resource should be reconciled again later
     *
     * @throws Exception    when the reconciliation failed and should be retried with a back-off
     */
    protected abstract ReconcileResult reconcile(Reconciliation reconciliation) throws Exception;

    /**
     * @return Controller metrics holder instance
     */
    protected abstract ControllerMetricsHolder metrics();

    /**
     * Starts the controller: this method creates a new thread in which the controller will run
     */
    public void start() {
        LOGGER.debugOp("{}: Starting the controller loop", name);
        controllerThread.start();
    }

    /**
     * Stops the controller: this method sets the stop flag and interrupt the run loop
     *
     * @throws InterruptedException when interrupted while joining the thread
     */
    public void stop() throws InterruptedException {
        LOGGER.infoOp("{}: Requesting the controller loop to stop", name);
        this.stop = true;
        controllerThread.interrupt();
        controllerThread.join();
    }

    /**
     * @return  True when the controller is in the run loop, false otherwise
     */
    public boolean isRunning() {
        return running;
    }

    /**
     * @return  True when the controller loop thread is alive, false otherwise
     */
    public boolean isAlive() {
        return controllerThread.isAlive();
    }

    /**
     * Obtains the lock for the resource and reconciles it. If the lock is in use, the reconciliation is re-queued.
     *
     * @param reconciliation    Reconciliation marker
     */
    /*test*/ void reconcileWithLock(SimplifiedReconciliation reconciliation) {
        String lockName = reconciliation.lockName();
        boolean requeue = false;

        try {
            boolean locked = lockManager.tryLock(lockName, 1_000, TimeUnit.MILLISECONDS);

            if (locked) {
                try {
                    reconcileWrapper(reconciliation);
                } finally {
                    lockManager.unlock(lockName);
                }
            } else {
                LOGGER.warnOp("{}: Failed to acquire lock {}. The resource will be re-queued for later.", name, lockName);
                metrics().lockedReconciliationsCounter().increment();
                requeue = true;
            }
        } catch (InterruptedException e) {
            LOGGER.warnOp("{}: Interrupted while trying to acquire lock {}. The resource will be re-queued for later.", name, lockName);
            metrics().lockedReconciliationsCounter().increment();
            requeue = true;
        }

        if (requeue) {
            workQueue.enqueue(reconciliation);
        }
    }

    /**
     * Runs the reconciliation with the progress warnings and metrics and handles its outcome.
     *
     * @param simplified    Queued reconciliation
     */
    private void reconcileWrapper(SimplifiedReconciliation simplified) {
        Reconciliation reconciliation = simplified.toReconciliation();

        ScheduledFuture<?> progressWarning = scheduledExecutor
                .scheduleAtFixedRate(() -> LOGGER.infoCr(reconciliation, "Reconciliation is in progress"), PROGRESS_WARNING_MS, PROGRESS_WARNING_MS, TimeUnit.MILLISECONDS);
        metrics().reconciliationsCounter().increment();
        Timer.Sample reconciliationTimerSample = Timer.start(metrics().metricsProvider().meterRegistry());

        try {
            ReconcileResult result = reconcile(reconciliation);
            metrics().successfulReconciliationsCounter().increment();
            workQueue.resetBackOff(simplified);

            if (result != null && result.isRequeue()) {
                LOGGER.debugCr(reconciliation, "Reconciliation will be repeated in {} ms", result.requeueAfter().toMillis());
                metrics().requeuedReconciliationsCounter().increment();
                workQueue.enqueueAfter(simplified.withTrigger("requeue"), result.requeueAfter());
            }
        } catch (IllegalStateException e) {
            LOGGER.errorCr(reconciliation, "Reconciliation failed and will not be retried", e);
            metrics().failedReconciliationsCounter().increment();
        } catch (Exception e) {
            metrics().failedReconciliationsCounter().increment();
            Duration delay = workQueue.enqueueWithBackOff(simplified.withTrigger("retry"));
            LOGGER.errorCr(reconciliation, "Reconciliation failed and will be retried in {} ms", delay.toMillis(), e);
        } finally {
            reconciliationTimerSample.stop(metrics().reconciliationsTimer());
            progressWarning.cancel(true);
        }
    }

    /**
     * Runner class which is used to run the controller loop
     */
    private class Runner implements Runnable {
        @Override
        public void run() {
            LOGGER.debugOp("{}: Starting", name);
            running = true;

            while (!stop) {
                try {
                    LOGGER.debugOp("{}: Waiting for next event from work queue", name);
                    SimplifiedReconciliation reconciliation = workQueue.take();
                    reconcileWithLock(reconciliation);
                } catch (InterruptedException e) {
                    LOGGER.debugOp("{}: was interrupted", name, e);
                } catch (Exception e) {
                    LOGGER.warnOp("{}: reconciliation failed", name, e);
                }
            }

            LOGGER.infoOp("{}: Stopping", name);
            running = false;
        }
    }
}
