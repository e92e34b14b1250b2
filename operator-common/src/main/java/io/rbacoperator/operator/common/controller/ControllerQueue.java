/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.common.controller;

import io.rbacoperator.operator.common.BackOff;
import io.rbacoperator.operator.common.metrics.ControllerMetricsHolder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Controller queue wraps a blocking queue and exposes the methods used by controllers: taking events from the queue,
 * enqueueing events right away and enqueueing them after a delay. Each resource has at most one pending delayed
 * event. Scheduling a new one replaces the previous one.
 */
public class ControllerQueue {
    private final static Logger LOGGER = LogManager.getLogger(ControllerQueue.class);

    /*test*/ final BlockingQueue<SimplifiedReconciliation> queue;
    /*test*/ final Map<String, DelayedReconciliation> delayed = new ConcurrentHashMap<>();
    private final Map<String, BackOff> backOffs = new ConcurrentHashMap<>();

    private final long maxBackOffMs;
    private final ScheduledExecutorService scheduledExecutor;
    private final ControllerMetricsHolder metrics;

    /**
     * Creates the controller queue
     *
     * @param queueSize             The capacity of the work queue
     * @param maxBackOffMs          The longest delay used when retrying failed reconciliations
     * @param scheduledExecutor     Executor used to enqueue the delayed reconciliations
     * @param metrics               Holder for the controller metrics
     *
     * @throws IllegalArgumentException when the maximal back-off is shorter than the first back-off delay
     */
    public ControllerQueue(int queueSize, long maxBackOffMs, ScheduledExecutorService scheduledExecutor, ControllerMetricsHolder metrics) {
        if (maxBackOffMs < BackOff.DEFAULT_SCALE_MS) {
            throw new IllegalArgumentException("The maximal back-off has to be at least " + BackOff.DEFAULT_SCALE_MS + " ms");
        }

        this.queue = new ArrayBlockingQueue<>(queueSize);
        this.maxBackOffMs = maxBackOffMs;
        this.scheduledExecutor = scheduledExecutor;
        this.metrics = metrics;
    }

    /**
     * @return  Takes the next item from the queue. Blocks if the queue is empty.
     *
     * @throws InterruptedException when interrupted while waiting for the next resource from the queue
     */
    public SimplifiedReconciliation take() throws InterruptedException {
        return queue.take();
    }

    /**
     * Enqueues the next reconciliation. It checks whether another reconciliation for the same resource is already in
     * the queue and enqueues the new event only if it is not there yet.
     *
     * @param reconciliation    Reconciliation identifier
     */
    public void enqueue(SimplifiedReconciliation reconciliation)    {
        if (!queue.contains(reconciliation)) {
            LOGGER.debug("Enqueueing {}", reconciliation);
            if (!queue.offer(reconciliation))    {
                LOGGER.warn("Failed to enqueue {} because the controller queue is full", reconciliation);
            }
        } else {
            metrics.alreadyEnqueuedReconciliationsCounter().increment();
            LOGGER.debug("{} is already enqueued => ignoring", reconciliation);
        }
    }

    /**
     * Enqueues the reconciliation after a delay. A delayed reconciliation which is already pending for the same
     * resource is replaced.
     *
     * @param reconciliation    Reconciliation identifier
     * @param delay             Delay after which the reconciliation should be enqueued
     */
    public void enqueueAfter(SimplifiedReconciliation reconciliation, Duration delay) {
        DelayedReconciliation next = new DelayedReconciliation(reconciliation);
        DelayedReconciliation previous = delayed.put(reconciliation.lockName(), next);

        if (previous != null)   {
            LOGGER.debug("Replacing the pending delayed reconciliation of {}", reconciliation);
            previous.cancel();
        }

        LOGGER.debug("Enqueueing {} in {} ms", reconciliation, delay.toMillis());
        next.schedule(delay.toMillis());
    }

    /**
     * Enqueues the reconciliation after a delay given by the exponential back-off of the resource. Each call for the
     * same resource doubles the delay until {@link #resetBackOff(SimplifiedReconciliation)} is called.
     *
     * @param reconciliation    Reconciliation identifier
     *
     * @return  The delay used
     */
    public Duration enqueueWithBackOff(SimplifiedReconciliation reconciliation) {
        BackOff backOff = backOffs.computeIfAbsent(reconciliation.lockName(), k -> new BackOff(maxBackOffMs));

        long delayMs;
        synchronized (backOff) {
            // The first delay of a back-off is always 0
            delayMs = backOff.delayMs();
            if (delayMs == 0) {
                delayMs = backOff.delayMs();
            }
        }

        Duration delay = Duration.ofMillis(delayMs);
        enqueueAfter(reconciliation, delay);
        return delay;
    }

    /**
     * Forgets the back-off state of the resource after it was reconciled successfully
     *
     * @param reconciliation    Reconciliation identifier
     */
    public void resetBackOff(SimplifiedReconciliation reconciliation) {
        backOffs.remove(reconciliation.lockName());
    }

    /**
     * Reconciliation enqueued after a delay. It enqueues the reconciliation only when it is still the latest delayed
     * reconciliation of the resource.
     */
    /*test*/ class DelayedReconciliation implements Runnable {
        private final SimplifiedReconciliation reconciliation;
        private volatile ScheduledFuture<?> future;

        DelayedReconciliation(SimplifiedReconciliation reconciliation) {
            this.reconciliation = reconciliation;
        }

        private void schedule(long delayMs) {
            future = scheduledExecutor.schedule(this, delayMs, TimeUnit.MILLISECONDS);
        }

        private void cancel() {
            ScheduledFuture<?> f = future;

            if (f != null) {
                f.cancel(false);
            }
        }

        @Override
        public void run() {
            if (delayed.remove(reconciliation.lockName(), this)) {
                enqueue(reconciliation);
            }
        }
    }
}
