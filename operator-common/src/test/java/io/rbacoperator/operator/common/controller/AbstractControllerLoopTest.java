/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.common.controller;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.rbacoperator.operator.common.MicrometerMetricsProvider;
import io.rbacoperator.operator.common.Reconciliation;
import io.rbacoperator.operator.common.metrics.ControllerMetricsHolder;
import io.rbacoperator.operator.common.model.Labels;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

public class AbstractControllerLoopTest {
    private static final SimplifiedReconciliation RULE = new SimplifiedReconciliation("RbacRule", null, "my-rule");

    private MeterRegistry metricsRegistry;
    private ControllerMetricsHolder metrics;
    private ScheduledExecutorService executor;
    private ControllerQueue queue;
    private ReconciliationLockManager lockManager;

    @BeforeEach
    public void setup() {
        metricsRegistry = new SimpleMeterRegistry();
        metrics = new ControllerMetricsHolder("RbacRule", Labels.EMPTY, new MicrometerMetricsProvider(metricsRegistry));
        executor = Executors.newSingleThreadScheduledExecutor();
        queue = new ControllerQueue(10, 60_000L, executor, metrics);
        lockManager = new ReconciliationLockManager();
    }

    @AfterEach
    public void teardown() {
        executor.shutdownNow();
    }

    @Test
    public void testSuccessfulReconciliation() {
        TestLoop loop = new TestLoop(r -> ReconcileResult.done());

        loop.reconcileWithLock(RULE);

        assertThat(loop.reconciled.size(), is(1));
        assertThat(loop.reconciled.get(0).name(), is("my-rule"));
        assertThat(counter(ControllerMetricsHolder.METRICS_RECONCILIATIONS), is(1.0));
        assertThat(counter(ControllerMetricsHolder.METRICS_RECONCILIATIONS_SUCCESSFUL), is(1.0));
        assertThat(queue.delayed.isEmpty(), is(true));
        assertThat(queue.queue.isEmpty(), is(true));
        assertThat(lockManager.locks.isEmpty(), is(true));
    }

    @Test
    public void testRequeuedReconciliation() throws InterruptedException {
        TestLoop loop = new TestLoop(r -> ReconcileResult.requeueAfter(Duration.ofMillis(50)));

        loop.reconcileWithLock(RULE);

        assertThat(counter(ControllerMetricsHolder.METRICS_RECONCILIATIONS_SUCCESSFUL), is(1.0));
        assertThat(counter(ControllerMetricsHolder.METRICS_RECONCILIATIONS_REQUEUED), is(1.0));

        SimplifiedReconciliation requeued = queue.queue.poll(5, TimeUnit.SECONDS);
        assertThat(requeued, is(RULE));
        assertThat(requeued.trigger(), is("requeue"));
    }

    @Test
    public void testFailedReconciliationIsRetried() throws InterruptedException {
        TestLoop loop = new TestLoop(r -> {
            throw new RuntimeException("Kubernetes API is not available");
        });

        loop.reconcileWithLock(RULE);

        assertThat(counter(ControllerMetricsHolder.METRICS_RECONCILIATIONS_FAILED), is(1.0));
        assertThat(queue.delayed.get(RULE.lockName()), is(notNullValue()));

        SimplifiedReconciliation retried = queue.queue.poll(5, TimeUnit.SECONDS);
        assertThat(retried, is(RULE));
        assertThat(retried.trigger(), is("retry"));
    }

    @Test
    public void testIllegalStateIsNotRetried() throws InterruptedException {
        TestLoop loop = new TestLoop(r -> {
            throw new IllegalStateException("Broken invariant");
        });

        loop.reconcileWithLock(RULE);

        assertThat(counter(ControllerMetricsHolder.METRICS_RECONCILIATIONS_FAILED), is(1.0));
        assertThat(queue.delayed.isEmpty(), is(true));
        assertThat(queue.queue.poll(300, TimeUnit.MILLISECONDS), is(nullValue()));
    }

    @Test
    public void testLockedReconciliationIsRequeued() throws Exception {
        TestLoop loop = new TestLoop(r -> ReconcileResult.done());
        ExecutorService other = Executors.newSingleThreadExecutor();

        try {
            // The lock has to be held by another thread because the locks are reentrant
            assertThat(other.submit(() -> lockManager.tryLock(RULE.lockName(), 10, TimeUnit.MILLISECONDS)).get(), is(true));

            loop.reconcileWithLock(RULE);

            assertThat(loop.reconciled.isEmpty(), is(true));
            assertThat(counter(ControllerMetricsHolder.METRICS_RECONCILIATIONS_LOCKED), is(1.0));
            assertThat(queue.queue.contains(RULE), is(true));

            other.submit(() -> lockManager.unlock(RULE.lockName())).get();
        } finally {
            other.shutdownNow();
        }
    }

    @Test
    public void testLoopConsumesQueue() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(2);
        TestLoop loop = new TestLoop(r -> {
            latch.countDown();
            return ReconcileResult.done();
        });

        loop.start();

        try {
            queue.enqueue(RULE);
            queue.enqueue(new SimplifiedReconciliation("RbacRule", null, "my-other-rule"));

            assertThat(latch.await(5, TimeUnit.SECONDS), is(true));
            assertThat(loop.isAlive(), is(true));
        } finally {
            loop.stop();
        }

        assertThat(loop.isAlive(), is(false));
        assertThat(loop.isRunning(), is(false));
    }

    private double counter(String name) {
        return metricsRegistry.get(name).tag("kind", "RbacRule").counter().count();
    }

    interface TestReconciler {
        ReconcileResult reconcile(Reconciliation reconciliation) throws Exception;
    }

    class TestLoop extends AbstractControllerLoop {
        final List<Reconciliation> reconciled = new CopyOnWriteArrayList<>();
        private final TestReconciler reconciler;

        TestLoop(TestReconciler reconciler) {
            super("test-loop", queue, lockManager, executor);
            this.reconciler = reconciler;
        }

        @Override
        protected ReconcileResult reconcile(Reconciliation reconciliation) throws Exception {
            reconciled.add(reconciliation);
            return reconciler.reconcile(reconciliation);
        }

        @Override
        protected ControllerMetricsHolder metrics() {
            return metrics;
        }
    }
}
