/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.common.controller;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.rbacoperator.operator.common.MetricsProvider;
import io.rbacoperator.operator.common.MicrometerMetricsProvider;
import io.rbacoperator.operator.common.metrics.ControllerMetricsHolder;
import io.rbacoperator.operator.common.model.Labels;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ControllerQueueTest {
    private MeterRegistry metricsRegistry;
    private ControllerMetricsHolder metrics;
    private ScheduledExecutorService executor;

    @BeforeEach
    public void setup() {
        metricsRegistry = new SimpleMeterRegistry();
        MetricsProvider metricsProvider = new MicrometerMetricsProvider(metricsRegistry);
        metrics = new ControllerMetricsHolder("RbacRule", Labels.EMPTY, metricsProvider);
        executor = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    public void teardown() {
        executor.shutdownNow();
    }

    @Test
    public void testEnqueueingEnqueued() {
        ControllerQueue q = new ControllerQueue(10, 60_000L, executor, metrics);

        SimplifiedReconciliation r1 = new SimplifiedReconciliation("RbacRule", null, "my-rule", "watch");
        SimplifiedReconciliation r2 = new SimplifiedReconciliation("RbacRule", null, "my-rule", "timer");
        SimplifiedReconciliation r3 = new SimplifiedReconciliation("RbacRule", null, "my-other-rule", "watch");

        q.enqueue(r1);
        q.enqueue(r3);
        q.enqueue(r2);

        assertThat(q.queue.size(), is(2));
        assertThat(q.queue.contains(r1), is(true));
        assertThat(q.queue.contains(r3), is(true));

        assertThat(metricsRegistry.get(ControllerMetricsHolder.METRICS_RECONCILIATIONS_ALREADY_ENQUEUED).tag("kind", "RbacRule").counter().count(), is(1.0));
    }

    @Test
    public void testFullQueue() {
        ControllerQueue q = new ControllerQueue(1, 60_000L, executor, metrics);

        q.enqueue(new SimplifiedReconciliation("RbacRule", null, "rule-1"));
        q.enqueue(new SimplifiedReconciliation("RbacRule", null, "rule-2"));

        assertThat(q.queue.size(), is(1));
        assertThat(q.queue.peek().name(), is("rule-1"));
    }

    @Test
    public void testEnqueueAfter() throws InterruptedException {
        ControllerQueue q = new ControllerQueue(10, 60_000L, executor, metrics);
        SimplifiedReconciliation r = new SimplifiedReconciliation("RbacRule", null, "my-rule");

        q.enqueueAfter(r.withTrigger("requeue"), Duration.ofMillis(50));

        SimplifiedReconciliation taken = q.queue.poll(5, TimeUnit.SECONDS);
        assertThat(taken, is(r));
        assertThat(taken.trigger(), is("requeue"));
        assertThat(q.delayed.isEmpty(), is(true));
    }

    @Test
    public void testEnqueueAfterReplacesPendingReconciliation() throws InterruptedException {
        ControllerQueue q = new ControllerQueue(10, 60_000L, executor, metrics);
        SimplifiedReconciliation r = new SimplifiedReconciliation("RbacRule", null, "my-rule");

        q.enqueueAfter(r.withTrigger("first"), Duration.ofHours(1));
        q.enqueueAfter(r.withTrigger("second"), Duration.ofMillis(50));

        assertThat(q.delayed.size(), is(1));

        SimplifiedReconciliation taken = q.queue.poll(5, TimeUnit.SECONDS);
        assertThat(taken.trigger(), is("second"));
        assertThat(q.queue.poll(200, TimeUnit.MILLISECONDS), is(nullValue()));
        assertThat(q.delayed.isEmpty(), is(true));
    }

    @Test
    public void testBackOffGrowsAndResets() {
        // The executor is not used to run anything within the test
        ControllerQueue q = new ControllerQueue(10, 1_000L, executor, metrics);
        SimplifiedReconciliation r = new SimplifiedReconciliation("RbacRule", null, "my-rule");

        assertThat(q.enqueueWithBackOff(r), is(Duration.ofMillis(200)));
        assertThat(q.enqueueWithBackOff(r), is(Duration.ofMillis(400)));
        assertThat(q.enqueueWithBackOff(r), is(Duration.ofMillis(800)));
        assertThat(q.enqueueWithBackOff(r), is(Duration.ofMillis(1_000)));
        assertThat(q.enqueueWithBackOff(r), is(Duration.ofMillis(1_000)));

        // Other resources have their own back-off
        assertThat(q.enqueueWithBackOff(new SimplifiedReconciliation("RbacRule", null, "my-other-rule")), is(Duration.ofMillis(200)));

        q.resetBackOff(r);
        assertThat(q.enqueueWithBackOff(r), is(Duration.ofMillis(200)));
    }

    @Test
    public void testMaxBackOffShorterThanFirstDelayIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ControllerQueue(10, 100L, executor, metrics));
    }
}
