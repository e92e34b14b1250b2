/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.common.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.rbacoperator.operator.common.MetricsProvider;
import io.rbacoperator.operator.common.model.Labels;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * A metrics holder for controllers. The metrics are tagged with the kind of the controlled resources and the
 * selector used to select them. They are created lazily when used for the first time.
 */
public class ControllerMetricsHolder {
    /**
     * Prefix used for metrics provided by the operator
     */
    public static final String METRICS_PREFIX = "rbac_operator.";
    /**
     * Metric name for number of reconciliations.
     */
    public static final String METRICS_RECONCILIATIONS = METRICS_PREFIX + "reconciliations";
    /**
     * Metric name for number of periodic reconciliations.
     */
    public static final String METRICS_RECONCILIATIONS_PERIODICAL = METRICS_RECONCILIATIONS + ".periodical";
    /**
     * Metric name for number of failed reconciliations.
     */
    public static final String METRICS_RECONCILIATIONS_FAILED = METRICS_RECONCILIATIONS + ".failed";
    /**
     * Metric name for number of successful reconciliations.
     */
    public static final String METRICS_RECONCILIATIONS_SUCCESSFUL = METRICS_RECONCILIATIONS + ".successful";
    /**
     * Metric name for number of reconciliations which asked to be retried later.
     */
    public static final String METRICS_RECONCILIATIONS_REQUEUED = METRICS_RECONCILIATIONS + ".requeued";
    /**
     * Metric name for duration of reconciliations.
     */
    public static final String METRICS_RECONCILIATIONS_DURATION = METRICS_RECONCILIATIONS + ".duration";
    /**
     * Metric name for number of locked reconciliations.
     */
    public static final String METRICS_RECONCILIATIONS_LOCKED = METRICS_RECONCILIATIONS + ".locked";
    /**
     * Metric name for reconciliations which are already queued when we try to enqueue them again.
     */
    public static final String METRICS_RECONCILIATIONS_ALREADY_ENQUEUED = METRICS_RECONCILIATIONS + ".already.enqueued";
    /**
     * Metric name for number of resources managed by the operator.
     */
    public static final String METRICS_RESOURCES = METRICS_PREFIX + "resources";

    private final MetricsProvider metricsProvider;
    private final Tags tags;

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> gauges = new ConcurrentHashMap<>();

    /**
     * Constructs the controller metrics holder
     *
     * @param kind              Kind of the resources for which these metrics apply
     * @param selectorLabels    Selector labels to select the controller resources
     * @param metricsProvider   Metrics provider
     */
    public ControllerMetricsHolder(String kind, Labels selectorLabels, MetricsProvider metricsProvider) {
        this.metricsProvider = metricsProvider;
        this.tags = Tags.of("kind", kind, "selector", selectorLabels != null ? selectorLabels.toSelectorString() : "");
    }

    /**
     * @return  Metrics provider used for the metrics by this holder class
     */
    public MetricsProvider metricsProvider()    {
        return metricsProvider;
    }

    /**
     * Counter metric for number of periodic reconciliations. It is incremented once per timer-trigger and not for
     * every resource found by the periodical reconciliation.
     *
     * @return  Metrics counter
     */
    public Counter periodicReconciliationsCounter() {
        return counter(METRICS_RECONCILIATIONS_PERIODICAL, "Number of periodical reconciliations done by the operator");
    }

    /**
     * @return  Counter of reconciliations of individual resources
     */
    public Counter reconciliationsCounter() {
        return counter(METRICS_RECONCILIATIONS, "Number of reconciliations done by the operator for individual resources");
    }

    /**
     * @return  Counter of failed reconciliations
     */
    public Counter failedReconciliationsCounter() {
        return counter(METRICS_RECONCILIATIONS_FAILED, "Number of reconciliations done by the operator for individual resources which failed");
    }

    /**
     * @return  Counter of successful reconciliations
     */
    public Counter successfulReconciliationsCounter() {
        return counter(METRICS_RECONCILIATIONS_SUCCESSFUL, "Number of reconciliations done by the operator for individual resources which were successful");
    }

    /**
     * @return  Counter of reconciliations which asked to be run again after a delay
     */
    public Counter requeuedReconciliationsCounter() {
        return counter(METRICS_RECONCILIATIONS_REQUEUED, "Number of reconciliations which were scheduled to be run again after a delay");
    }

    /**
     * Counter metric for number of reconciliations which did not happen because they did not get the lock (which means
     * that other reconciliation for the same resource was in progress).
     *
     * @return  Metrics counter
     */
    public Counter lockedReconciliationsCounter() {
        return counter(METRICS_RECONCILIATIONS_LOCKED, "Number of reconciliations skipped because another reconciliation for the same resource was still running");
    }

    /**
     * Counter metric for number of reconciliations which are already queued when we try to enqueue them again. This
     * might indicate for example that the periodic reconciliations are triggering too often.
     *
     * @return  Metrics counter
     */
    public Counter alreadyEnqueuedReconciliationsCounter() {
        return counter(METRICS_RECONCILIATIONS_ALREADY_ENQUEUED, "Number of reconciliations skipped because the same resource was already waiting in the queue");
    }

    /**
     * @return  Timer which measures how long do the reconciliations take
     */
    public Timer reconciliationsTimer() {
        return timers.computeIfAbsent(METRICS_RECONCILIATIONS_DURATION,
                name -> metricsProvider.timer(name, "The time the reconciliation takes to complete", tags));
    }

    /**
     * @return  Gauge with the number of custom resources seen by the operator
     */
    public AtomicInteger resourceCounter() {
        return gauges.computeIfAbsent(METRICS_RESOURCES,
                name -> metricsProvider.gauge(name, "Number of custom resources the operator sees", tags));
    }

    private Counter counter(String name, String description) {
        return metric(counters, name, metricName -> metricsProvider.counter(metricName, description, tags));
    }

    private static <M> M metric(Map<String, M> metrics, String name, Function<String, M> fn) {
        return metrics.computeIfAbsent(name, fn);
    }
}
