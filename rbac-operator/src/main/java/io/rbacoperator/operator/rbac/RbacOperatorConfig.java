/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.rbac;

import io.rbacoperator.operator.common.BackOff;
import io.rbacoperator.operator.common.config.ConfigParameter;
import io.rbacoperator.operator.common.model.Labels;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static io.rbacoperator.operator.common.config.ConfigParameterParser.BOOLEAN;
import static io.rbacoperator.operator.common.config.ConfigParameterParser.INTEGER;
import static io.rbacoperator.operator.common.config.ConfigParameterParser.LABEL_PREDICATE;
import static io.rbacoperator.operator.common.config.ConfigParameterParser.LONG;
import static io.rbacoperator.operator.common.config.ConfigParameterParser.NAMESPACE_NAME;
import static io.rbacoperator.operator.common.config.ConfigParameterParser.atLeast;
import static io.rbacoperator.operator.common.config.ConfigParameterParser.strictlyPositive;

/**
 * RBAC Operator configuration
 */
public class RbacOperatorConfig {
    private static final Map<String, ConfigParameter<?>> CONFIG_VALUES = new HashMap<>();

    /**
     * How many milliseconds between the periodic reconciliations of all RbacRules
     */
    public static final ConfigParameter<Long> RECONCILIATION_INTERVAL_MS = new ConfigParameter<>("RBAC_OPERATOR_FULL_RECONCILIATION_INTERVAL_MS", strictlyPositive(LONG), "120000", CONFIG_VALUES);
    /**
     * Size of the controller work queue
     */
    public static final ConfigParameter<Integer> WORK_QUEUE_SIZE = new ConfigParameter<>("RBAC_OPERATOR_WORK_QUEUE_SIZE", strictlyPositive(INTEGER), "1024", CONFIG_VALUES);
    /**
     * Number of the controller loop threads
     */
    public static final ConfigParameter<Integer> CONTROLLER_THREAD_POOL_SIZE = new ConfigParameter<>("RBAC_OPERATOR_CONTROLLER_THREAD_POOL_SIZE", strictlyPositive(INTEGER), "10", CONFIG_VALUES);
    /**
     * Fixed delay after which a reconciliation is retried when creating or updating a generated object failed
     */
    public static final ConfigParameter<Long> RETRY_DELAY_MS = new ConfigParameter<>("RBAC_OPERATOR_RETRY_DELAY_MS", strictlyPositive(LONG), "500", CONFIG_VALUES);
    /**
     * Longest delay of the exponential back-off used for failed reconciliations
     */
    public static final ConfigParameter<Long> MAX_BACKOFF_MS = new ConfigParameter<>("RBAC_OPERATOR_MAX_BACKOFF_MS", atLeast(LONG, BackOff.DEFAULT_SCALE_MS), "60000", CONFIG_VALUES);
    /**
     * Namespace used for ServiceAccount subjects and RoleBindings which do not select any namespace
     */
    public static final ConfigParameter<String> DEFAULT_NAMESPACE = new ConfigParameter<>("RBAC_OPERATOR_DEFAULT_NAMESPACE", NAMESPACE_NAME, "default", CONFIG_VALUES);
    /**
     * Whether the admission webhook defaults and validates the RbacRules. When disabled, the operator does it itself.
     */
    public static final ConfigParameter<Boolean> WEBHOOKS_ENABLED = new ConfigParameter<>("RBAC_OPERATOR_WEBHOOKS_ENABLED", BOOLEAN, "true", CONFIG_VALUES);
    /**
     * Labels used to select the RbacRule resources handled by this operator
     */
    public static final ConfigParameter<Labels> LABELS = new ConfigParameter<>("RBAC_OPERATOR_LABELS", LABEL_PREDICATE, "", CONFIG_VALUES);
    /**
     * Port of the health check and metrics server
     */
    public static final ConfigParameter<Integer> HEALTH_CHECK_PORT = new ConfigParameter<>("RBAC_OPERATOR_HEALTH_CHECK_PORT", INTEGER, "8080", CONFIG_VALUES);

    private final Map<String, Object> map;

    private RbacOperatorConfig(Map<String, Object> map) {
        this.map = map;
    }

    /**
     * Creates the configuration from the environment variables. Variables which are not configuration parameters of
     * this operator are ignored.
     *
     * @param map   Map with the environment variables
     *
     * @return  RbacOperatorConfig object
     */
    public static RbacOperatorConfig buildFromMap(Map<String, String> map) {
        Map<String, String> envMap = new HashMap<>(map);
        envMap.keySet().retainAll(RbacOperatorConfig.keyNames());

        Map<String, Object> generatedMap = ConfigParameter.define(envMap, CONFIG_VALUES);

        return new RbacOperatorConfig(generatedMap);
    }

    /**
     * @return Set of configuration key/names
     */
    public static Set<String> keyNames() {
        return Collections.unmodifiableSet(CONFIG_VALUES.keySet());
    }

    /**
     * Gets the configuration value corresponding to the key
     *
     * @param <T>      Type of value
     * @param value    Instance of Config Parameter class
     *
     * @return         Configuration value w.r.t to the key
     */
    @SuppressWarnings("unchecked")
    public <T> T get(ConfigParameter<T> value) {
        return (T) this.map.get(value.key());
    }

    /**
     * @return  How many milliseconds between the periodic reconciliations
     */
    public long getReconciliationIntervalMs() {
        return get(RECONCILIATION_INTERVAL_MS);
    }

    /**
     * @return  The size of the controller work queue
     */
    public int getWorkQueueSize() {
        return get(WORK_QUEUE_SIZE);
    }

    /**
     * @return  Number of the controller loop threads
     */
    public int getControllerThreadPoolSize() {
        return get(CONTROLLER_THREAD_POOL_SIZE);
    }

    /**
     * @return  Delay after which failed object mutations are retried
     */
    public long getRetryDelayMs() {
        return get(RETRY_DELAY_MS);
    }

    /**
     * @return  Cap of the exponential back-off
     */
    public long getMaxBackOffMs() {
        return get(MAX_BACKOFF_MS);
    }

    /**
     * @return  The fallback namespace
     */
    public String getDefaultNamespace() {
        return get(DEFAULT_NAMESPACE);
    }

    /**
     * @return  True when the admission webhook is enabled
     */
    public boolean isWebhooksEnabled() {
        return get(WEBHOOKS_ENABLED);
    }

    /**
     * @return The labels which should be used as selector
     */
    public Labels getLabels() {
        return get(LABELS);
    }

    /**
     * @return  Port of the health check and metrics server
     */
    public int getHealthCheckPort() {
        return get(HEALTH_CHECK_PORT);
    }

    @Override
    public String toString() {
        return "RbacOperatorConfig{" +
                "\n\treconciliationIntervalMs=" + getReconciliationIntervalMs() +
                "\n\tworkQueueSize=" + getWorkQueueSize() +
                "\n\tcontrollerThreadPoolSize=" + getControllerThreadPoolSize() +
                "\n\tretryDelayMs=" + getRetryDelayMs() +
                "\n\tmaxBackOffMs=" + getMaxBackOffMs() +
                "\n\tdefaultNamespace='" + getDefaultNamespace() + '\'' +
                "\n\twebhooksEnabled=" + isWebhooksEnabled() +
                "\n\tlabels=" + getLabels() +
                "\n\thealthCheckPort=" + getHealthCheckPort() +
                '}';
    }
}
