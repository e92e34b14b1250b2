/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.rbac;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ClassLoaderMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.rbacoperator.operator.common.MetricsProvider;
import io.rbacoperator.operator.common.MicrometerMetricsProvider;
import io.rbacoperator.operator.common.OperatorKubernetesClientBuilder;
import io.rbacoperator.operator.common.Util;
import io.rbacoperator.operator.common.http.HealthCheckAndMetricsServer;
import io.rbacoperator.operator.common.operator.resource.ClusterRoleBindingOperator;
import io.rbacoperator.operator.common.operator.resource.NamespaceOperator;
import io.rbacoperator.operator.common.operator.resource.RoleBindingOperator;
import io.rbacoperator.operator.common.operator.resource.ServiceAccountOperator;
import io.rbacoperator.operator.rbac.operator.RbacRuleOperator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;

/**
 * The main class of the RBAC Operator
 */
@SuppressWarnings("checkstyle:classdataabstractioncoupling")
public class Main {
    private static final Logger LOGGER = LogManager.getLogger(Main.class);

    /**
     * Main method which starts the webserver with healthchecks and metrics and the RbacRuleController which is
     * responsible for handling the RbacRules
     *
     * @param args  Startup arguments
     */
    public static void main(String[] args) {
        LOGGER.info("RbacOperator {} is starting", Main.class.getPackage().getImplementationVersion());

        // Log environment information
        Util.printEnvInfo();

        RbacOperatorConfig config = RbacOperatorConfig.buildFromMap(System.getenv());
        LOGGER.info("RbacOperator configuration is {}", config);

        KubernetesClient client = new OperatorKubernetesClientBuilder("rbac-operator", Main.class.getPackage().getImplementationVersion()).build();

        RbacRuleOperator ruleOperator = new RbacRuleOperator(client);
        NamespaceOperator namespaceOperator = new NamespaceOperator(client);
        ServiceAccountOperator serviceAccountOperator = new ServiceAccountOperator(client);
        RoleBindingOperator roleBindingOperator = new RoleBindingOperator(client);
        ClusterRoleBindingOperator clusterRoleBindingOperator = new ClusterRoleBindingOperator(client);

        RbacRuleReconciler reconciler = new RbacRuleReconciler(
                config,
                Clock.systemUTC(),
                ruleOperator,
                namespaceOperator,
                serviceAccountOperator,
                roleBindingOperator,
                clusterRoleBindingOperator
        );

        MetricsProvider metricsProvider = createMetricsProvider();

        RbacRuleController controller = new RbacRuleController(
                config,
                reconciler,
                ruleOperator,
                namespaceOperator,
                serviceAccountOperator,
                roleBindingOperator,
                clusterRoleBindingOperator,
                metricsProvider
        );

        HealthCheckAndMetricsServer healthCheckAndMetricsServer = new HealthCheckAndMetricsServer(config.getHealthCheckPort(), controller, controller, metricsProvider);

        healthCheckAndMetricsServer.start();
        controller.start();

        LOGGER.info("Registering shutdown hook");
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Requesting controller to stop");
            controller.stop();

            LOGGER.info("Requesting health check and metrics server to stop");
            healthCheckAndMetricsServer.stop();

            LOGGER.info("Requesting Kubernetes client to stop");
            client.close();

            LOGGER.info("Shutdown complete");
        }));
    }

    /**
     * Creates the MetricsProvider instance based on a PrometheusMeterRegistry and binds the JVM metrics to it
     *
     * @return  MetricsProvider instance
     */
    private static MetricsProvider createMetricsProvider()  {
        MeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new ClassLoaderMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);

        return new MicrometerMetricsProvider(registry);
    }
}
