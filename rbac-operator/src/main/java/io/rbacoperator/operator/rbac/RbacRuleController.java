/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.rbac;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.ServiceAccount;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBinding;
import io.fabric8.kubernetes.api.model.rbac.RoleBinding;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.rbacoperator.api.rbac.model.RbacRule;
import io.rbacoperator.operator.common.InformerUtils;
import io.rbacoperator.operator.common.MetricsProvider;
import io.rbacoperator.operator.common.ReconciliationLogger;
import io.rbacoperator.operator.common.controller.AbstractControllerLoop;
import io.rbacoperator.operator.common.controller.ControllerQueue;
import io.rbacoperator.operator.common.controller.ReconciliationLockManager;
import io.rbacoperator.operator.common.controller.SimplifiedReconciliation;
import io.rbacoperator.operator.common.http.Liveness;
import io.rbacoperator.operator.common.http.Readiness;
import io.rbacoperator.operator.common.metrics.ControllerMetricsHolder;
import io.rbacoperator.operator.common.model.Labels;
import io.rbacoperator.operator.common.operator.resource.ClusterRoleBindingOperator;
import io.rbacoperator.operator.common.operator.resource.NamespaceOperator;
import io.rbacoperator.operator.common.operator.resource.RoleBindingOperator;
import io.rbacoperator.operator.common.operator.resource.ServiceAccountOperator;
import io.rbacoperator.operator.rbac.model.RbacRuleModel;
import io.rbacoperator.operator.rbac.operator.RbacRuleOperator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * RbacRule controller is responsible for queueing the reconciliations of the RbacRules. It does so by watching the
 * RbacRules and the objects they own and by triggering the periodical reconciliations. The actual processing of the
 * events is done by the controller loop class.
 */
public class RbacRuleController implements Liveness, Readiness {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(RbacRuleController.class);
    private static final String RESOURCE_KIND = RbacRule.RESOURCE_KIND;
    private static final long DEFAULT_RESYNC_PERIOD_MS = 5 * 60 * 1_000L; // 5 minutes by default

    private final ControllerMetricsHolder metrics;
    private final ControllerQueue workQueue;
    private final List<RbacRuleControllerLoop> threadPool;

    private final long reconcileIntervalMs;

    private final SharedIndexInformer<RbacRule> ruleInformer;
    private final SharedIndexInformer<RoleBinding> roleBindingInformer;
    private final SharedIndexInformer<ClusterRoleBinding> clusterRoleBindingInformer;
    private final SharedIndexInformer<ServiceAccount> serviceAccountInformer;
    private final SharedIndexInformer<Namespace> namespaceInformer;

    private final ScheduledExecutorService scheduledExecutor;

    /**
     * Creates the RbacRule controller
     *
     * @param config                        RBAC Operator configuration
     * @param reconciler                    Reconciler of the RbacRules
     * @param ruleOperator                  For operating on the RbacRules
     * @param namespaceOperator             For operating on the Namespaces
     * @param serviceAccountOperator        For operating on the ServiceAccounts
     * @param roleBindingOperator           For operating on the RoleBindings
     * @param clusterRoleBindingOperator    For operating on the ClusterRoleBindings
     * @param metricsProvider               Metrics provider for handling metrics
     */
    public RbacRuleController(
            RbacOperatorConfig config,
            RbacRuleReconciler reconciler,
            RbacRuleOperator ruleOperator,
            NamespaceOperator namespaceOperator,
            ServiceAccountOperator serviceAccountOperator,
            RoleBindingOperator roleBindingOperator,
            ClusterRoleBindingOperator clusterRoleBindingOperator,
            MetricsProvider metricsProvider) {

        this.reconcileIntervalMs = config.getReconciliationIntervalMs();

        // Rule selector is used to select the RbacRule resources
        Map<String, String> ruleSelector = (config.getLabels() == null || config.getLabels().toMap().isEmpty()) ? Map.of() : config.getLabels().toMap();

        // The owned objects are selected by the managed-by label. The namespaces are watched all, because new
        // namespaces can match the selectors of the rules.
        Map<String, String> ownedSelector = Labels.EMPTY.withKubernetesManagedBy(RbacRuleModel.OPERATOR_NAME).toMap();

        this.metrics = new ControllerMetricsHolder(RESOURCE_KIND, Labels.fromMap(ruleSelector), metricsProvider);

        // Creates the scheduled executor service used for periodical reconciliations, delayed reconciliations and
        // progress warnings
        this.scheduledExecutor = Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, "RbacRuleControllerScheduledExecutor"));

        this.workQueue = new ControllerQueue(config.getWorkQueueSize(), config.getMaxBackOffMs(), scheduledExecutor, metrics);

        this.ruleInformer = ruleOperator.informer(ruleSelector, DEFAULT_RESYNC_PERIOD_MS);
        this.roleBindingInformer = roleBindingOperator.informer(ownedSelector, DEFAULT_RESYNC_PERIOD_MS);
        this.clusterRoleBindingInformer = clusterRoleBindingOperator.informer(ownedSelector, DEFAULT_RESYNC_PERIOD_MS);
        this.serviceAccountInformer = serviceAccountOperator.informer(ownedSelector, DEFAULT_RESYNC_PERIOD_MS);
        this.namespaceInformer = namespaceOperator.informer(Map.of(), DEFAULT_RESYNC_PERIOD_MS);

        ReconciliationLockManager lockManager = new ReconciliationLockManager();

        // Create a thread pool for the reconciliation loops and add the reconciliation loops
        this.threadPool = new ArrayList<>(config.getControllerThreadPoolSize());
        for (int i = 0; i < config.getControllerThreadPoolSize(); i++)  {
            threadPool.add(new RbacRuleControllerLoop(RESOURCE_KIND + "-ControllerLoop-" + i, workQueue, lockManager, scheduledExecutor, reconciler, metrics));
        }
    }

    /**
     * Enqueues a rule based on an event from the RbacRule informer
     *
     * @param rule      Rule which triggered the event
     * @param action    Type of the event
     */
    private void enqueueRule(RbacRule rule, String action) {
        LOGGER.infoOp("{} {} was {}", RESOURCE_KIND, rule.getMetadata().getName(), action);
        workQueue.enqueue(new SimplifiedReconciliation(RESOURCE_KIND, null, rule.getMetadata().getName()));
    }

    /**
     * Enqueues the rule which owns the object from an event of the owned objects informers. Objects without an
     * RbacRule owner are ignored.
     *
     * @param resource  Resource which triggered the event
     * @param action    Type of the event
     */
    /*test*/ void enqueueOwner(HasMetadata resource, String action) {
        String owner;

        try {
            owner = ownerRuleName(resource);
        } catch (IllegalStateException e) {
            LOGGER.errorOp("Failed to find the {} owning {} {}", RESOURCE_KIND, resource.getKind(), describe(resource), e);
            return;
        }

        if (owner != null) {
            LOGGER.debugOp("{} {} owned by {} {} was {}", resource.getKind(), describe(resource), RESOURCE_KIND, owner, action);
            workQueue.enqueue(new SimplifiedReconciliation(RESOURCE_KIND, null, owner));
        }
    }

    /**
     * Enqueues all known rules. Used when a namespace which might match the namespace selectors was added or
     * relabeled.
     *
     * @param trigger   Trigger of the reconciliations
     */
    private void enqueueAllRules(String trigger) {
        for (RbacRule rule : ruleInformer.getIndexer().list()) {
            workQueue.enqueue(new SimplifiedReconciliation(RESOURCE_KIND, null, rule.getMetadata().getName(), trigger));
        }
    }

    /**
     * @param resource  Resource owned by an RbacRule
     *
     * @return  Name of the owning RbacRule or null when it is not owned by any RbacRule
     */
    /*test*/ static String ownerRuleName(HasMetadata resource) {
        if (resource.getMetadata() == null || resource.getMetadata().getOwnerReferences() == null) {
            return null;
        }

        for (OwnerReference ownerReference : resource.getMetadata().getOwnerReferences()) {
            if (RESOURCE_KIND.equals(ownerReference.getKind())) {
                if (ownerReference.getName() == null) {
                    throw new IllegalStateException(resource.getKind() + " " + describe(resource) + " has an owner reference to an RbacRule without a name");
                }

                return ownerReference.getName();
            }
        }

        return null;
    }

    private static String describe(HasMetadata resource) {
        return resource.getMetadata().getNamespace() != null
                ? resource.getMetadata().getNamespace() + "/" + resource.getMetadata().getName()
                : resource.getMetadata().getName();
    }

    /**
     * Indicates that the informers have been synced and are up-to-date.
     *
     * @return  True when all informers are synced. False otherwise.
     */
    protected boolean isSynced() {
        return ruleInformer.hasSynced()
                && roleBindingInformer.hasSynced()
                && clusterRoleBindingInformer.hasSynced()
                && serviceAccountInformer.hasSynced()
                && namespaceInformer.hasSynced();
    }

    /**
     * Stops the controller and all its controller loop threads
     */
    protected void stop() {
        LOGGER.infoOp("Stopping scheduled executor service");
        scheduledExecutor.shutdownNow(); // We do not wait for termination

        LOGGER.infoOp("Stopping RbacRule Controller loops");
        threadPool.forEach(t -> {
            try {
                t.stop();
            } catch (InterruptedException e) {
                LOGGER.debugOp("Interrupted while stopping controller loop", e);
            }
        });

        InformerUtils.stopAll(5_000L, ruleInformer, roleBindingInformer, clusterRoleBindingInformer, serviceAccountInformer, namespaceInformer);
    }

    /**
     * Starts the controller: its informers, its loop threads etc.
     */
    protected void start() {
        ruleInformer.addEventHandler(new RbacRuleEventHandler());
        ruleInformer.exceptionHandler((isStarted, throwable) -> InformerUtils.loggingExceptionHandler(RESOURCE_KIND, isStarted, throwable));

        roleBindingInformer.addEventHandler(new OwnedResourceEventHandler<>());
        roleBindingInformer.exceptionHandler((isStarted, throwable) -> InformerUtils.loggingExceptionHandler("RoleBinding", isStarted, throwable));

        clusterRoleBindingInformer.addEventHandler(new OwnedResourceEventHandler<>());
        clusterRoleBindingInformer.exceptionHandler((isStarted, throwable) -> InformerUtils.loggingExceptionHandler("ClusterRoleBinding", isStarted, throwable));

        serviceAccountInformer.addEventHandler(new OwnedResourceEventHandler<>());
        serviceAccountInformer.exceptionHandler((isStarted, throwable) -> InformerUtils.loggingExceptionHandler("ServiceAccount", isStarted, throwable));

        namespaceInformer.addEventHandler(new NamespaceEventHandler());
        namespaceInformer.exceptionHandler((isStarted, throwable) -> InformerUtils.loggingExceptionHandler("Namespace", isStarted, throwable));

        LOGGER.infoOp("Starting the informers");
        ruleInformer.start();
        roleBindingInformer.start();
        clusterRoleBindingInformer.start();
        serviceAccountInformer.start();
        namespaceInformer.start();

        while (!isSynced())   {
            LOGGER.infoOp("Waiting for the informers to sync");
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException e) {
                LOGGER.debugOp("Interrupted while waiting for informers to sync", e);
            }
        }

        // The controller loop threads should be started only after the informers are synced
        LOGGER.infoOp("Starting RbacRule Controller loops");
        threadPool.forEach(AbstractControllerLoop::start);

        schedulePeriodicReconciliations();
    }

    /**
     * Indicates whether the controller is ready or not. It is considered ready, when all controllers are running.
     *
     * @return  True when the controller is ready, false otherwise
     */
    @Override
    public boolean isReady()    {
        boolean ready = true;

        for (RbacRuleControllerLoop t : threadPool) {
            ready &= t.isRunning();
        }

        return ready;
    }

    /**
     * Indicates whether the controller is alive or not. It is considered alive when all controller loop threads and
     * informers are alive.
     *
     * @return  True when the controller is alive, false otherwise
     */
    @Override
    public boolean isAlive()    {
        boolean alive = true;

        for (RbacRuleControllerLoop t : threadPool) {
            alive &= t.isAlive();
        }

        alive &= ruleInformer.isRunning();
        alive &= roleBindingInformer.isRunning();
        alive &= clusterRoleBindingInformer.isRunning();
        alive &= serviceAccountInformer.isRunning();
        alive &= namespaceInformer.isRunning();

        return alive;
    }

    private void schedulePeriodicReconciliations()  {
        scheduledExecutor.scheduleAtFixedRate(new PeriodicReconciliation(), reconcileIntervalMs, reconcileIntervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Timer task which queues all known RbacRules for reconciliation
     */
    class PeriodicReconciliation implements Runnable  {
        @Override
        public void run() {
            LOGGER.infoOp("Triggering periodic reconciliation of {} resources", RESOURCE_KIND);
            metrics.periodicReconciliationsCounter().increment();
            enqueueAllRules("timer");
        }
    }

    /**
     * Event handler used in the RbacRule informer
     */
    private class RbacRuleEventHandler implements ResourceEventHandler<RbacRule> {
        @Override
        public void onAdd(RbacRule rule) {
            metrics.resourceCounter().incrementAndGet();
            enqueueRule(rule, "ADDED");
        }

        @Override
        public void onUpdate(RbacRule oldRule, RbacRule newRule) {
            enqueueRule(newRule, "MODIFIED");
        }

        @Override
        public void onDelete(RbacRule rule, boolean deletedFinalStateUnknown) {
            metrics.resourceCounter().decrementAndGet();
            enqueueRule(rule, "DELETED");
        }
    }

    /**
     * Event handler used in the informers of the RoleBindings, ClusterRoleBindings and ServiceAccounts. Changes of
     * these objects trigger the reconciliation of the rule owning them so that they are reverted or recreated.
     *
     * @param <T>   Type of the owned resource
     */
    private class OwnedResourceEventHandler<T extends HasMetadata> implements ResourceEventHandler<T> {
        @Override
        public void onAdd(T resource) {
            enqueueOwner(resource, "ADDED");
        }

        @Override
        public void onUpdate(T oldResource, T newResource) {
            enqueueOwner(newResource, "MODIFIED");
        }

        @Override
        public void onDelete(T resource, boolean deletedFinalStateUnknown) {
            enqueueOwner(resource, "DELETED");
        }
    }

    /**
     * Event handler used in the Namespace informer. New namespaces and namespaces with changed labels can match the
     * namespace selectors of any rule.
     */
    private class NamespaceEventHandler implements ResourceEventHandler<Namespace> {
        @Override
        public void onAdd(Namespace namespace) {
            LOGGER.debugOp("Namespace {} was ADDED", namespace.getMetadata().getName());
            enqueueAllRules("namespace");
        }

        @Override
        public void onUpdate(Namespace oldNamespace, Namespace newNamespace) {
            if (!Objects.equals(oldNamespace.getMetadata().getLabels(), newNamespace.getMetadata().getLabels())) {
                LOGGER.debugOp("Labels of namespace {} were MODIFIED", newNamespace.getMetadata().getName());
                enqueueAllRules("namespace");
            }
        }

        @Override
        public void onDelete(Namespace namespace, boolean deletedFinalStateUnknown) {
            enqueueOwner(namespace, "DELETED");
        }
    }
}
