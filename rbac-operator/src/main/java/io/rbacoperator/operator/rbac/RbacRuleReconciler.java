/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.rbac;

import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.ServiceAccount;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBinding;
import io.fabric8.kubernetes.api.model.rbac.RoleBinding;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.rbacoperator.api.rbac.model.Binding;
import io.rbacoperator.api.rbac.model.RbacRule;
import io.rbacoperator.api.rbac.model.RbacRuleStatus;
import io.rbacoperator.operator.common.Reconciliation;
import io.rbacoperator.operator.common.ReconciliationLogger;
import io.rbacoperator.operator.common.controller.ReconcileResult;
import io.rbacoperator.operator.common.model.InvalidResourceException;
import io.rbacoperator.operator.common.model.Labels;
import io.rbacoperator.operator.common.model.StatusUtils;
import io.rbacoperator.operator.common.operator.resource.AbstractResourceOperator;
import io.rbacoperator.operator.common.operator.resource.ClusterRoleBindingOperator;
import io.rbacoperator.operator.common.operator.resource.NamespaceOperator;
import io.rbacoperator.operator.common.operator.resource.RoleBindingOperator;
import io.rbacoperator.operator.common.operator.resource.ServiceAccountOperator;
import io.rbacoperator.operator.rbac.admission.RbacRuleDefaulter;
import io.rbacoperator.operator.rbac.admission.RbacRuleValidator;
import io.rbacoperator.operator.rbac.model.BindingExpander;
import io.rbacoperator.operator.rbac.model.BindingExpansionException;
import io.rbacoperator.operator.rbac.model.ExpandedBinding;
import io.rbacoperator.operator.rbac.model.NamespaceResolver;
import io.rbacoperator.operator.rbac.model.RbacRuleModel;
import io.rbacoperator.operator.rbac.operator.RbacRuleOperator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Reconciles a single RbacRule. One pass reads the rule and then either tears down everything the rule owns (when
 * the rule is being deleted), waits for the start time of the rule, or creates and updates the ServiceAccounts,
 * RoleBindings and ClusterRoleBindings of all its bindings.
 *
 * <p>The identifiers of the RoleBindings and ClusterRoleBindings are written to the status right after each of them
 * is created, so that the cleanup always knows about everything which was created even when the pass fails half way.
 * Failures to create, update or delete the generated objects are retried after a short fixed delay. Failures to read
 * or update the rule itself are thrown to the controller loop which retries them with an exponential back-off.</p>
 *
 * <p>The reconciler keeps no state between the passes, so different rules can be reconciled in parallel.</p>
 */
public class RbacRuleReconciler {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(RbacRuleReconciler.class);

    /**
     * Reason used when the rule waits for its start time
     */
    public static final String REASON_PENDING = "Pending";
    /**
     * Reason used when all bindings of the rule were applied
     */
    public static final String REASON_ACTIVE = "Active";
    /**
     * Reason used when some bindings could not be expanded
     */
    public static final String REASON_INVALID_BINDING = "InvalidBinding";
    /**
     * Reason used when the rule itself is not valid
     */
    public static final String REASON_INVALID_RESOURCE = "InvalidResource";
    /**
     * Reason used when the generated objects could not be created, updated or deleted
     */
    public static final String REASON_RECONCILIATION_FAILED = "ReconciliationFailed";

    private final Clock clock;
    private final Duration retryDelay;
    private final boolean webhooksEnabled;

    private final RbacRuleOperator ruleOperator;
    private final NamespaceOperator namespaceOperator;
    private final ServiceAccountOperator serviceAccountOperator;
    private final RoleBindingOperator roleBindingOperator;
    private final ClusterRoleBindingOperator clusterRoleBindingOperator;

    private final BindingExpander expander;
    private final RbacRuleDefaulter defaulter;
    private final RbacRuleValidator validator;

    /**
     * Constructs the reconciler
     *
     * @param config                        Operator configuration
     * @param clock                         Clock used for the start and end times of the rules
     * @param ruleOperator                  Operator for the RbacRule resources
     * @param namespaceOperator             Operator for the Namespaces
     * @param serviceAccountOperator        Operator for the ServiceAccounts
     * @param roleBindingOperator           Operator for the RoleBindings
     * @param clusterRoleBindingOperator    Operator for the ClusterRoleBindings
     */
    public RbacRuleReconciler(RbacOperatorConfig config,
                              Clock clock,
                              RbacRuleOperator ruleOperator,
                              NamespaceOperator namespaceOperator,
                              ServiceAccountOperator serviceAccountOperator,
                              RoleBindingOperator roleBindingOperator,
                              ClusterRoleBindingOperator clusterRoleBindingOperator) {
        this.clock = clock;
        this.retryDelay = Duration.ofMillis(config.getRetryDelayMs());
        this.webhooksEnabled = config.isWebhooksEnabled();

        this.ruleOperator = ruleOperator;
        this.namespaceOperator = namespaceOperator;
        this.serviceAccountOperator = serviceAccountOperator;
        this.roleBindingOperator = roleBindingOperator;
        this.clusterRoleBindingOperator = clusterRoleBindingOperator;

        this.expander = new BindingExpander(new NamespaceResolver(namespaceOperator));
        this.defaulter = new RbacRuleDefaulter(config.getDefaultNamespace());
        this.validator = new RbacRuleValidator(clock);
    }

    /**
     * Runs one reconciliation pass of the rule
     *
     * @param reconciliation    Reconciliation marker identifying the rule
     *
     * @return  Result telling whether and when the rule should be reconciled again
     */
    public ReconcileResult reconcile(Reconciliation reconciliation) {
        RbacRule rule = ruleOperator.get(reconciliation.name());

        if (rule == null) {
            LOGGER.infoCr(reconciliation, "{} {} does not exist anymore", reconciliation.kind(), reconciliation.name());
            return ReconcileResult.done();
        }

        if (RbacRuleModel.isDeleted(rule)) {
            return reconcileDeletion(reconciliation, rule);
        }

        if (!RbacRuleModel.hasFinalizer(rule)) {
            rule = ruleOperator.addFinalizer(reconciliation, rule, RbacRuleModel.FINALIZER);
        }

        initStatus(rule);

        if (!webhooksEnabled) {
            defaulter.apply(rule);

            try {
                validator.validateUpdate(reconciliation, rule);
            } catch (InvalidResourceException e) {
                updateReadyCondition(reconciliation, rule, "False", REASON_INVALID_RESOURCE, e.getMessage());
                return ReconcileResult.done();
            }
        }

        Instant now = clock.instant();
        Instant start;
        Instant end;

        try {
            start = rule.getSpec().startInstant();
            end = rule.getSpec().endInstant();
        } catch (DateTimeParseException e) {
            LOGGER.warnCr(reconciliation, "RbacRule has invalid start or end time", e);
            updateReadyCondition(reconciliation, rule, "False", REASON_INVALID_RESOURCE, "Invalid start or end time: " + e.getMessage());
            return ReconcileResult.done();
        }

        if (start != null && start.isAfter(now)) {
            Duration wait = Duration.between(now, start);
            LOGGER.infoCr(reconciliation, "RbacRule is not active yet and will be reconciled again at {} (in {} ms)", start, wait.toMillis());
            updateReadyCondition(reconciliation, rule, "False", REASON_PENDING, "The rule becomes active at " + StatusUtils.iso8601(start));
            return ReconcileResult.requeueAfter(wait);
        }

        List<String> invalidBindings;

        try {
            invalidBindings = applyBindings(reconciliation, rule);
        } catch (MutationFailedException e) {
            LOGGER.warnCr(reconciliation, "Reconciliation will be retried in {} ms: {}", retryDelay.toMillis(), e.getMessage());
            updateReadyCondition(reconciliation, rule, "False", REASON_RECONCILIATION_FAILED, e.getMessage());
            return ReconcileResult.requeueAfter(retryDelay);
        }

        ReconcileResult result = ReconcileResult.done();

        if (end != null) {
            if (end.isAfter(now)) {
                Duration wait = Duration.between(now, end);
                LOGGER.infoCr(reconciliation, "RbacRule will be deleted at {} (in {} ms)", end, wait.toMillis());
                result = ReconcileResult.requeueAfter(wait);
            } else {
                LOGGER.infoCr(reconciliation, "RbacRule reached its end time {} and will be deleted", end);
                ruleOperator.delete(reconciliation, null, rule.getMetadata().getName());
                return ReconcileResult.done();
            }
        }

        boolean generationChanged = !Objects.equals(rule.getStatus().getObservedGeneration(), rule.getMetadata().getGeneration());
        rule.getStatus().setObservedGeneration(rule.getMetadata().getGeneration());

        if (invalidBindings.isEmpty()) {
            updateReadyCondition(reconciliation, rule, "True", REASON_ACTIVE, null, generationChanged);
        } else {
            updateReadyCondition(reconciliation, rule, "False", REASON_INVALID_BINDING, String.join("; ", invalidBindings), generationChanged);
        }

        LOGGER.infoCr(reconciliation, "RbacRule reconciled");
        return result;
    }

    /**
     * Creates or updates the objects of all bindings of the rule and deletes the objects which are not desired
     * anymore. Bindings which cannot be expanded are skipped. Nothing is deleted in that case, because the desired
     * state is not known completely.
     *
     * @return  Error messages of the bindings which could not be expanded
     */
    private List<String> applyBindings(Reconciliation reconciliation, RbacRule rule) {
        String ruleName = rule.getMetadata().getName();
        Labels labels = RbacRuleModel.labels(ruleName);
        List<OwnerReference> ownerReferences = List.of(RbacRuleModel.ownerReference(rule));
        RbacRuleStatus status = rule.getStatus();

        Set<String> desiredServiceAccounts = new LinkedHashSet<>();
        Set<String> desiredRoleBindings = new LinkedHashSet<>();
        Set<String> desiredClusterRoleBindings = new LinkedHashSet<>();
        List<String> invalidBindings = new ArrayList<>();

        List<Binding> bindings = rule.getSpec().getBindings() != null ? rule.getSpec().getBindings() : List.of();

        for (Binding binding : bindings) {
            ExpandedBinding expanded;

            try {
                expanded = expander.expand(rule, binding, labels, ownerReferences);
            } catch (BindingExpansionException e) {
                LOGGER.warnCr(reconciliation, "Binding {} will be skipped", e.getBindingName(), e);
                invalidBindings.add(e.getMessage());
                continue;
            }

            String conflict = conflictingObject(expanded, desiredRoleBindings, desiredClusterRoleBindings);

            if (conflict != null) {
                String message = "Binding " + expanded.name() + " cannot be applied: " + conflict + " is already generated by another binding";
                LOGGER.warnCr(reconciliation, "Binding {} will be skipped because {} is already generated by another binding", expanded.name(), conflict);
                invalidBindings.add(message);
                continue;
            }

            LOGGER.debugCr(reconciliation, "Binding {} expanded into {} ServiceAccounts, {} RoleBindings and {} ClusterRoleBindings",
                    expanded.name(), expanded.serviceAccounts().size(), expanded.roleBindings().size(), expanded.clusterRoleBindings().size());

            for (String namespace : expanded.namespaces()) {
                ensureNamespace(reconciliation, namespace, labels, ownerReferences);
            }

            for (ServiceAccount serviceAccount : expanded.serviceAccounts()) {
                mutate(reconciliation, "create or update ServiceAccount " + id(serviceAccount),
                        () -> serviceAccountOperator.createOrUpdate(reconciliation, serviceAccount));
                desiredServiceAccounts.add(id(serviceAccount));
            }

            for (RoleBinding roleBinding : expanded.roleBindings()) {
                mutate(reconciliation, "create or update RoleBinding " + id(roleBinding),
                        () -> roleBindingOperator.createOrUpdate(reconciliation, roleBinding));
                desiredRoleBindings.add(id(roleBinding));

                if (status.getRoleBindings().add(id(roleBinding))) {
                    writeStatus(reconciliation, rule);
                }
            }

            for (ClusterRoleBinding clusterRoleBinding : expanded.clusterRoleBindings()) {
                mutate(reconciliation, "create or update ClusterRoleBinding " + id(clusterRoleBinding),
                        () -> clusterRoleBindingOperator.createOrUpdate(reconciliation, clusterRoleBinding));
                desiredClusterRoleBindings.add(id(clusterRoleBinding));

                if (status.getClusterRoleBindings().add(id(clusterRoleBinding))) {
                    writeStatus(reconciliation, rule);
                }
            }
        }

        if (invalidBindings.isEmpty()) {
            prune(reconciliation, rule, desiredServiceAccounts, desiredRoleBindings, desiredClusterRoleBindings);
        } else {
            LOGGER.infoCr(reconciliation, "Objects which are not desired anymore will not be deleted because some bindings are invalid");
        }

        return invalidBindings;
    }

    /**
     * @return  Description of the first RoleBinding or ClusterRoleBinding of the expanded binding which was already
     *          generated by one of the previous bindings, or null when there is none
     */
    private static String conflictingObject(ExpandedBinding expanded, Set<String> roleBindings, Set<String> clusterRoleBindings) {
        for (RoleBinding roleBinding : expanded.roleBindings()) {
            if (roleBindings.contains(id(roleBinding))) {
                return "RoleBinding " + id(roleBinding);
            }
        }

        for (ClusterRoleBinding clusterRoleBinding : expanded.clusterRoleBindings()) {
            if (clusterRoleBindings.contains(id(clusterRoleBinding))) {
                return "ClusterRoleBinding " + id(clusterRoleBinding);
            }
        }

        return null;
    }

    /**
     * Creates the namespace when it does not exist yet. The namespace gets the labels and the owner reference of the
     * rule.
     */
    private void ensureNamespace(Reconciliation reconciliation, String name, Labels labels, List<OwnerReference> ownerReferences) {
        Namespace current = mutate(reconciliation, "get Namespace " + name, () -> namespaceOperator.get(name));

        if (current == null) {
            LOGGER.infoCr(reconciliation, "Namespace {} does not exist and will be created", name);

            Namespace namespace = new NamespaceBuilder()
                    .withNewMetadata()
                        .withName(name)
                        .withLabels(labels.toMap())
                        .withOwnerReferences(ownerReferences)
                    .endMetadata()
                    .build();

            mutate(reconciliation, "create Namespace " + name, () -> {
                try {
                    return namespaceOperator.create(reconciliation, namespace);
                } catch (KubernetesClientException e) {
                    if (e.getCode() == AbstractResourceOperator.HTTP_CONFLICT) {
                        // Created by someone else in the meantime
                        return null;
                    }

                    throw e;
                }
            });
        }
    }

    /**
     * Deletes the owned objects which are not part of the desired state anymore and removes them from the status.
     */
    private void prune(Reconciliation reconciliation, RbacRule rule, Set<String> desiredServiceAccounts, Set<String> desiredRoleBindings, Set<String> desiredClusterRoleBindings) {
        Map<String, String> selector = RbacRuleModel.selector(rule.getMetadata().getName());

        for (RoleBinding roleBinding : mutate(reconciliation, "list RoleBindings", () -> roleBindingOperator.listWithLabels(selector))) {
            if (!desiredRoleBindings.contains(id(roleBinding))) {
                LOGGER.infoCr(reconciliation, "RoleBinding {} is not desired anymore and will be deleted", id(roleBinding));
                mutate(reconciliation, "delete RoleBinding " + id(roleBinding),
                        () -> roleBindingOperator.delete(reconciliation, roleBinding.getMetadata().getNamespace(), roleBinding.getMetadata().getName()));
            }
        }

        for (ClusterRoleBinding clusterRoleBinding : mutate(reconciliation, "list ClusterRoleBindings", () -> clusterRoleBindingOperator.listWithLabels(selector))) {
            if (!desiredClusterRoleBindings.contains(id(clusterRoleBinding))) {
                LOGGER.infoCr(reconciliation, "ClusterRoleBinding {} is not desired anymore and will be deleted", id(clusterRoleBinding));
                mutate(reconciliation, "delete ClusterRoleBinding " + id(clusterRoleBinding),
                        () -> clusterRoleBindingOperator.delete(reconciliation, null, clusterRoleBinding.getMetadata().getName()));
            }
        }

        for (ServiceAccount serviceAccount : mutate(reconciliation, "list ServiceAccounts", () -> serviceAccountOperator.listWithLabels(selector))) {
            if (!desiredServiceAccounts.contains(id(serviceAccount))) {
                LOGGER.infoCr(reconciliation, "ServiceAccount {} is not desired anymore and will be deleted", id(serviceAccount));
                mutate(reconciliation, "delete ServiceAccount " + id(serviceAccount),
                        () -> serviceAccountOperator.delete(reconciliation, serviceAccount.getMetadata().getNamespace(), serviceAccount.getMetadata().getName()));
            }
        }

        RbacRuleStatus status = rule.getStatus();
        boolean changed = status.getRoleBindings().retainAll(desiredRoleBindings);
        changed |= status.getClusterRoleBindings().retainAll(desiredClusterRoleBindings);

        if (changed) {
            writeStatus(reconciliation, rule);
        }
    }

    /**
     * Deletes everything the rule owns and removes the finalizer afterwards. Failures are thrown, so the finalizer
     * stays in place until all owned objects are gone.
     */
    private ReconcileResult reconcileDeletion(Reconciliation reconciliation, RbacRule rule) {
        if (!RbacRuleModel.hasFinalizer(rule)) {
            LOGGER.debugCr(reconciliation, "RbacRule is being deleted and has no finalizer");
            return ReconcileResult.done();
        }

        LOGGER.infoCr(reconciliation, "RbacRule is being deleted. Deleting the objects it owns.");

        initStatus(rule);
        RbacRuleStatus status = rule.getStatus();
        Map<String, String> selector = RbacRuleModel.selector(rule.getMetadata().getName());

        for (RoleBinding roleBinding : roleBindingOperator.listWithLabels(selector)) {
            roleBindingOperator.delete(reconciliation, roleBinding.getMetadata().getNamespace(), roleBinding.getMetadata().getName());

            if (status.getRoleBindings().remove(id(roleBinding))) {
                writeStatus(reconciliation, rule);
            }
        }

        for (ClusterRoleBinding clusterRoleBinding : clusterRoleBindingOperator.listWithLabels(selector)) {
            clusterRoleBindingOperator.delete(reconciliation, null, clusterRoleBinding.getMetadata().getName());

            if (status.getClusterRoleBindings().remove(id(clusterRoleBinding))) {
                writeStatus(reconciliation, rule);
            }
        }

        for (ServiceAccount serviceAccount : serviceAccountOperator.listWithLabels(selector)) {
            // A ServiceAccount which does not exist anymore is reported as not deleted, which is fine here
            serviceAccountOperator.delete(reconciliation, serviceAccount.getMetadata().getNamespace(), serviceAccount.getMetadata().getName());
        }

        ruleOperator.removeFinalizer(reconciliation, rule, RbacRuleModel.FINALIZER);
        LOGGER.infoCr(reconciliation, "Objects owned by the RbacRule were deleted and the finalizer was removed");

        return ReconcileResult.done();
    }

    private void updateReadyCondition(Reconciliation reconciliation, RbacRule rule, String conditionStatus, String reason, String message) {
        updateReadyCondition(reconciliation, rule, conditionStatus, reason, message, false);
    }

    /**
     * Sets the Ready condition and writes the status when the condition changed or when the write is forced
     */
    private void updateReadyCondition(Reconciliation reconciliation, RbacRule rule, String conditionStatus, String reason, String message, boolean forceWrite) {
        RbacRuleStatus status = rule.getStatus();
        Condition current = StatusUtils.findCondition(status.getConditions(), StatusUtils.READY);
        Condition desired = StatusUtils.preserveTransitionTime(current,
                StatusUtils.buildCondition(StatusUtils.READY, conditionStatus, reason, message, clock.instant()));

        boolean changed = desired != current;

        if (changed) {
            List<Condition> conditions = new ArrayList<>();

            for (Condition condition : status.getConditions()) {
                if (!StatusUtils.READY.equals(condition.getType())) {
                    conditions.add(condition);
                }
            }

            conditions.add(desired);
            status.setConditions(conditions);
        }

        if (changed || forceWrite) {
            writeStatus(reconciliation, rule);
        }
    }

    private void writeStatus(Reconciliation reconciliation, RbacRule rule) {
        ruleOperator.updateStatus(reconciliation, rule);
    }

    private static void initStatus(RbacRule rule) {
        RbacRuleStatus status = new RbacRuleStatus(rule.getStatus());
        rule.setStatus(status);
    }

    private static <T> T mutate(Reconciliation reconciliation, String description, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (KubernetesClientException e) {
            LOGGER.warnCr(reconciliation, "Failed to {}", description, e);
            throw new MutationFailedException("Failed to " + description + ": " + e.getMessage(), e);
        }
    }

    private static String id(HasMetadata resource) {
        return resource.getMetadata().getNamespace() != null
                ? resource.getMetadata().getNamespace() + "/" + resource.getMetadata().getName()
                : resource.getMetadata().getName();
    }
}
