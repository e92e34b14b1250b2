/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.rbac.operator;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.AnyNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.rbacoperator.api.rbac.Crds;
import io.rbacoperator.api.rbac.model.RbacRule;
import io.rbacoperator.api.rbac.model.RbacRuleList;
import io.rbacoperator.operator.common.Reconciliation;
import io.rbacoperator.operator.common.ReconciliationLogger;
import io.rbacoperator.operator.common.operator.resource.AbstractResourceOperator;

import java.util.ArrayList;
import java.util.List;

/**
 * Operations for the cluster scoped {@code RbacRule} resources: finalizer handling and status updates.
 */
public class RbacRuleOperator extends AbstractResourceOperator<RbacRule, RbacRuleList, Resource<RbacRule>> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(RbacRuleOperator.class);

    /**
     * Constructor
     *
     * @param client    The Kubernetes client
     */
    public RbacRuleOperator(KubernetesClient client) {
        super(client, RbacRule.RESOURCE_KIND);
    }

    @Override
    protected NonNamespaceOperation<RbacRule, RbacRuleList, Resource<RbacRule>> operation(String namespace) {
        return Crds.rbacRuleOperation(client);
    }

    @Override
    protected AnyNamespaceOperation<RbacRule, RbacRuleList, Resource<RbacRule>> anyNamespaceOperation() {
        return Crds.rbacRuleOperation(client);
    }

    /**
     * @param name  Name of the rule
     *
     * @return  The rule or null if it does not exist
     */
    public RbacRule get(String name) {
        return get(null, name);
    }

    /**
     * Adds the finalizer to the rule. The update uses the resource version of the rule, so it fails with a conflict
     * when the rule was changed in the meantime.
     *
     * @param reconciliation    Reconciliation marker
     * @param rule              The rule
     * @param finalizer         Name of the finalizer
     *
     * @return  The updated rule
     */
    public RbacRule addFinalizer(Reconciliation reconciliation, RbacRule rule, String finalizer) {
        List<String> finalizers = rule.getMetadata().getFinalizers() != null ? new ArrayList<>(rule.getMetadata().getFinalizers()) : new ArrayList<>();

        if (finalizers.contains(finalizer)) {
            return rule;
        }

        LOGGER.debugCr(reconciliation, "Adding finalizer {}", finalizer);
        finalizers.add(finalizer);
        rule.getMetadata().setFinalizers(finalizers);

        return update(reconciliation, rule);
    }

    /**
     * Removes the finalizer from the rule. When the deletion of the rule was requested and this was its last
     * finalizer, the rule is deleted by Kubernetes.
     *
     * @param reconciliation    Reconciliation marker
     * @param rule              The rule
     * @param finalizer         Name of the finalizer
     *
     * @return  The updated rule
     */
    public RbacRule removeFinalizer(Reconciliation reconciliation, RbacRule rule, String finalizer) {
        List<String> finalizers = rule.getMetadata().getFinalizers() != null ? new ArrayList<>(rule.getMetadata().getFinalizers()) : new ArrayList<>();

        if (!finalizers.remove(finalizer)) {
            return rule;
        }

        LOGGER.debugCr(reconciliation, "Removing finalizer {}", finalizer);
        rule.getMetadata().setFinalizers(finalizers);

        return update(reconciliation, rule);
    }

    /**
     * Writes the status of the rule. The update does not use optimistic locking because the status is owned only by
     * the operator. The new resource version is copied into the rule so that later updates of the rule do not
     * conflict with this one.
     *
     * @param reconciliation    Reconciliation marker
     * @param rule              The rule with the desired status
     *
     * @return  The updated rule or null when the rule does not exist anymore
     */
    public RbacRule updateStatus(Reconciliation reconciliation, RbacRule rule) {
        RbacRule copy = new RbacRule();
        copy.setMetadata(new ObjectMetaBuilder(rule.getMetadata()).withResourceVersion(null).build());
        copy.setSpec(rule.getSpec());
        copy.setStatus(rule.getStatus());

        try {
            LOGGER.debugCr(reconciliation, "Updating status of {} {}", resourceKind, rule.getMetadata().getName());
            RbacRule updated = operation(null).resource(copy).updateStatus();

            if (updated != null && updated.getMetadata() != null) {
                rule.getMetadata().setResourceVersion(updated.getMetadata().getResourceVersion());
            }

            return updated;
        } catch (KubernetesClientException e) {
            if (e.getCode() == HTTP_NOT_FOUND) {
                LOGGER.debugCr(reconciliation, "{} {} was deleted while trying to update status", resourceKind, rule.getMetadata().getName());
                return null;
            }

            throw e;
        }
    }
}
