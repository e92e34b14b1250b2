/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.rbac.model;

import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import io.rbacoperator.api.rbac.Constants;
import io.rbacoperator.api.rbac.model.RbacRule;
import io.rbacoperator.operator.common.model.Labels;

import java.util.Map;

/**
 * Ownership of the resources generated for an RbacRule: labels, owner references and the finalizer
 */
public class RbacRuleModel {
    /**
     * Name of the operator used in the app.kubernetes.io/managed-by label
     */
    public static final String OPERATOR_NAME = "rbac-operator";

    /**
     * Label with the name of the RbacRule which owns the resource
     */
    public static final String RBAC_RULE_LABEL = Constants.RBAC_OPERATOR_DOMAIN + "rbac-rule";

    /**
     * Finalizer which keeps the RbacRule until its resources are deleted
     */
    public static final String FINALIZER = Constants.RBAC_OPERATOR_DOMAIN + "cleanup-rbac-rule";

    private RbacRuleModel() { }

    /**
     * @param ruleName  Name of the RbacRule
     *
     * @return  Labels which all resources owned by the rule have
     */
    public static Labels labels(String ruleName) {
        return Labels.EMPTY
                .withKubernetesManagedBy(OPERATOR_NAME)
                .with(RBAC_RULE_LABEL, ruleName);
    }

    /**
     * @param ruleName  Name of the RbacRule
     *
     * @return  Label selector matching the resources owned by the rule
     */
    public static Map<String, String> selector(String ruleName) {
        return Labels.EMPTY.with(RBAC_RULE_LABEL, ruleName).toMap();
    }

    /**
     * @param rule  The RbacRule
     *
     * @return  Controller owner reference pointing to the rule
     */
    public static OwnerReference ownerReference(RbacRule rule) {
        return new OwnerReferenceBuilder()
                .withApiVersion(rule.getApiVersion())
                .withKind(rule.getKind())
                .withName(rule.getMetadata().getName())
                .withUid(rule.getMetadata().getUid())
                .withBlockOwnerDeletion(false)
                .withController(true)
                .build();
    }

    /**
     * @param rule  The RbacRule
     *
     * @return  True if the rule has the cleanup finalizer
     */
    public static boolean hasFinalizer(RbacRule rule) {
        return rule.getMetadata().getFinalizers() != null && rule.getMetadata().getFinalizers().contains(FINALIZER);
    }

    /**
     * @param rule  The RbacRule
     *
     * @return  True if the deletion of the rule was requested
     */
    public static boolean isDeleted(RbacRule rule) {
        return rule.getMetadata().getDeletionTimestamp() != null;
    }
}
