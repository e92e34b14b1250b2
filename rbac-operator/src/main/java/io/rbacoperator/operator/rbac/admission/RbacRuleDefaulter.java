/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.rbac.admission;

import io.rbacoperator.api.rbac.model.Binding;
import io.rbacoperator.api.rbac.model.RbacRule;
import io.rbacoperator.api.rbac.model.RoleBindingSpec;
import io.rbacoperator.api.rbac.model.Subject;
import io.rbacoperator.api.rbac.model.SubjectKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Fills in the defaults of an RbacRule. ServiceAccount subjects and RoleBindings without any namespace selection get
 * the fallback namespace.
 */
public class RbacRuleDefaulter {
    private final String defaultNamespace;

    /**
     * Constructor
     *
     * @param defaultNamespace  The fallback namespace
     */
    public RbacRuleDefaulter(String defaultNamespace) {
        this.defaultNamespace = defaultNamespace;
    }

    /**
     * Applies the defaults to the rule. The rule is modified in place.
     *
     * @param rule  The RbacRule
     *
     * @return  True if anything was changed
     */
    public boolean apply(RbacRule rule) {
        boolean changed = false;

        if (rule.getSpec() == null || rule.getSpec().getBindings() == null) {
            return false;
        }

        for (Binding binding : rule.getSpec().getBindings()) {
            if (binding.getSubjects() != null) {
                for (Subject subject : binding.getSubjects()) {
                    if (subject.getKind() == SubjectKind.SERVICE_ACCOUNT && subject.hasNoNamespaceSelection()) {
                        subject.setNamespaces(defaultNamespaces());
                        changed = true;
                    }
                }
            }

            if (binding.getRoleBindings() != null) {
                for (RoleBindingSpec roleBinding : binding.getRoleBindings()) {
                    if (roleBinding.hasNoNamespaceSelection()) {
                        roleBinding.setNamespaces(defaultNamespaces());
                        changed = true;
                    }
                }
            }
        }

        return changed;
    }

    private List<String> defaultNamespaces() {
        List<String> namespaces = new ArrayList<>(1);
        namespaces.add(defaultNamespace);
        return namespaces;
    }
}
