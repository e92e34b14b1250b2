/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.common.operator.resource;

import io.fabric8.kubernetes.api.model.rbac.RoleBinding;
import io.fabric8.kubernetes.api.model.rbac.RoleBindingList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.AnyNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;

/**
 * Operations for {@code RoleBinding}s.
 */
public class RoleBindingOperator extends AbstractResourceOperator<RoleBinding, RoleBindingList, Resource<RoleBinding>> {
    /**
     * Constructor
     *
     * @param client    The Kubernetes client
     */
    public RoleBindingOperator(KubernetesClient client) {
        super(client, "RoleBinding");
    }

    @Override
    protected NonNamespaceOperation<RoleBinding, RoleBindingList, Resource<RoleBinding>> operation(String namespace) {
        return client.rbac().roleBindings().inNamespace(namespace);
    }

    @Override
    protected AnyNamespaceOperation<RoleBinding, RoleBindingList, Resource<RoleBinding>> anyNamespaceOperation() {
        return client.rbac().roleBindings().inAnyNamespace();
    }
}
