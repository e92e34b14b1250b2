/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.common.operator.resource;

import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBinding;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBindingList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.AnyNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;

/**
 * Operations for {@code ClusterRoleBinding}s. They are cluster scoped, so the namespace is always ignored.
 */
public class ClusterRoleBindingOperator extends AbstractResourceOperator<ClusterRoleBinding, ClusterRoleBindingList, Resource<ClusterRoleBinding>> {
    /**
     * Constructor
     *
     * @param client    The Kubernetes client
     */
    public ClusterRoleBindingOperator(KubernetesClient client) {
        super(client, "ClusterRoleBinding");
    }

    @Override
    protected NonNamespaceOperation<ClusterRoleBinding, ClusterRoleBindingList, Resource<ClusterRoleBinding>> operation(String namespace) {
        return client.rbac().clusterRoleBindings();
    }

    @Override
    protected AnyNamespaceOperation<ClusterRoleBinding, ClusterRoleBindingList, Resource<ClusterRoleBinding>> anyNamespaceOperation() {
        return client.rbac().clusterRoleBindings();
    }
}
