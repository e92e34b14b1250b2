/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.common.operator.resource;

import io.fabric8.kubernetes.api.model.ServiceAccount;
import io.fabric8.kubernetes.api.model.ServiceAccountList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.AnyNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.ServiceAccountResource;

/**
 * Operations for {@code ServiceAccount}s.
 */
public class ServiceAccountOperator extends AbstractResourceOperator<ServiceAccount, ServiceAccountList, ServiceAccountResource> {
    /**
     * Constructor
     *
     * @param client    The Kubernetes client
     */
    public ServiceAccountOperator(KubernetesClient client) {
        super(client, "ServiceAccount");
    }

    @Override
    protected NonNamespaceOperation<ServiceAccount, ServiceAccountList, ServiceAccountResource> operation(String namespace) {
        return client.serviceAccounts().inNamespace(namespace);
    }

    @Override
    protected AnyNamespaceOperation<ServiceAccount, ServiceAccountList, ServiceAccountResource> anyNamespaceOperation() {
        return client.serviceAccounts().inAnyNamespace();
    }
}
