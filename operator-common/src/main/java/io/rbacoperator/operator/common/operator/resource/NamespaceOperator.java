/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.common.operator.resource;

import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.NamespaceList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.AnyNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;

import java.util.List;

/**
 * Operations for {@code Namespace}s.
 */
public class NamespaceOperator extends AbstractResourceOperator<Namespace, NamespaceList, Resource<Namespace>> {
    /**
     * Constructor
     *
     * @param client    The Kubernetes client
     */
    public NamespaceOperator(KubernetesClient client) {
        super(client, "Namespace");
    }

    @Override
    protected NonNamespaceOperation<Namespace, NamespaceList, Resource<Namespace>> operation(String namespace) {
        return client.namespaces();
    }

    @Override
    protected AnyNamespaceOperation<Namespace, NamespaceList, Resource<Namespace>> anyNamespaceOperation() {
        return client.namespaces();
    }

    /**
     * @return  All namespaces in the cluster
     */
    public List<Namespace> list() {
        return client.namespaces().list().getItems();
    }

    /**
     * @param name  Name of the namespace
     *
     * @return  The namespace or null if it does not exist
     */
    public Namespace get(String name) {
        return get(null, name);
    }
}
