/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.common.operator.resource;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.api.model.StatusDetails;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.AnyNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.rbacoperator.operator.common.Reconciliation;
import io.rbacoperator.operator.common.ReconciliationLogger;

import java.util.List;
import java.util.Map;

/**
 * Abstract resource operator which provides synchronous operations over one kind of Kubernetes resources. The
 * namespace is ignored for cluster scoped resources.
 *
 * @param <T>   The Kubernetes resource type
 * @param <L>   The list variant of the Kubernetes resource type
 * @param <R>   The resource operations
 */
public abstract class AbstractResourceOperator<T extends HasMetadata, L extends KubernetesResourceList<T>, R extends Resource<T>> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(AbstractResourceOperator.class);

    /**
     * HTTP code returned when the resource does not exist
     */
    public static final int HTTP_NOT_FOUND = 404;

    /**
     * HTTP code returned when the resource already exists or was changed in the meantime
     */
    public static final int HTTP_CONFLICT = 409;

    protected final KubernetesClient client;
    protected final String resourceKind;

    /**
     * Constructor
     *
     * @param client        The Kubernetes client
     * @param resourceKind  The kind of the resources
     */
    protected AbstractResourceOperator(KubernetesClient client, String resourceKind) {
        this.client = client;
        this.resourceKind = resourceKind;
    }

    /**
     * @param namespace     Namespace of the resource. Ignored for cluster scoped resources.
     *
     * @return  Operation for the resources in given namespace
     */
    protected abstract NonNamespaceOperation<T, L, R> operation(String namespace);

    /**
     * @return  Operation for the resources in all namespaces
     */
    protected abstract AnyNamespaceOperation<T, L, R> anyNamespaceOperation();

    /**
     * @return  The kind of the resources handled by this operator
     */
    public String kind() {
        return resourceKind;
    }

    /**
     * Gets the resource
     *
     * @param namespace     Namespace of the resource. Ignored for cluster scoped resources.
     * @param name          Name of the resource
     *
     * @return  The resource or null if it does not exist
     */
    public T get(String namespace, String name) {
        return operation(namespace).withName(name).get();
    }

    /**
     * Lists the resources with given labels in all namespaces
     *
     * @param labels    Labels which the resources should have
     *
     * @return  List of matching resources
     */
    public List<T> listWithLabels(Map<String, String> labels) {
        return anyNamespaceOperation().withLabels(labels).list().getItems();
    }

    /**
     * Creates the resource
     *
     * @param reconciliation    Reconciliation marker
     * @param desired           The desired resource
     *
     * @return  The created resource
     */
    public T create(Reconciliation reconciliation, T desired) {
        LOGGER.debugCr(reconciliation, "{} {} will be created", resourceKind, describe(desired));
        return operation(desired.getMetadata().getNamespace()).resource(desired).create();
    }

    /**
     * Replaces the resource. The resource version of the desired resource is used for optimistic locking.
     *
     * @param reconciliation    Reconciliation marker
     * @param desired           The desired resource
     *
     * @return  The updated resource
     */
    public T update(Reconciliation reconciliation, T desired) {
        LOGGER.debugCr(reconciliation, "{} {} will be updated", resourceKind, describe(desired));
        return operation(desired.getMetadata().getNamespace()).resource(desired).update();
    }

    /**
     * Creates the resource or replaces it when it already exists. The replacement carries the resource version of
     * the current resource.
     *
     * @param reconciliation    Reconciliation marker
     * @param desired           The desired resource
     *
     * @return  The created or updated resource
     *
     * @throws KubernetesClientException when the resource cannot be created or updated
     */
    public T createOrUpdate(Reconciliation reconciliation, T desired) {
        try {
            return create(reconciliation, desired);
        } catch (KubernetesClientException e) {
            if (e.getCode() != HTTP_CONFLICT) {
                throw e;
            }
        }

        T current = get(desired.getMetadata().getNamespace(), desired.getMetadata().getName());

        if (current == null) {
            // Deleted in the meantime
            return create(reconciliation, desired);
        }

        desired.getMetadata().setResourceVersion(current.getMetadata().getResourceVersion());
        return update(reconciliation, desired);
    }

    /**
     * Deletes the resource
     *
     * @param reconciliation    Reconciliation marker
     * @param namespace         Namespace of the resource. Ignored for cluster scoped resources.
     * @param name              Name of the resource
     *
     * @return  True if the resource was deleted, false if it did not exist
     */
    public boolean delete(Reconciliation reconciliation, String namespace, String name) {
        LOGGER.debugCr(reconciliation, "{} {} will be deleted", resourceKind, namespace != null ? namespace + "/" + name : name);

        try {
            List<StatusDetails> deleted = operation(namespace).withName(name).delete();
            return deleted != null && !deleted.isEmpty();
        } catch (KubernetesClientException e) {
            if (e.getCode() == HTTP_NOT_FOUND) {
                return false;
            }

            throw e;
        }
    }

    /**
     * Creates the informer for the resources with given labels in all namespaces. The informer has to be started by
     * the caller.
     *
     * @param selectorLabels    Labels which the resources should have
     * @param resyncIntervalMs  Resync interval of the informer
     *
     * @return  The informer
     */
    public SharedIndexInformer<T> informer(Map<String, String> selectorLabels, long resyncIntervalMs) {
        return anyNamespaceOperation().withLabels(selectorLabels).runnableInformer(resyncIntervalMs);
    }

    private static String describe(HasMetadata resource) {
        return resource.getMetadata().getNamespace() != null
                ? resource.getMetadata().getNamespace() + "/" + resource.getMetadata().getName()
                : resource.getMetadata().getName();
    }
}
