/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.rbac.model;

import io.fabric8.kubernetes.api.model.ServiceAccount;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBinding;
import io.fabric8.kubernetes.api.model.rbac.RoleBinding;
import io.fabric8.kubernetes.api.model.rbac.Subject;

import java.util.List;
import java.util.Set;

/**
 * Kubernetes resources realizing one binding of an RbacRule
 *
 * @param name                  Name of the binding
 * @param namespaces            Namespaces which have to exist before the resources are created
 * @param subjects              Expanded subjects shared by all RoleBindings and ClusterRoleBindings
 * @param serviceAccounts       ServiceAccounts for the ServiceAccount subjects
 * @param roleBindings          RoleBindings
 * @param clusterRoleBindings   ClusterRoleBindings
 */
public record ExpandedBinding(String name,
                              Set<String> namespaces,
                              List<Subject> subjects,
                              List<ServiceAccount> serviceAccounts,
                              List<RoleBinding> roleBindings,
                              List<ClusterRoleBinding> clusterRoleBindings) {
}
