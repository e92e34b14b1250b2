/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.api.rbac.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.fabric8.kubernetes.api.model.LabelSelector;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Namespaced binding of the subjects to a Role and / or ClusterRole. One RoleBinding is created in every selected
 * namespace for each role field which is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"role", "clusterRole", "namespaces", "namespaceSelector", "namespaceMatchExpression"})
@EqualsAndHashCode
@ToString
public class RoleBindingSpec implements NamespaceSelection, Serializable {
    private static final long serialVersionUID = 1L;

    private String role;
    private String clusterRole;
    private List<String> namespaces = new ArrayList<>();
    private LabelSelector namespaceSelector;
    private String namespaceMatchExpression;

    public String getRole() {
        return role;
    }

    public void setRole(String role) {
        this.role = role;
    }

    public String getClusterRole() {
        return clusterRole;
    }

    public void setClusterRole(String clusterRole) {
        this.clusterRole = clusterRole;
    }

    @Override
    public List<String> getNamespaces() {
        return namespaces;
    }

    public void setNamespaces(List<String> namespaces) {
        this.namespaces = namespaces;
    }

    @Override
    public LabelSelector getNamespaceSelector() {
        return namespaceSelector;
    }

    public void setNamespaceSelector(LabelSelector namespaceSelector) {
        this.namespaceSelector = namespaceSelector;
    }

    @Override
    public String getNamespaceMatchExpression() {
        return namespaceMatchExpression;
    }

    public void setNamespaceMatchExpression(String namespaceMatchExpression) {
        this.namespaceMatchExpression = namespaceMatchExpression;
    }
}
