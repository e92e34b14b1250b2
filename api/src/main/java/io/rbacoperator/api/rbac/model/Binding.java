/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.api.rbac.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Named group of subjects bound to roles. The subjects are shared by all role bindings and cluster role bindings of
 * the binding.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "subjects", "roleBindings", "clusterRoleBindings"})
@EqualsAndHashCode
@ToString
public class Binding implements Serializable {
    private static final long serialVersionUID = 1L;

    private String name;
    private List<Subject> subjects = new ArrayList<>();
    private List<RoleBindingSpec> roleBindings = new ArrayList<>();
    private List<ClusterRoleBindingSpec> clusterRoleBindings = new ArrayList<>();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<Subject> getSubjects() {
        return subjects;
    }

    public void setSubjects(List<Subject> subjects) {
        this.subjects = subjects;
    }

    public List<RoleBindingSpec> getRoleBindings() {
        return roleBindings;
    }

    public void setRoleBindings(List<RoleBindingSpec> roleBindings) {
        this.roleBindings = roleBindings;
    }

    public List<ClusterRoleBindingSpec> getClusterRoleBindings() {
        return clusterRoleBindings;
    }

    public void setClusterRoleBindings(List<ClusterRoleBindingSpec> clusterRoleBindings) {
        this.clusterRoleBindings = clusterRoleBindings;
    }
}
