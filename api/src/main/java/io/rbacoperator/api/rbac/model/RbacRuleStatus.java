/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.api.rbac.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.fabric8.kubernetes.api.model.Condition;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Observed state of the RbacRule. The role binding and cluster role binding sets hold the identifiers of the objects
 * currently owned by the rule. They keep the insertion order.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"conditions", "observedGeneration", "roleBindings", "clusterRoleBindings"})
@EqualsAndHashCode
@ToString
public class RbacRuleStatus implements Serializable {
    private static final long serialVersionUID = 1L;

    private List<Condition> conditions = new ArrayList<>();
    private Long observedGeneration;
    @JsonDeserialize(as = LinkedHashSet.class)
    private Set<String> roleBindings = new LinkedHashSet<>();
    @JsonDeserialize(as = LinkedHashSet.class)
    private Set<String> clusterRoleBindings = new LinkedHashSet<>();

    /**
     * Creates an empty status
     */
    public RbacRuleStatus() {
    }

    /**
     * Creates a copy of another status
     *
     * @param other     Status which should be copied
     */
    public RbacRuleStatus(RbacRuleStatus other) {
        if (other != null) {
            this.conditions = other.conditions != null ? new ArrayList<>(other.conditions) : new ArrayList<>();
            this.observedGeneration = other.observedGeneration;
            this.roleBindings = other.roleBindings != null ? new LinkedHashSet<>(other.roleBindings) : new LinkedHashSet<>();
            this.clusterRoleBindings = other.clusterRoleBindings != null ? new LinkedHashSet<>(other.clusterRoleBindings) : new LinkedHashSet<>();
        }
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    public void setConditions(List<Condition> conditions) {
        this.conditions = conditions;
    }

    public Long getObservedGeneration() {
        return observedGeneration;
    }

    public void setObservedGeneration(Long observedGeneration) {
        this.observedGeneration = observedGeneration;
    }

    /**
     * @return  Owned RoleBindings in the {@code <namespace>/<name>} form
     */
    public Set<String> getRoleBindings() {
        return roleBindings;
    }

    public void setRoleBindings(Set<String> roleBindings) {
        this.roleBindings = roleBindings;
    }

    /**
     * @return  Names of the owned ClusterRoleBindings
     */
    public Set<String> getClusterRoleBindings() {
        return clusterRoleBindings;
    }

    public void setClusterRoleBindings(Set<String> clusterRoleBindings) {
        this.clusterRoleBindings = clusterRoleBindings;
    }
}
