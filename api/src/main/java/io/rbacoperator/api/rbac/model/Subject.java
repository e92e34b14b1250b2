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
 * Subject of a binding. Namespace selection is used only for ServiceAccount subjects.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"kind", "name", "namespaces", "namespaceSelector", "namespaceMatchExpression"})
@EqualsAndHashCode
@ToString
public class Subject implements NamespaceSelection, Serializable {
    private static final long serialVersionUID = 1L;

    private SubjectKind kind;
    private String name;
    private List<String> namespaces = new ArrayList<>();
    private LabelSelector namespaceSelector;
    private String namespaceMatchExpression;

    public SubjectKind getKind() {
        return kind;
    }

    public void setKind(SubjectKind kind) {
        this.kind = kind;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
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
