/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.api.rbac.model;

import io.fabric8.kubernetes.api.model.LabelSelector;

import java.util.List;

/**
 * Selection rule of namespaces shared by subjects and role bindings. The selected namespaces are the union of the
 * explicitly listed namespaces, the namespaces matching the label selector and the namespaces matching the match
 * expression.
 */
public interface NamespaceSelection {
    /**
     * @return  Explicitly listed namespaces
     */
    List<String> getNamespaces();

    /**
     * @return  Label selector matched against the labels of the namespaces
     */
    LabelSelector getNamespaceSelector();

    /**
     * @return  Label selector in its string form (for example {@code env in (dev,test),!legacy})
     */
    String getNamespaceMatchExpression();

    /**
     * @return  True when none of the selection fields is set
     */
    default boolean hasNoNamespaceSelection() {
        return (getNamespaces() == null || getNamespaces().isEmpty())
                && getNamespaceSelector() == null
                && (getNamespaceMatchExpression() == null || getNamespaceMatchExpression().isBlank());
    }
}
