/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.rbac.model;

import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.Namespace;
import io.rbacoperator.api.rbac.model.NamespaceSelection;
import io.rbacoperator.operator.common.operator.resource.NamespaceOperator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves the namespace selection of subjects and role bindings into namespace names. The result is the union of
 * the explicit namespaces, the namespaces matching the label selector and the namespaces matching the match
 * expression. Explicit namespaces come first in their declaration order, the selected namespaces follow sorted by
 * name.
 */
public class NamespaceResolver {
    private final NamespaceOperator namespaceOperator;

    /**
     * Constructor
     *
     * @param namespaceOperator     Operator used to list the namespaces
     */
    public NamespaceResolver(NamespaceOperator namespaceOperator) {
        this.namespaceOperator = namespaceOperator;
    }

    /**
     * Resolves the namespaces
     *
     * @param selection     The namespace selection
     *
     * @return  Set of namespace names
     *
     * @throws SelectorException    when the label selector or the match expression is invalid
     */
    public Set<String> resolve(NamespaceSelection selection) throws SelectorException {
        Set<String> namespaces = new LinkedHashSet<>();

        if (selection.getNamespaces() != null) {
            for (String namespace : selection.getNamespaces()) {
                if (namespace != null && !namespace.isBlank()) {
                    namespaces.add(namespace);
                }
            }
        }

        LabelSelector selector = selection.getNamespaceSelector();
        LabelSelector expressionSelector = selection.getNamespaceMatchExpression() != null && !selection.getNamespaceMatchExpression().isBlank()
                ? LabelSelectorParser.parse(selection.getNamespaceMatchExpression())
                : null;

        boolean hasSelector = !LabelSelectorMatcher.isEmpty(selector);
        boolean hasExpression = !LabelSelectorMatcher.isEmpty(expressionSelector);

        if (hasSelector || hasExpression) {
            LabelSelectorMatcher.validate(selector);
            LabelSelectorMatcher.validate(expressionSelector);

            List<Namespace> candidates = new ArrayList<>(namespaceOperator.list());
            candidates.sort(Comparator.comparing(ns -> ns.getMetadata().getName()));

            if (hasSelector) {
                addMatching(namespaces, candidates, selector);
            }

            if (hasExpression) {
                addMatching(namespaces, candidates, expressionSelector);
            }
        }

        return namespaces;
    }

    private static void addMatching(Set<String> namespaces, List<Namespace> candidates, LabelSelector selector) throws SelectorException {
        for (Namespace namespace : candidates) {
            if (LabelSelectorMatcher.matches(selector, namespace.getMetadata().getLabels())) {
                namespaces.add(namespace.getMetadata().getName());
            }
        }
    }
}
