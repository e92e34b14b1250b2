/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.rbac.model;

import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.LabelSelectorRequirement;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates Kubernetes label selectors against the labels of a resource using set membership
 */
public class LabelSelectorMatcher {
    static final String IN = "In";
    static final String NOT_IN = "NotIn";
    static final String EXISTS = "Exists";
    static final String DOES_NOT_EXIST = "DoesNotExist";

    private LabelSelectorMatcher() { }

    /**
     * @param selector  Label selector
     *
     * @return  True if the selector has neither match labels nor match expressions
     */
    public static boolean isEmpty(LabelSelector selector) {
        return selector == null
                || ((selector.getMatchLabels() == null || selector.getMatchLabels().isEmpty())
                    && (selector.getMatchExpressions() == null || selector.getMatchExpressions().isEmpty()));
    }

    /**
     * Checks whether the labels match the selector. All match labels and all match expressions have to match.
     *
     * @param selector  Label selector
     * @param labels    Labels of the resource (null is treated as no labels)
     *
     * @return  True if the labels match the selector
     *
     * @throws SelectorException    when the selector uses an unknown operator or invalid values
     */
    public static boolean matches(LabelSelector selector, Map<String, String> labels) throws SelectorException {
        Map<String, String> actual = labels != null ? labels : Map.of();

        if (selector.getMatchLabels() != null) {
            for (Map.Entry<String, String> label : selector.getMatchLabels().entrySet()) {
                if (!Objects.equals(label.getValue(), actual.get(label.getKey()))) {
                    return false;
                }
            }
        }

        if (selector.getMatchExpressions() != null) {
            for (LabelSelectorRequirement requirement : selector.getMatchExpressions()) {
                if (!matches(requirement, actual)) {
                    return false;
                }
            }
        }

        return true;
    }

    /**
     * Checks that the selector uses only known operators with valid values
     *
     * @param selector  Label selector
     *
     * @throws SelectorException    when the selector is invalid
     */
    public static void validate(LabelSelector selector) throws SelectorException {
        if (selector != null && selector.getMatchExpressions() != null) {
            for (LabelSelectorRequirement requirement : selector.getMatchExpressions()) {
                validate(requirement);
            }
        }
    }

    private static void validate(LabelSelectorRequirement requirement) throws SelectorException {
        String key = requirement.getKey();
        boolean hasValues = requirement.getValues() != null && !requirement.getValues().isEmpty();

        if (key == null || key.isBlank()) {
            throw new SelectorException("Match expression without a key");
        }

        String operator = requirement.getOperator();
        if (operator == null) {
            throw new SelectorException("Match expression for key " + key + " has no operator");
        }

        switch (operator) {
            case IN, NOT_IN -> requireValues(key, operator, hasValues);
            case EXISTS, DOES_NOT_EXIST -> requireNoValues(key, operator, hasValues);
            default -> throw new SelectorException("Unknown operator " + operator + " in match expression for key " + key);
        }
    }

    private static boolean matches(LabelSelectorRequirement requirement, Map<String, String> labels) throws SelectorException {
        validate(requirement);

        String key = requirement.getKey();
        List<String> values = requirement.getValues();

        return switch (requirement.getOperator()) {
            case IN -> labels.containsKey(key) && values.contains(labels.get(key));
            case NOT_IN -> !labels.containsKey(key) || !values.contains(labels.get(key));
            case EXISTS -> labels.containsKey(key);
            default -> !labels.containsKey(key);
        };
    }

    private static void requireValues(String key, String operator, boolean hasValues) throws SelectorException {
        if (!hasValues) {
            throw new SelectorException("Operator " + operator + " for key " + key + " requires at least one value");
        }
    }

    private static void requireNoValues(String key, String operator, boolean hasValues) throws SelectorException {
        if (hasValues) {
            throw new SelectorException("Operator " + operator + " for key " + key + " does not accept values");
        }
    }
}
