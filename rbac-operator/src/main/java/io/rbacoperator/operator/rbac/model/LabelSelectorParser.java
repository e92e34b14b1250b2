/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.rbac.model;

import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.LabelSelectorBuilder;
import io.fabric8.kubernetes.api.model.LabelSelectorRequirement;
import io.fabric8.kubernetes.api.model.LabelSelectorRequirementBuilder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses label selectors written in the Kubernetes string syntax, as used by {@code kubectl get -l}. Supported terms
 * are {@code key=value}, {@code key==value}, {@code key!=value}, {@code key in (v1,v2)}, {@code key notin (v1,v2)},
 * {@code key} and {@code !key}. Terms are separated by commas and all of them have to match.
 */
public class LabelSelectorParser {
    private static final Pattern LABEL_KEY = Pattern.compile("([a-zA-Z0-9]([-a-zA-Z0-9.]{0,251}[a-zA-Z0-9])?/)?[a-zA-Z0-9]([-a-zA-Z0-9_.]{0,61}[a-zA-Z0-9])?");
    private static final Pattern LABEL_VALUE = Pattern.compile("([a-zA-Z0-9]([-a-zA-Z0-9_.]{0,61}[a-zA-Z0-9])?)?");
    private static final Pattern SET_TERM = Pattern.compile("^(\\S+)\\s+(in|notin)\\s*\\((.*)\\)$");

    private LabelSelectorParser() { }

    /**
     * Parses the selector
     *
     * @param expression    Selector in the string syntax
     *
     * @return  Equivalent label selector using only match expressions
     *
     * @throws SelectorException    when the expression is not a valid selector
     */
    public static LabelSelector parse(String expression) throws SelectorException {
        List<LabelSelectorRequirement> requirements = new ArrayList<>();

        for (String term : splitTerms(expression)) {
            requirements.add(parseTerm(term.trim(), expression));
        }

        return new LabelSelectorBuilder()
                .withMatchExpressions(requirements)
                .build();
    }

    /**
     * Splits the expression on the commas which are not inside parentheses
     */
    private static List<String> splitTerms(String expression) throws SelectorException {
        List<String> terms = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;

        for (char c : expression.toCharArray()) {
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    throw new SelectorException("Unbalanced parentheses in selector " + expression);
                }
            }

            if (c == ',' && depth == 0) {
                terms.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }

        if (depth != 0) {
            throw new SelectorException("Unbalanced parentheses in selector " + expression);
        }

        terms.add(current.toString());
        return terms;
    }

    private static LabelSelectorRequirement parseTerm(String term, String expression) throws SelectorException {
        if (term.isEmpty()) {
            throw new SelectorException("Empty term in selector " + expression);
        }

        Matcher setTerm = SET_TERM.matcher(term);
        if (setTerm.matches()) {
            String operator = "in".equals(setTerm.group(2)) ? LabelSelectorMatcher.IN : LabelSelectorMatcher.NOT_IN;
            List<String> values = new ArrayList<>();

            for (String value : Arrays.asList(setTerm.group(3).split(",", -1))) {
                values.add(value(value.trim(), expression));
            }

            if (values.isEmpty() || values.stream().allMatch(String::isEmpty)) {
                throw new SelectorException("Operator " + setTerm.group(2) + " needs at least one value in selector " + expression);
            }

            return requirement(key(setTerm.group(1), expression), operator, values);
        } else if (term.startsWith("!")) {
            return requirement(key(term.substring(1).trim(), expression), LabelSelectorMatcher.DOES_NOT_EXIST, List.of());
        } else if (term.contains("!=")) {
            String[] fields = term.split("!=", -1);
            checkFields(fields, expression);
            return requirement(key(fields[0].trim(), expression), LabelSelectorMatcher.NOT_IN, List.of(value(fields[1].trim(), expression)));
        } else if (term.contains("==")) {
            String[] fields = term.split("==", -1);
            checkFields(fields, expression);
            return requirement(key(fields[0].trim(), expression), LabelSelectorMatcher.IN, List.of(value(fields[1].trim(), expression)));
        } else if (term.contains("=")) {
            String[] fields = term.split("=", -1);
            checkFields(fields, expression);
            return requirement(key(fields[0].trim(), expression), LabelSelectorMatcher.IN, List.of(value(fields[1].trim(), expression)));
        } else {
            return requirement(key(term, expression), LabelSelectorMatcher.EXISTS, List.of());
        }
    }

    private static void checkFields(String[] fields, String expression) throws SelectorException {
        if (fields.length != 2) {
            throw new SelectorException("Invalid term in selector " + expression);
        }
    }

    private static String key(String key, String expression) throws SelectorException {
        if (!LABEL_KEY.matcher(key).matches()) {
            throw new SelectorException("Invalid label key '" + key + "' in selector " + expression);
        }

        return key;
    }

    private static String value(String value, String expression) throws SelectorException {
        if (!LABEL_VALUE.matcher(value).matches()) {
            throw new SelectorException("Invalid label value '" + value + "' in selector " + expression);
        }

        return value;
    }

    private static LabelSelectorRequirement requirement(String key, String operator, List<String> values) {
        return new LabelSelectorRequirementBuilder()
                .withKey(key)
                .withOperator(operator)
                .withValues(values)
                .build();
    }
}
