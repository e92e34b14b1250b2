/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.common.model;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.rbacoperator.operator.common.Util;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import static java.util.Collections.emptyMap;
import static java.util.Collections.unmodifiableMap;

/**
 * An immutable set of labels
 */
public class Labels {
    /**
     * Kubernetes domain used for Kubernetes labels
     */
    public static final String KUBERNETES_DOMAIN = "app.kubernetes.io/";

    /**
     * Used to identify which tool is managing given resource
     */
    public static final String KUBERNETES_MANAGED_BY_LABEL = KUBERNETES_DOMAIN + "managed-by";

    /**
     * Maximal length of a label value
     */
    public static final int MAX_LABEL_VALUE_LENGTH = 63;

    /**
     * Empty set of labels
     */
    public static final Labels EMPTY = new Labels(emptyMap());

    private final Map<String, String> labels;

    private Labels(Map<String, String> labels) {
        this.labels = unmodifiableMap(new LinkedHashMap<>(labels));
    }

    /**
     * @param resource The resource to get the labels of.
     *
     * @return A new instance which is the same as the labels on the given resource.
     */
    public static Labels fromResource(HasMetadata resource) {
        Map<String, String> additionalLabels = resource.getMetadata().getLabels();
        return additionalLabels != null ? new Labels(additionalLabels) : EMPTY;
    }

    /**
     * @param labels The labels.
     *
     * @return A new instance with the given labels.
     */
    public static Labels fromMap(Map<String, String> labels) {
        return labels != null ? new Labels(labels) : EMPTY;
    }

    /**
     * Parses labels from a String in the {@code key1=value1,key2=value2} format
     *
     * @param stringLabels  String with the labels
     *
     * @return  Labels object with parsed labels
     *
     * @throws IllegalArgumentException When the labels cannot be parsed
     */
    public static Labels fromString(String stringLabels) throws IllegalArgumentException {
        Map<String, String> labels = new LinkedHashMap<>();

        if (stringLabels != null && !stringLabels.isBlank()) {
            for (String label : stringLabels.split(",")) {
                String[] fields = label.split("=", -1);

                if (fields.length != 2 || fields[0].isBlank()) {
                    throw new IllegalArgumentException("Failed to parse labels from string " + stringLabels);
                }

                labels.put(fields[0].trim(), fields[1].trim());
            }
        }

        return new Labels(labels);
    }

    /**
     * Returns a label value which is safe to use in Kubernetes. Values longer than 63 characters are truncated and
     * suffixed with a hash of the complete value so that different long values stay distinct.
     *
     * @param value     The desired label value
     *
     * @return  Value which fits into a label
     */
    public static String sanitizeLabelValue(String value) {
        if (value.length() <= MAX_LABEL_VALUE_LENGTH) {
            return value;
        }

        String hash = Util.hashStub(value);
        String prefix = value.substring(0, MAX_LABEL_VALUE_LENGTH - hash.length() - 1);

        // Label values have to end with an alphanumeric character
        while (!prefix.isEmpty() && !Character.isLetterOrDigit(prefix.charAt(prefix.length() - 1))) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }

        return prefix + "-" + hash;
    }

    /**
     * @param additionalLabels Labels which should be added
     *
     * @return A new instance with the additional labels added. The new labels win over the existing ones.
     */
    public Labels withAdditionalLabels(Map<String, String> additionalLabels) {
        if (additionalLabels == null || additionalLabels.isEmpty()) {
            return this;
        }

        Map<String, String> newLabels = new LinkedHashMap<>(labels);
        newLabels.putAll(additionalLabels);
        return new Labels(newLabels);
    }

    /**
     * @param label     Label key
     * @param value     Label value. It is sanitized to fit the label value limits.
     *
     * @return A new instance with the given label added
     */
    public Labels with(String label, String value) {
        Map<String, String> newLabels = new LinkedHashMap<>(labels);
        newLabels.put(label, sanitizeLabelValue(value));
        return new Labels(newLabels);
    }

    /**
     * @param operatorName  Name of the operator managing the resource
     *
     * @return A new instance with the given name added for the {@code app.kubernetes.io/managed-by} key
     */
    public Labels withKubernetesManagedBy(String operatorName) {
        return with(KUBERNETES_MANAGED_BY_LABEL, operatorName);
    }

    /**
     * @return an unmodifiable map of the labels.
     */
    public Map<String, String> toMap() {
        return labels;
    }

    /**
     * @return A string which can be used as the Kubernetes label selector (e.g. key1=value1,key2=value2).
     */
    public String toSelectorString() {
        return labels.entrySet().stream().map(entry -> entry.getKey() + "=" + entry.getValue()).collect(Collectors.joining(","));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Labels labels1 = (Labels) o;
        return Objects.equals(labels, labels1.labels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(labels);
    }

    @Override
    public String toString() {
        return "Labels" + labels;
    }
}
