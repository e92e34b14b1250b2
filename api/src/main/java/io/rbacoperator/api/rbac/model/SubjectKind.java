/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.api.rbac.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of RBAC subjects
 */
public enum SubjectKind {
    USER("User"),
    GROUP("Group"),
    SERVICE_ACCOUNT("ServiceAccount");

    private final String kind;

    SubjectKind(String kind) {
        this.kind = kind;
    }

    /**
     * @return  The kind as used in the Kubernetes RBAC subjects
     */
    @JsonValue
    public String toValue() {
        return kind;
    }

    /**
     * Parses the subject kind
     *
     * @param value     Kind as used in the custom resource
     *
     * @return  The subject kind
     */
    @JsonCreator
    public static SubjectKind forValue(String value) {
        if (value == null) {
            return null;
        }

        switch (value.toLowerCase(Locale.ENGLISH)) {
            case "user":
                return USER;
            case "group":
                return GROUP;
            case "serviceaccount":
                return SERVICE_ACCOUNT;
            default:
                throw new IllegalArgumentException("Unknown subject kind " + value);
        }
    }
}
