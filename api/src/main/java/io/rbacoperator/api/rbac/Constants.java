/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.api.rbac;

/**
 * Constants shared by the RbacRule API and the operator.
 */
public class Constants {
    private Constants() { }

    /**
     * API group of the RbacRule resource
     */
    public static final String RESOURCE_GROUP_NAME = "rbac-operator.io";

    /**
     * Domain prefix used for labels, annotations and finalizers owned by the operator
     */
    public static final String RBAC_OPERATOR_DOMAIN = RESOURCE_GROUP_NAME + "/";

    /**
     * The only served and stored version
     */
    public static final String V1ALPHA1 = "v1alpha1";

    /**
     * apiVersion value of the RbacRule resources
     */
    public static final String V1ALPHA1_API_VERSION = RESOURCE_GROUP_NAME + "/" + V1ALPHA1;

    /**
     * API group of the Kubernetes RBAC resources
     */
    public static final String RBAC_API_GROUP = "rbac.authorization.k8s.io";
}
