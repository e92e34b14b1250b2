/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.api.rbac.model;

import io.fabric8.kubernetes.client.CustomResourceList;

/**
 * A {@code CustomResourceList<RbacRule>} required for using Fabric8 CRD support.
 */
public class RbacRuleList extends CustomResourceList<RbacRule> {
    private static final long serialVersionUID = 1L;
}
