/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.common;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.endsWith;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;

public class ReconciliationTest {
    @Test
    public void testToString() {
        Reconciliation namespaced = new Reconciliation("watch", "RoleBinding", "my-ns", "my-rb");
        assertThat(namespaced.toString(), startsWith("Reconciliation #"));
        assertThat(namespaced.toString(), endsWith("(watch) RoleBinding(my-ns/my-rb)"));

        Reconciliation clusterScoped = new Reconciliation("timer", "RbacRule", null, "my-rule");
        assertThat(clusterScoped.toString(), endsWith("(timer) RbacRule(/my-rule)"));
        assertThat(clusterScoped.name(), is("my-rule"));
        assertThat(clusterScoped.kind(), is("RbacRule"));
        assertThat(clusterScoped.trigger(), is("timer"));
    }
}
