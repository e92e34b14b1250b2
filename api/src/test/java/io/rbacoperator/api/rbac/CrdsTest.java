/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.api.rbac;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinition;
import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinitionVersion;
import io.rbacoperator.api.rbac.model.RbacRule;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;

public class CrdsTest {
    @Test
    public void testCrdMatchesTheModel() {
        CustomResourceDefinition crd = Crds.rbacRule();

        assertThat(crd.getMetadata().getName(), is("rbacrules.rbac-operator.io"));
        assertThat(crd.getSpec().getScope(), is("Cluster"));
        assertThat(crd.getSpec().getGroup(), is(Constants.RESOURCE_GROUP_NAME));
        assertThat(crd.getSpec().getNames().getKind(), is(RbacRule.RESOURCE_KIND));
        assertThat(crd.getSpec().getNames().getShortNames(), contains("rr"));

        CustomResourceDefinitionVersion version = crd.getSpec().getVersions().get(0);
        assertThat(version.getName(), is("v1alpha1"));
        assertThat(version.getSubresources().getStatus(), is(notNullValue()));

        assertThat(HasMetadata.getPlural(RbacRule.class), is(RbacRule.RESOURCE_PLURAL));
        assertThat(new RbacRule().getApiVersion(), is(Constants.V1ALPHA1_API_VERSION));
    }
}
