/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.api.rbac;

import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinition;
import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinitionBuilder;
import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceSubresourceStatus;
import io.fabric8.kubernetes.api.model.apiextensions.v1.JSONSchemaPropsBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.rbacoperator.api.rbac.model.RbacRule;
import io.rbacoperator.api.rbac.model.RbacRuleList;

/**
 * "Static" information about the CRDs defined in this package
 */
public class Crds {
    private Crds() {
    }

    /**
     * Builds the CustomResourceDefinition of the RbacRule resource. The schema preserves unknown fields, the actual
     * validation is done by the admission webhook and by the operator itself.
     *
     * @return  The RbacRule CRD
     */
    public static CustomResourceDefinition rbacRule() {
        return new CustomResourceDefinitionBuilder()
                .withNewMetadata()
                    .withName(RbacRule.CRD_NAME)
                .endMetadata()
                .withNewSpec()
                    .withScope(RbacRule.SCOPE)
                    .withGroup(RbacRule.RESOURCE_GROUP)
                    .withNewNames()
                        .withSingular(RbacRule.RESOURCE_SINGULAR)
                        .withPlural(RbacRule.RESOURCE_PLURAL)
                        .withKind(RbacRule.RESOURCE_KIND)
                        .withListKind(RbacRule.RESOURCE_LIST_KIND)
                        .withShortNames(RbacRule.SHORT_NAME)
                    .endNames()
                    .addNewVersion()
                        .withName(Constants.V1ALPHA1)
                        .withServed(true)
                        .withStorage(true)
                        .withNewSubresources()
                            .withStatus(new CustomResourceSubresourceStatus())
                        .endSubresources()
                        .withNewSchema()
                            .withOpenAPIV3Schema(new JSONSchemaPropsBuilder()
                                    .withType("object")
                                    .withXKubernetesPreserveUnknownFields(true)
                                    .build())
                        .endSchema()
                    .endVersion()
                .endSpec()
                .build();
    }

    /**
     * @param client    Kubernetes client
     *
     * @return  Operation for the RbacRule resources
     */
    public static MixedOperation<RbacRule, RbacRuleList, Resource<RbacRule>> rbacRuleOperation(KubernetesClient client) {
        return client.resources(RbacRule.class, RbacRuleList.class);
    }
}
