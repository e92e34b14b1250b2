/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.api.rbac.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.ShortNames;
import io.fabric8.kubernetes.model.annotation.Singular;
import io.fabric8.kubernetes.model.annotation.Version;
import io.rbacoperator.api.rbac.Constants;

/**
 * The RbacRule custom resource. It declares the bindings of subjects to roles which should exist across many
 * namespaces. The resource is cluster scoped so that it can own both namespaced and cluster scoped objects.
 */
@JsonDeserialize
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"apiVersion", "kind", "metadata", "spec", "status"})
@Group(Constants.RESOURCE_GROUP_NAME)
@Version(Constants.V1ALPHA1)
@Kind(RbacRule.RESOURCE_KIND)
@Plural(RbacRule.RESOURCE_PLURAL)
@Singular(RbacRule.RESOURCE_SINGULAR)
@ShortNames(RbacRule.SHORT_NAME)
public class RbacRule extends CustomResource<RbacRuleSpec, RbacRuleStatus> {
    private static final long serialVersionUID = 1L;

    public static final String SCOPE = "Cluster";
    public static final String RESOURCE_KIND = "RbacRule";
    public static final String RESOURCE_LIST_KIND = RESOURCE_KIND + "List";
    public static final String RESOURCE_GROUP = Constants.RESOURCE_GROUP_NAME;
    public static final String RESOURCE_PLURAL = "rbacrules";
    public static final String RESOURCE_SINGULAR = "rbacrule";
    public static final String CRD_NAME = RESOURCE_PLURAL + "." + RESOURCE_GROUP;
    public static final String SHORT_NAME = "rr";

    @Override
    protected RbacRuleSpec initSpec() {
        return new RbacRuleSpec();
    }

    @Override
    public String toString() {
        YAMLMapper mapper = new YAMLMapper();
        try {
            return mapper.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new RuntimeException(e);
        }
    }
}
