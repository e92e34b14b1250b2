/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.rbac.model;

import io.fabric8.kubernetes.api.model.LabelSelectorBuilder;
import io.fabric8.kubernetes.api.model.LabelSelectorRequirementBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.rbacoperator.api.rbac.model.RoleBindingSpec;
import io.rbacoperator.operator.common.operator.resource.NamespaceOperator;
import io.rbacoperator.operator.rbac.ResourceUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertThrows;

@EnableKubernetesMockClient(crud = true)
public class NamespaceResolverTest {
    // Injected by Fabric8 Mock Kubernetes Server
    @SuppressWarnings("unused")
    private KubernetesClient client;

    private NamespaceResolver resolver;

    @BeforeEach
    public void setup() {
        createNamespace("a", Map.of("env", "prod"));
        createNamespace("c", Map.of("env", "dev"));
        createNamespace("b", Map.of("env", "dev", "team", "x"));
        createNamespace("d", Map.of("env", "test", "legacy", "true"));

        resolver = new NamespaceResolver(new NamespaceOperator(client));
    }

    @Test
    public void testExplicitNamespacesOnly() throws SelectorException {
        RoleBindingSpec spec = ResourceUtils.roleBinding("reader", null, "z", "a", "z");

        assertThat(resolver.resolve(spec), contains("z", "a"));
    }

    @Test
    public void testUnionOfExplicitNamespacesAndSelector() throws SelectorException {
        RoleBindingSpec spec = ResourceUtils.roleBinding("reader", null, "a");
        spec.setNamespaceSelector(new LabelSelectorBuilder().withMatchLabels(Map.of("env", "dev")).build());

        assertThat(resolver.resolve(spec), contains("a", "b", "c"));
    }

    @Test
    public void testSelectorWithExpressions() throws SelectorException {
        RoleBindingSpec spec = ResourceUtils.roleBinding("reader", null);
        spec.setNamespaceSelector(new LabelSelectorBuilder()
                .withMatchExpressions(new LabelSelectorRequirementBuilder()
                        .withKey("env")
                        .withOperator(LabelSelectorMatcher.NOT_IN)
                        .withValues("dev")
                        .build())
                .build());

        assertThat(resolver.resolve(spec), contains("a", "d"));
    }

    @Test
    public void testMatchExpression() throws SelectorException {
        RoleBindingSpec spec = ResourceUtils.roleBinding("reader", null);
        spec.setNamespaceMatchExpression("env in (dev,test),!legacy");

        assertThat(resolver.resolve(spec), contains("b", "c"));
    }

    @Test
    public void testSelectorAndMatchExpressionAreUnited() throws SelectorException {
        RoleBindingSpec spec = ResourceUtils.roleBinding("reader", null);
        spec.setNamespaceSelector(new LabelSelectorBuilder().withMatchLabels(Map.of("team", "x")).build());
        spec.setNamespaceMatchExpression("legacy");

        assertThat(resolver.resolve(spec), contains("b", "d"));
    }

    @Test
    public void testEmptySelection() throws SelectorException {
        RoleBindingSpec spec = ResourceUtils.roleBinding("reader", null);
        spec.setNamespaceSelector(new LabelSelectorBuilder().build());
        spec.setNamespaceMatchExpression("  ");

        assertThat(resolver.resolve(spec), is(empty()));
    }

    @Test
    public void testSelectorWithoutMatches() throws SelectorException {
        RoleBindingSpec spec = ResourceUtils.roleBinding("reader", null);
        spec.setNamespaceSelector(new LabelSelectorBuilder().withMatchLabels(Map.of("env", "staging")).build());

        assertThat(resolver.resolve(spec), is(empty()));
    }

    @Test
    public void testInvalidSelectors() {
        RoleBindingSpec invalidOperator = ResourceUtils.roleBinding("reader", null, "a");
        invalidOperator.setNamespaceSelector(new LabelSelectorBuilder()
                .withMatchExpressions(new LabelSelectorRequirementBuilder()
                        .withKey("env")
                        .withOperator("Equals")
                        .withValues(List.of("dev"))
                        .build())
                .build());
        assertThrows(SelectorException.class, () -> resolver.resolve(invalidOperator));

        RoleBindingSpec invalidExpression = ResourceUtils.roleBinding("reader", null, "a");
        invalidExpression.setNamespaceMatchExpression("env in (dev");
        assertThrows(SelectorException.class, () -> resolver.resolve(invalidExpression));
    }

    private void createNamespace(String name, Map<String, String> labels) {
        client.namespaces().resource(ResourceUtils.namespace(name, labels)).create();
    }
}
