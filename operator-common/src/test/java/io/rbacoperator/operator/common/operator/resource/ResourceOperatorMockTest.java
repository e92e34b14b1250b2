/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.common.operator.resource;

import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.fabric8.kubernetes.api.model.ServiceAccount;
import io.fabric8.kubernetes.api.model.ServiceAccountBuilder;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBinding;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBindingBuilder;
import io.fabric8.kubernetes.api.model.rbac.RoleBinding;
import io.fabric8.kubernetes.api.model.rbac.RoleBindingBuilder;
import io.fabric8.kubernetes.api.model.rbac.RoleRefBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.rbacoperator.operator.common.Reconciliation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.jupiter.api.Assertions.assertThrows;

@EnableKubernetesMockClient(crud = true)
public class ResourceOperatorMockTest {
    private static final Map<String, String> LABELS = Map.of("rbac-operator.io/rbac-rule", "my-rule");

    // Injected by Fabric8 Mock Kubernetes Server
    @SuppressWarnings("unused")
    private KubernetesClient client;

    @Test
    public void testRoleBindingCreateOrUpdate() {
        RoleBindingOperator op = new RoleBindingOperator(client);

        RoleBinding created = op.createOrUpdate(Reconciliation.DUMMY_RECONCILIATION, roleBinding("ns1", "my-rb", "alice"));
        assertThat(created.getMetadata().getResourceVersion(), is(notNullValue()));
        assertThat(op.get("ns1", "my-rb").getSubjects().get(0).getName(), is("alice"));

        // Second call has no resource version and conflicts with the existing binding
        op.createOrUpdate(Reconciliation.DUMMY_RECONCILIATION, roleBinding("ns1", "my-rb", "bob"));
        assertThat(op.get("ns1", "my-rb").getSubjects().get(0).getName(), is("bob"));
        assertThat(op.listWithLabels(LABELS).size(), is(1));
    }

    @Test
    public void testCreateConflicts() {
        RoleBindingOperator op = new RoleBindingOperator(client);

        op.create(Reconciliation.DUMMY_RECONCILIATION, roleBinding("ns1", "my-rb", "alice"));
        KubernetesClientException e = assertThrows(KubernetesClientException.class,
                () -> op.create(Reconciliation.DUMMY_RECONCILIATION, roleBinding("ns1", "my-rb", "alice")));
        assertThat(e.getCode(), is(AbstractResourceOperator.HTTP_CONFLICT));
    }

    @Test
    public void testListWithLabelsAcrossNamespaces() {
        RoleBindingOperator op = new RoleBindingOperator(client);

        op.createOrUpdate(Reconciliation.DUMMY_RECONCILIATION, roleBinding("ns1", "rb-1", "alice"));
        op.createOrUpdate(Reconciliation.DUMMY_RECONCILIATION, roleBinding("ns2", "rb-2", "alice"));
        client.rbac().roleBindings().inNamespace("ns3").resource(new RoleBindingBuilder()
                .withNewMetadata()
                    .withName("unrelated")
                    .withNamespace("ns3")
                .endMetadata()
                .withRoleRef(new RoleRefBuilder().withApiGroup("rbac.authorization.k8s.io").withKind("ClusterRole").withName("view").build())
                .build()).create();

        List<RoleBinding> owned = op.listWithLabels(LABELS);
        assertThat(owned.stream().map(rb -> rb.getMetadata().getNamespace() + "/" + rb.getMetadata().getName()).toList(),
                containsInAnyOrder("ns1/rb-1", "ns2/rb-2"));
    }

    @Test
    public void testDelete() {
        RoleBindingOperator op = new RoleBindingOperator(client);
        op.createOrUpdate(Reconciliation.DUMMY_RECONCILIATION, roleBinding("ns1", "my-rb", "alice"));

        assertThat(op.delete(Reconciliation.DUMMY_RECONCILIATION, "ns1", "my-rb"), is(true));
        assertThat(op.get("ns1", "my-rb"), is(nullValue()));
        assertThat(op.delete(Reconciliation.DUMMY_RECONCILIATION, "ns1", "my-rb"), is(false));
    }

    @Test
    public void testClusterRoleBindings() {
        ClusterRoleBindingOperator op = new ClusterRoleBindingOperator(client);

        ClusterRoleBinding crb = new ClusterRoleBindingBuilder()
                .withNewMetadata()
                    .withName("my-rule-devs-crb-view")
                    .withLabels(LABELS)
                .endMetadata()
                .withRoleRef(new RoleRefBuilder().withApiGroup("rbac.authorization.k8s.io").withKind("ClusterRole").withName("view").build())
                .addNewSubject()
                    .withApiGroup("rbac.authorization.k8s.io")
                    .withKind("Group")
                    .withName("developers")
                .endSubject()
                .build();

        op.createOrUpdate(Reconciliation.DUMMY_RECONCILIATION, crb);
        assertThat(op.get(null, "my-rule-devs-crb-view"), is(notNullValue()));
        assertThat(op.listWithLabels(LABELS).size(), is(1));
        assertThat(op.kind(), is("ClusterRoleBinding"));

        assertThat(op.delete(Reconciliation.DUMMY_RECONCILIATION, null, "my-rule-devs-crb-view"), is(true));
        assertThat(op.listWithLabels(LABELS).isEmpty(), is(true));
    }

    @Test
    public void testServiceAccounts() {
        ServiceAccountOperator op = new ServiceAccountOperator(client);

        ServiceAccount sa = new ServiceAccountBuilder()
                .withNewMetadata()
                    .withName("ci")
                    .withNamespace("build")
                    .withLabels(LABELS)
                .endMetadata()
                .build();

        op.createOrUpdate(Reconciliation.DUMMY_RECONCILIATION, sa);
        op.createOrUpdate(Reconciliation.DUMMY_RECONCILIATION, new ServiceAccountBuilder(sa).build());

        assertThat(op.get("build", "ci"), is(notNullValue()));
        assertThat(op.listWithLabels(LABELS).size(), is(1));
    }

    @Test
    public void testNamespaces() {
        client.namespaces().resource(new NamespaceBuilder().withNewMetadata().withName("team-a").withLabels(Map.of("team", "a")).endMetadata().build()).create();
        client.namespaces().resource(new NamespaceBuilder().withNewMetadata().withName("team-b").endMetadata().build()).create();

        NamespaceOperator op = new NamespaceOperator(client);

        assertThat(op.list().stream().map(ns -> ns.getMetadata().getName()).toList(), containsInAnyOrder("team-a", "team-b"));
        assertThat(op.get("team-a").getMetadata().getLabels(), is(Map.of("team", "a")));
        assertThat(op.get("missing"), is(nullValue()));
        assertThat(op.listWithLabels(Map.of("team", "a")).size(), is(1));
    }

    private static RoleBinding roleBinding(String namespace, String name, String user) {
        return new RoleBindingBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withNamespace(namespace)
                    .withLabels(LABELS)
                .endMetadata()
                .withRoleRef(new RoleRefBuilder().withApiGroup("rbac.authorization.k8s.io").withKind("ClusterRole").withName("edit").build())
                .addNewSubject()
                    .withApiGroup("rbac.authorization.k8s.io")
                    .withKind("User")
                    .withName(user)
                .endSubject()
                .build();
    }
}
