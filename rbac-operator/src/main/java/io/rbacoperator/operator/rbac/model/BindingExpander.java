/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.rbac.model;

import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.ServiceAccount;
import io.fabric8.kubernetes.api.model.ServiceAccountBuilder;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBinding;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBindingBuilder;
import io.fabric8.kubernetes.api.model.rbac.RoleBinding;
import io.fabric8.kubernetes.api.model.rbac.RoleBindingBuilder;
import io.fabric8.kubernetes.api.model.rbac.RoleRef;
import io.fabric8.kubernetes.api.model.rbac.RoleRefBuilder;
import io.fabric8.kubernetes.api.model.rbac.Subject;
import io.fabric8.kubernetes.api.model.rbac.SubjectBuilder;
import io.rbacoperator.api.rbac.Constants;
import io.rbacoperator.api.rbac.model.Binding;
import io.rbacoperator.api.rbac.model.ClusterRoleBindingSpec;
import io.rbacoperator.api.rbac.model.RbacRule;
import io.rbacoperator.api.rbac.model.RoleBindingSpec;
import io.rbacoperator.operator.common.model.Labels;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Expands a binding of an RbacRule into the Kubernetes resources which realize it. User and Group subjects are used
 * once. ServiceAccount subjects are used once per resolved namespace. All RoleBindings and ClusterRoleBindings of the
 * binding share the same expanded subjects.
 */
public class BindingExpander {
    private static final String SERVICE_ACCOUNT_KIND = "ServiceAccount";

    private final NamespaceResolver namespaceResolver;

    /**
     * Constructor
     *
     * @param namespaceResolver     Resolver of the namespace selections
     */
    public BindingExpander(NamespaceResolver namespaceResolver) {
        this.namespaceResolver = namespaceResolver;
    }

    /**
     * Expands the binding
     *
     * @param rule              RbacRule to which the binding belongs
     * @param binding           The binding
     * @param labels            Labels of the generated resources
     * @param ownerReferences   Owner references of the generated resources
     *
     * @return  The generated resources
     *
     * @throws BindingExpansionException    when some namespace selection of the binding is invalid
     */
    public ExpandedBinding expand(RbacRule rule, Binding binding, Labels labels, List<OwnerReference> ownerReferences) throws BindingExpansionException {
        try {
            String ruleName = rule.getMetadata().getName();
            Set<String> namespaces = new LinkedHashSet<>();
            Set<Subject> subjects = new LinkedHashSet<>();
            Map<String, ServiceAccount> serviceAccounts = new LinkedHashMap<>();

            for (io.rbacoperator.api.rbac.model.Subject subject : nullToEmpty(binding.getSubjects())) {
                if (subject.getKind() == null) {
                    throw new BindingExpansionException(binding.getName(), "subject " + subject.getName() + " has no kind");
                }

                List<Subject> expanded = switch (subject.getKind()) {
                    case USER, GROUP -> List.of(new SubjectBuilder()
                            .withApiGroup(Constants.RBAC_API_GROUP)
                            .withKind(subject.getKind().toValue())
                            .withName(subject.getName())
                            .build());
                    case SERVICE_ACCOUNT -> serviceAccountSubjects(subject);
                };

                for (Subject expandedSubject : expanded) {
                    subjects.add(expandedSubject);

                    if (expandedSubject.getNamespace() != null) {
                        namespaces.add(expandedSubject.getNamespace());

                        if (rule.getSpec().shouldCreateServiceAccounts()) {
                            serviceAccounts.putIfAbsent(expandedSubject.getNamespace() + "/" + expandedSubject.getName(),
                                    serviceAccount(expandedSubject.getNamespace(), expandedSubject.getName(), labels, ownerReferences));
                        }
                    }
                }
            }

            List<Subject> subjectList = List.copyOf(subjects);
            Map<String, RoleBinding> roleBindings = new LinkedHashMap<>();

            for (RoleBindingSpec spec : nullToEmpty(binding.getRoleBindings())) {
                for (String namespace : namespaceResolver.resolve(spec)) {
                    namespaces.add(namespace);

                    if (hasText(spec.getRole())) {
                        String name = ResourceNames.roleBindingForRole(ruleName, binding.getName(), spec.getRole());
                        roleBindings.putIfAbsent(namespace + "/" + name, roleBinding(namespace, name, roleRef("Role", spec.getRole()), subjectList, labels, ownerReferences));
                    }

                    if (hasText(spec.getClusterRole())) {
                        String name = ResourceNames.roleBindingForClusterRole(ruleName, binding.getName(), spec.getClusterRole());
                        roleBindings.putIfAbsent(namespace + "/" + name, roleBinding(namespace, name, roleRef("ClusterRole", spec.getClusterRole()), subjectList, labels, ownerReferences));
                    }
                }
            }

            Map<String, ClusterRoleBinding> clusterRoleBindings = new LinkedHashMap<>();

            for (ClusterRoleBindingSpec spec : nullToEmpty(binding.getClusterRoleBindings())) {
                if (hasText(spec.getClusterRole())) {
                    String name = ResourceNames.clusterRoleBinding(ruleName, binding.getName(), spec.getClusterRole());
                    clusterRoleBindings.putIfAbsent(name, clusterRoleBinding(name, roleRef("ClusterRole", spec.getClusterRole()), subjectList, labels, ownerReferences));
                }
            }

            return new ExpandedBinding(binding.getName(),
                    namespaces,
                    subjectList,
                    List.copyOf(serviceAccounts.values()),
                    List.copyOf(roleBindings.values()),
                    List.copyOf(clusterRoleBindings.values()));
        } catch (SelectorException e) {
            throw new BindingExpansionException(binding.getName(), e);
        }
    }

    private List<Subject> serviceAccountSubjects(io.rbacoperator.api.rbac.model.Subject subject) throws SelectorException {
        List<Subject> subjects = new ArrayList<>();

        for (String namespace : namespaceResolver.resolve(subject)) {
            subjects.add(new SubjectBuilder()
                    .withKind(SERVICE_ACCOUNT_KIND)
                    .withName(subject.getName())
                    .withNamespace(namespace)
                    .build());
        }

        return subjects;
    }

    private static ServiceAccount serviceAccount(String namespace, String name, Labels labels, List<OwnerReference> ownerReferences) {
        return new ServiceAccountBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withNamespace(namespace)
                    .withLabels(labels.toMap())
                    .withOwnerReferences(ownerReferences)
                .endMetadata()
                .build();
    }

    private static RoleBinding roleBinding(String namespace, String name, RoleRef roleRef, List<Subject> subjects, Labels labels, List<OwnerReference> ownerReferences) {
        return new RoleBindingBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withNamespace(namespace)
                    .withLabels(labels.toMap())
                    .withOwnerReferences(ownerReferences)
                .endMetadata()
                .withRoleRef(roleRef)
                .withSubjects(subjects)
                .build();
    }

    private static ClusterRoleBinding clusterRoleBinding(String name, RoleRef roleRef, List<Subject> subjects, Labels labels, List<OwnerReference> ownerReferences) {
        return new ClusterRoleBindingBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withLabels(labels.toMap())
                    .withOwnerReferences(ownerReferences)
                .endMetadata()
                .withRoleRef(roleRef)
                .withSubjects(subjects)
                .build();
    }

    private static RoleRef roleRef(String kind, String name) {
        return new RoleRefBuilder()
                .withApiGroup(Constants.RBAC_API_GROUP)
                .withKind(kind)
                .withName(name)
                .build();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list != null ? list : List.of();
    }
}
