/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.rbac.admission;

import io.rbacoperator.api.rbac.model.Binding;
import io.rbacoperator.api.rbac.model.ClusterRoleBindingSpec;
import io.rbacoperator.api.rbac.model.RbacRule;
import io.rbacoperator.api.rbac.model.RbacRuleSpec;
import io.rbacoperator.api.rbac.model.RoleBindingSpec;
import io.rbacoperator.api.rbac.model.Subject;
import io.rbacoperator.operator.common.Reconciliation;
import io.rbacoperator.operator.common.ReconciliationLogger;
import io.rbacoperator.operator.common.model.InvalidResourceException;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates RbacRules. Creation additionally requires the start time not to be in the past.
 */
public class RbacRuleValidator {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(RbacRuleValidator.class);

    private final Clock clock;

    /**
     * Constructor
     *
     * @param clock     Clock used to check the start time of new rules
     */
    public RbacRuleValidator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Validates a new rule
     *
     * @param reconciliation    Reconciliation marker
     * @param rule              The RbacRule
     *
     * @throws InvalidResourceException when the rule is not valid
     */
    public void validateCreate(Reconciliation reconciliation, RbacRule rule) throws InvalidResourceException {
        throwIfInvalid(reconciliation, validateAndGetErrorMessages(rule, clock.instant(), true));
    }

    /**
     * Validates an updated rule
     *
     * @param reconciliation    Reconciliation marker
     * @param rule              The RbacRule
     *
     * @throws InvalidResourceException when the rule is not valid
     */
    public void validateUpdate(Reconciliation reconciliation, RbacRule rule) throws InvalidResourceException {
        throwIfInvalid(reconciliation, validateAndGetErrorMessages(rule, clock.instant(), false));
    }

    private static void throwIfInvalid(Reconciliation reconciliation, Set<String> errors) {
        if (!errors.isEmpty()) {
            LOGGER.warnCr(reconciliation, "RbacRule is not valid: {}", errors);
            throw new InvalidResourceException("RbacRule is not valid: " + errors);
        }
    }

    /*test*/ static Set<String> validateAndGetErrorMessages(RbacRule rule, Instant now, boolean create) {
        Set<String> errors = new LinkedHashSet<>();
        RbacRuleSpec spec = rule.getSpec();

        if (spec == null) {
            errors.add("spec is required");
            return errors;
        }

        validateTimes(errors, spec, now, create);

        Set<String> bindingNames = new HashSet<>();
        List<Binding> bindings = spec.getBindings() != null ? spec.getBindings() : List.of();

        for (int i = 0; i < bindings.size(); i++) {
            Binding binding = bindings.get(i);
            String path = "spec.bindings[" + i + "]";

            if (binding.getName() == null || binding.getName().isBlank()) {
                errors.add(path + " needs a name");
            } else if (!bindingNames.add(binding.getName())) {
                errors.add(path + " uses the name " + binding.getName() + " which is already used by another binding");
            }

            validateSubjects(errors, path, binding.getSubjects());

            boolean noRoleBindings = binding.getRoleBindings() == null || binding.getRoleBindings().isEmpty();
            boolean noClusterRoleBindings = binding.getClusterRoleBindings() == null || binding.getClusterRoleBindings().isEmpty();

            if (noRoleBindings && noClusterRoleBindings) {
                errors.add(path + " needs at least one roleBinding or clusterRoleBinding");
            }

            if (!noRoleBindings) {
                for (int j = 0; j < binding.getRoleBindings().size(); j++) {
                    RoleBindingSpec roleBinding = binding.getRoleBindings().get(j);

                    if (isBlank(roleBinding.getRole()) && isBlank(roleBinding.getClusterRole())) {
                        errors.add(path + ".roleBindings[" + j + "] needs a role or a clusterRole");
                    }
                }
            }

            if (!noClusterRoleBindings) {
                for (int j = 0; j < binding.getClusterRoleBindings().size(); j++) {
                    ClusterRoleBindingSpec clusterRoleBinding = binding.getClusterRoleBindings().get(j);

                    if (isBlank(clusterRoleBinding.getClusterRole())) {
                        errors.add(path + ".clusterRoleBindings[" + j + "] needs a clusterRole");
                    }
                }
            }
        }

        return errors;
    }

    private static void validateTimes(Set<String> errors, RbacRuleSpec spec, Instant now, boolean create) {
        Instant start;
        Instant end;

        try {
            start = spec.startInstant();
        } catch (DateTimeParseException e) {
            errors.add("spec.startTime " + spec.getStartTime() + " is not a valid RFC 3339 timestamp");
            return;
        }

        try {
            end = spec.endInstant();
        } catch (DateTimeParseException e) {
            errors.add("spec.endTime " + spec.getEndTime() + " is not a valid RFC 3339 timestamp");
            return;
        }

        if (create && start != null && start.isBefore(now)) {
            errors.add("spec.startTime should not be earlier than now");
        }

        if (start != null && end != null && start.isAfter(end)) {
            errors.add("spec.startTime should not be later than spec.endTime");
        }
    }

    private static void validateSubjects(Set<String> errors, String path, List<Subject> subjects) {
        if (subjects == null) {
            return;
        }

        for (int i = 0; i < subjects.size(); i++) {
            Subject subject = subjects.get(i);

            if (subject.getKind() == null) {
                errors.add(path + ".subjects[" + i + "] needs a kind");
            }

            if (isBlank(subject.getName())) {
                errors.add(path + ".subjects[" + i + "] needs a name");
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
