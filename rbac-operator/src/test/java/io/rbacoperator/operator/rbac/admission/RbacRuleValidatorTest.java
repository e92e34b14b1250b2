/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.rbac.admission;

import io.rbacoperator.api.rbac.model.RbacRule;
import io.rbacoperator.api.rbac.model.SubjectKind;
import io.rbacoperator.operator.common.Reconciliation;
import io.rbacoperator.operator.common.model.InvalidResourceException;
import io.rbacoperator.operator.rbac.ResourceUtils;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static io.rbacoperator.operator.rbac.ResourceUtils.RULE_NAME;
import static io.rbacoperator.operator.rbac.ResourceUtils.binding;
import static io.rbacoperator.operator.rbac.ResourceUtils.clusterRoleBinding;
import static io.rbacoperator.operator.rbac.ResourceUtils.roleBinding;
import static io.rbacoperator.operator.rbac.ResourceUtils.rule;
import static io.rbacoperator.operator.rbac.ResourceUtils.serviceAccount;
import static io.rbacoperator.operator.rbac.ResourceUtils.user;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class RbacRuleValidatorTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private static RbacRule validRule() {
        return rule(RULE_NAME,
                binding("devs", List.of(serviceAccount("sa1", "team-a"), user("alice")), List.of(roleBinding("reader", null, "ns-1")), List.of()),
                binding("admins", List.of(user("bob")), List.of(), List.of(clusterRoleBinding("admin"))));
    }

    @Test
    public void testValidRule() {
        assertThat(RbacRuleValidator.validateAndGetErrorMessages(validRule(), NOW, true), is(empty()));
    }

    @Test
    public void testDuplicateAndMissingBindingNames() {
        RbacRule rule = rule(RULE_NAME,
                binding("devs", List.of(user("alice")), List.of(roleBinding("reader", null, "ns-1")), List.of()),
                binding("devs", List.of(user("bob")), List.of(roleBinding("reader", null, "ns-1")), List.of()),
                binding(null, List.of(user("carol")), List.of(roleBinding("reader", null, "ns-1")), List.of()));

        assertThat(RbacRuleValidator.validateAndGetErrorMessages(rule, NOW, false), containsInAnyOrder(
                "spec.bindings[1] uses the name devs which is already used by another binding",
                "spec.bindings[2] needs a name"));
    }

    @Test
    public void testBindingWithoutRoles() {
        RbacRule rule = rule(RULE_NAME,
                binding("devs", List.of(user("alice")), List.of(), List.of()),
                binding("partial", List.of(user("alice")), List.of(roleBinding(null, null, "ns-1")), List.of(clusterRoleBinding(" "))));

        assertThat(RbacRuleValidator.validateAndGetErrorMessages(rule, NOW, false), containsInAnyOrder(
                "spec.bindings[0] needs at least one roleBinding or clusterRoleBinding",
                "spec.bindings[1].roleBindings[0] needs a role or a clusterRole",
                "spec.bindings[1].clusterRoleBindings[0] needs a clusterRole"));
    }

    @Test
    public void testInvalidSubjects() {
        RbacRule rule = rule(RULE_NAME,
                binding("devs", List.of(ResourceUtils.subject(null, "alice"), ResourceUtils.subject(SubjectKind.USER, "")), List.of(roleBinding("reader", null, "ns-1")), List.of()));

        assertThat(RbacRuleValidator.validateAndGetErrorMessages(rule, NOW, false), containsInAnyOrder(
                "spec.bindings[0].subjects[0] needs a kind",
                "spec.bindings[0].subjects[1] needs a name"));
    }

    @Test
    public void testStartTimeInThePastIsRejectedOnlyOnCreate() {
        RbacRule rule = validRule();
        rule.getSpec().setStartTime("2024-05-01T11:00:00Z");

        assertThat(RbacRuleValidator.validateAndGetErrorMessages(rule, NOW, true), containsInAnyOrder("spec.startTime should not be earlier than now"));
        assertThat(RbacRuleValidator.validateAndGetErrorMessages(rule, NOW, false), is(empty()));
    }

    @Test
    public void testStartTimeAfterEndTime() {
        RbacRule rule = validRule();
        rule.getSpec().setStartTime("2024-05-02T12:00:00Z");
        rule.getSpec().setEndTime("2024-05-02T10:00:00+01:00");

        assertThat(RbacRuleValidator.validateAndGetErrorMessages(rule, NOW, true), containsInAnyOrder("spec.startTime should not be later than spec.endTime"));

        rule.getSpec().setEndTime("2024-05-02T12:00:00Z");
        assertThat(RbacRuleValidator.validateAndGetErrorMessages(rule, NOW, true), is(empty()));
    }

    @Test
    public void testInvalidTimestamps() {
        RbacRule rule = validRule();
        rule.getSpec().setStartTime("tomorrow");

        Set<String> errors = RbacRuleValidator.validateAndGetErrorMessages(rule, NOW, false);
        assertThat(errors.size(), is(1));
        assertThat(errors.iterator().next(), containsString("spec.startTime tomorrow"));

        rule.getSpec().setStartTime(null);
        rule.getSpec().setEndTime("2024-13-01T00:00:00Z");

        errors = RbacRuleValidator.validateAndGetErrorMessages(rule, NOW, false);
        assertThat(errors.size(), is(1));
        assertThat(errors.iterator().next(), containsString("spec.endTime"));
    }

    @Test
    public void testMissingSpec() {
        RbacRule rule = validRule();
        rule.setSpec(null);

        assertThat(RbacRuleValidator.validateAndGetErrorMessages(rule, NOW, false), containsInAnyOrder("spec is required"));
    }

    @Test
    public void testValidateThrows() {
        RbacRuleValidator validator = new RbacRuleValidator(Clock.fixed(NOW, ZoneOffset.UTC));
        RbacRule rule = validRule();
        rule.getSpec().setStartTime("2024-05-01T11:00:00Z");

        InvalidResourceException e = assertThrows(InvalidResourceException.class, () -> validator.validateCreate(Reconciliation.DUMMY_RECONCILIATION, rule));
        assertThat(e.getMessage(), containsString("spec.startTime should not be earlier than now"));

        assertDoesNotThrow(() -> validator.validateUpdate(Reconciliation.DUMMY_RECONCILIATION, rule));
    }
}
