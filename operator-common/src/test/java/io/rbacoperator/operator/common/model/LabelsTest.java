/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.common.model;

import io.fabric8.kubernetes.api.model.ConfigMapBuilder;
import io.rbacoperator.operator.common.Util;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.hamcrest.CoreMatchers.endsWith;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class LabelsTest {
    @Test
    public void testFromString() {
        Map<String, String> expected = new LinkedHashMap<>();
        expected.put("key1", "value1");
        expected.put("key2", "value2");

        assertThat(Labels.fromString("key1=value1,key2=value2").toMap(), is(expected));
        assertThat(Labels.fromString(" key1 = value1 , key2=value2").toMap(), is(expected));
        assertThat(Labels.fromString("key1="), is(Labels.fromMap(Map.of("key1", ""))));
        assertThat(Labels.fromString(null), is(Labels.EMPTY));
        assertThat(Labels.fromString("  "), is(Labels.EMPTY));
    }

    @Test
    public void testFromInvalidString() {
        assertThrows(IllegalArgumentException.class, () -> Labels.fromString("key1"));
        assertThrows(IllegalArgumentException.class, () -> Labels.fromString("=value1"));
        assertThrows(IllegalArgumentException.class, () -> Labels.fromString("key1=value1=value2"));
    }

    @Test
    public void testFromResource() {
        Labels labels = Labels.fromResource(new ConfigMapBuilder()
                .withNewMetadata()
                    .withName("my-cm")
                    .withLabels(Map.of("team", "a"))
                .endMetadata()
                .build());
        assertThat(labels.toMap(), is(Map.of("team", "a")));

        assertThat(Labels.fromResource(new ConfigMapBuilder().withNewMetadata().withName("my-cm").endMetadata().build()), is(Labels.EMPTY));
    }

    @Test
    public void testWith() {
        Labels labels = Labels.EMPTY
                .withKubernetesManagedBy("rbac-operator")
                .with("rbac-operator.io/rbac-rule", "my-rule")
                .withAdditionalLabels(Map.of("team", "a"));

        assertThat(labels.toMap().get(Labels.KUBERNETES_MANAGED_BY_LABEL), is("rbac-operator"));
        assertThat(labels.toMap().get("rbac-operator.io/rbac-rule"), is("my-rule"));
        assertThat(labels.toSelectorString(), is("app.kubernetes.io/managed-by=rbac-operator,rbac-operator.io/rbac-rule=my-rule,team=a"));
        assertThat(Labels.EMPTY.toMap().isEmpty(), is(true));
    }

    @Test
    public void testSanitizeLabelValue() {
        assertThat(Labels.sanitizeLabelValue("my-rule"), is("my-rule"));
        assertThat(Labels.sanitizeLabelValue("a".repeat(63)), is("a".repeat(63)));

        String longValue = "a".repeat(70);
        String sanitized = Labels.sanitizeLabelValue(longValue);
        assertThat(sanitized.length(), is(63));
        assertThat(sanitized, endsWith("-" + Util.hashStub(longValue)));

        String otherLongValue = "a".repeat(71);
        assertThat(Labels.sanitizeLabelValue(otherLongValue), is(not(sanitized)));
    }

    @Test
    public void testSanitizeLabelValueTrimsSeparators() {
        // The cut would end with dashes which are not allowed at the end of a label value
        String value = "a".repeat(50) + "----" + "b".repeat(20);
        String sanitized = Labels.sanitizeLabelValue(value);

        assertThat(sanitized, is("a".repeat(50) + "-" + Util.hashStub(value)));
    }
}
