/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.common.config;

import io.rbacoperator.operator.common.InvalidConfigurationException;
import io.rbacoperator.operator.common.model.Labels;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ConfigParameterParserTest {
    @Test
    public void testNumbers() {
        assertThat(ConfigParameterParser.LONG.parse("120000"), is(120_000L));
        assertThat(ConfigParameterParser.INTEGER.parse("10"), is(10));
        assertThrows(InvalidConfigurationException.class, () -> ConfigParameterParser.LONG.parse("2m"));
        assertThrows(InvalidConfigurationException.class, () -> ConfigParameterParser.INTEGER.parse("ten"));

        ConfigParameterParser<Integer> positive = ConfigParameterParser.strictlyPositive(ConfigParameterParser.INTEGER);
        assertThat(positive.parse("1"), is(1));
        assertThrows(InvalidConfigurationException.class, () -> positive.parse("0"));
        assertThrows(InvalidConfigurationException.class, () -> positive.parse("-5"));
    }

    @Test
    public void testAtLeast() {
        ConfigParameterParser<Long> atLeast = ConfigParameterParser.atLeast(ConfigParameterParser.LONG, 200);
        assertThat(atLeast.parse("200"), is(200L));
        assertThat(atLeast.parse("60000"), is(60_000L));
        assertThrows(InvalidConfigurationException.class, () -> atLeast.parse("199"));
    }

    @Test
    public void testBoolean() {
        assertThat(ConfigParameterParser.BOOLEAN.parse("true"), is(true));
        assertThat(ConfigParameterParser.BOOLEAN.parse("FALSE"), is(false));
        assertThrows(InvalidConfigurationException.class, () -> ConfigParameterParser.BOOLEAN.parse("yes"));
    }

    @Test
    public void testNamespaceName() {
        assertThat(ConfigParameterParser.NAMESPACE_NAME.parse("default"), is("default"));
        assertThat(ConfigParameterParser.NAMESPACE_NAME.parse("team-a1"), is("team-a1"));
        assertThrows(InvalidConfigurationException.class, () -> ConfigParameterParser.NAMESPACE_NAME.parse("Team"));
        assertThrows(InvalidConfigurationException.class, () -> ConfigParameterParser.NAMESPACE_NAME.parse("-team"));
        assertThrows(InvalidConfigurationException.class, () -> ConfigParameterParser.NAMESPACE_NAME.parse("a".repeat(64)));
    }

    @Test
    public void testStrings() {
        assertThat(ConfigParameterParser.STRING.parse(""), is(""));
        assertThat(ConfigParameterParser.NON_EMPTY_STRING.parse("x"), is("x"));
        assertThrows(InvalidConfigurationException.class, () -> ConfigParameterParser.NON_EMPTY_STRING.parse(""));
    }

    @Test
    public void testLabels() {
        assertThat(ConfigParameterParser.LABEL_PREDICATE.parse("team=a,env=dev").toMap(), is(Map.of("team", "a", "env", "dev")));
        assertThat(ConfigParameterParser.LABEL_PREDICATE.parse(""), is(Labels.EMPTY));
        assertThrows(InvalidConfigurationException.class, () -> ConfigParameterParser.LABEL_PREDICATE.parse("team"));
    }
}
