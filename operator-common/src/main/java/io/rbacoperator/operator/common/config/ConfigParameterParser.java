/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.common.config;

import io.rbacoperator.operator.common.InvalidConfigurationException;
import io.rbacoperator.operator.common.model.Labels;

import java.util.regex.Pattern;

/**
 * Abstraction for things which convert a single configuration parameter value from a String to some specific type.
 */
public interface ConfigParameterParser<T> {
    /**
     * Parses the string based on its type
     *
     * @param configValue config value in String format
     *
     * @throws InvalidConfigurationException if the given configuration value is not supported
     *
     * @return the value based on its type
     */
    T parse(String configValue) throws InvalidConfigurationException;

    /**
     * A java string
     */
    ConfigParameterParser<String> STRING = configValue -> configValue;

    /**
     * A non empty java string
     */
    ConfigParameterParser<String> NON_EMPTY_STRING = configValue -> {
        if (configValue == null || configValue.isEmpty()) {
            throw new InvalidConfigurationException("Failed to parse. Value cannot be empty or null");
        } else {
            return configValue;
        }
    };

    /**
     * Name of a Kubernetes namespace
     */
    ConfigParameterParser<String> NAMESPACE_NAME = configValue -> {
        if (configValue != null && Pattern.matches("[a-z0-9]([-a-z0-9]{0,61}[a-z0-9])?", configValue)) {
            return configValue;
        } else {
            throw new InvalidConfigurationException("Failed to parse. Value " + configValue + " is not a valid namespace name");
        }
    };

    /**
     * A Java Long
     */
    ConfigParameterParser<Long> LONG = configValue -> {
        try {
            return Long.parseLong(configValue);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Failed to parse. Value " + configValue + " is not valid", e);
        }
    };

    /**
     * A Java Integer
     */
    ConfigParameterParser<Integer> INTEGER = configValue -> {
        try {
            return Integer.parseInt(configValue);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Failed to parse. Value " + configValue + " is not valid", e);
        }
    };

    /**
     * Strictly Positive Number
     *
     * @param parser ConfigParameterParser object
     * @param <T>    Type of parameter
     *
     * @return Positive number
     */
    static <T extends Number> ConfigParameterParser<T> strictlyPositive(ConfigParameterParser<T> parser) {
        return configValue -> {
            var value = parser.parse(configValue);
            if (value.longValue() <= 0) {
                throw new InvalidConfigurationException("Failed to parse. Value " + configValue + " has to be bigger than 0");
            }
            return value;
        };
    }

    /**
     * Number which is not smaller than the given minimum
     *
     * @param parser    ConfigParameterParser object
     * @param minimum   The smallest allowed value
     * @param <T>       Type of parameter
     *
     * @return Number which is at least the minimum
     */
    static <T extends Number> ConfigParameterParser<T> atLeast(ConfigParameterParser<T> parser, long minimum) {
        return configValue -> {
            var value = parser.parse(configValue);
            if (value.longValue() < minimum) {
                throw new InvalidConfigurationException("Failed to parse. Value " + configValue + " has to be at least " + minimum);
            }
            return value;
        };
    }

    /**
     * A Java Boolean
     */
    ConfigParameterParser<Boolean> BOOLEAN = configValue -> {
        if (configValue.equalsIgnoreCase("true") || configValue.equalsIgnoreCase("false")) {
            return Boolean.parseBoolean(configValue);
        } else {
            throw new InvalidConfigurationException("Failed to parse. Value " + configValue + " is not valid");
        }
    };

    /**
     * A kubernetes selector.
     */
    ConfigParameterParser<Labels> LABEL_PREDICATE = stringLabels -> {
        try {
            return Labels.fromString(stringLabels);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Failed to parse. Value " + stringLabels + " is not valid", e);
        }
    };
}
