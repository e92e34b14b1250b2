/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */

package io.rbacoperator.operator.common.model;

import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.ConditionBuilder;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * Utility methods for working with status sections of custom resources
 */
public class StatusUtils {
    /**
     * Type of the condition which tells whether the resource is ready
     */
    public static final String READY = "Ready";

    private StatusUtils() { }

    /**
     * Returns the timestamp of the provided date in ISO 8601 format, for example "2019-07-23T09:08:12.356Z".
     *
     * @param instant The date instant for which should the ISO 8601 timestamp be provided
     *
     * @return the timestamp in ISO 8601 format
     */
    public static String iso8601(Instant instant) {
        return ZonedDateTime.ofInstant(instant, ZoneOffset.UTC).format(DateTimeFormatter.ISO_INSTANT);
    }

    /**
     * Creates condition
     *
     * @param type              Type of the condition
     * @param status            Status of the condition (True, False or Unknown)
     * @param reason            Reason of the condition
     * @param message           Human readable message
     * @param transitionTime    Time of the transition
     *
     * @return  New condition
     */
    public static Condition buildCondition(String type, String status, String reason, String message, Instant transitionTime) {
        return new ConditionBuilder()
                .withLastTransitionTime(iso8601(transitionTime))
                .withType(type)
                .withStatus(status)
                .withReason(reason)
                .withMessage(message)
                .build();
    }

    /**
     * Finds the condition of given type
     *
     * @param conditions    List of conditions. Might be null.
     * @param type          Type of the condition
     *
     * @return  The condition or null when there is no condition of this type
     */
    public static Condition findCondition(List<Condition> conditions, String type) {
        if (conditions == null) {
            return null;
        }

        return conditions.stream()
                .filter(c -> type.equals(c.getType()))
                .findFirst()
                .orElse(null);
    }

    /**
     * Keeps the transition time of the current condition when the desired condition does not differ from it in
     * anything else. This prevents status updates which would only move the transition time.
     *
     * @param current   Current condition or null
     * @param desired   Desired condition
     *
     * @return  The condition which should be used
     */
    public static Condition preserveTransitionTime(Condition current, Condition desired) {
        if (current != null
                && Objects.equals(current.getType(), desired.getType())
                && Objects.equals(current.getStatus(), desired.getStatus())
                && Objects.equals(current.getReason(), desired.getReason())
                && Objects.equals(current.getMessage(), desired.getMessage())) {
            return current;
        }

        return desired;
    }
}
