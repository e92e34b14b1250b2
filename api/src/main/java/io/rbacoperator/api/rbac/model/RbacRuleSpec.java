/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.api.rbac.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.io.Serializable;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Desired state of the RbacRule
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"bindings", "startTime", "endTime", "createServiceAccounts"})
@EqualsAndHashCode
@ToString
public class RbacRuleSpec implements Serializable {
    private static final long serialVersionUID = 1L;

    private List<Binding> bindings = new ArrayList<>();
    private String startTime;
    private String endTime;
    private Boolean createServiceAccounts;

    /**
     * @return  The bindings in declaration order
     */
    public List<Binding> getBindings() {
        return bindings;
    }

    public void setBindings(List<Binding> bindings) {
        this.bindings = bindings;
    }

    /**
     * @return  RFC 3339 timestamp from which the rule is active. Null means the rule is active right away.
     */
    public String getStartTime() {
        return startTime;
    }

    public void setStartTime(String startTime) {
        this.startTime = startTime;
    }

    /**
     * @return  RFC 3339 timestamp at which the rule is deleted. Null means the rule is never deleted automatically.
     */
    public String getEndTime() {
        return endTime;
    }

    public void setEndTime(String endTime) {
        this.endTime = endTime;
    }

    /**
     * @return  Whether the ServiceAccount subjects should be created. Null is treated as true.
     */
    public Boolean getCreateServiceAccounts() {
        return createServiceAccounts;
    }

    public void setCreateServiceAccounts(Boolean createServiceAccounts) {
        this.createServiceAccounts = createServiceAccounts;
    }

    /**
     * @return  True unless the creation of the ServiceAccounts was explicitly disabled
     */
    @JsonIgnore
    public boolean shouldCreateServiceAccounts() {
        return createServiceAccounts == null || createServiceAccounts;
    }

    /**
     * @return  The start time as an Instant or null when not set
     *
     * @throws java.time.format.DateTimeParseException  When the start time is not a valid RFC 3339 timestamp
     */
    @JsonIgnore
    public Instant startInstant() {
        return toInstant(startTime);
    }

    /**
     * @return  The end time as an Instant or null when not set
     *
     * @throws java.time.format.DateTimeParseException  When the end time is not a valid RFC 3339 timestamp
     */
    @JsonIgnore
    public Instant endInstant() {
        return toInstant(endTime);
    }

    private static Instant toInstant(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return null;
        }

        return OffsetDateTime.parse(timestamp).toInstant();
    }
}
