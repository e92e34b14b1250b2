/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.common.controller;

import io.rbacoperator.operator.common.Reconciliation;

import java.util.Objects;

/**
 * This simplified class is used in the work queue instead of the regular Reconciliation class. Its equals method
 * ignores the trigger so that the same resource is never queued twice. It doesn't request the reconciliation ID
 * until the reconciliation really starts, which keeps the IDs linear.
 */
public class SimplifiedReconciliation {
    final String kind;
    final String namespace;
    final String name;
    final String trigger;

    /**
     * SimplifiedReconciliation constructor with default (watch) trigger
     *
     * @param kind      Kind of the resource
     * @param namespace Namespace of the resource or null for cluster scoped resources
     * @param name      Name of the resource
     */
    public SimplifiedReconciliation(String kind, String namespace, String name) {
        this(kind, namespace, name, "watch");
    }

    /**
     * SimplifiedReconciliation constructor with custom trigger
     *
     * @param kind      Kind of the resource
     * @param namespace Namespace of the resource or null for cluster scoped resources
     * @param name      Name of the resource
     * @param trigger   Type of the trigger
     */
    public SimplifiedReconciliation(String kind, String namespace, String name, String trigger) {
        this.kind = kind;
        this.namespace = namespace;
        this.name = name;
        this.trigger = trigger;
    }

    /**
     * @param newTrigger    The new trigger
     *
     * @return  Reconciliation of the same resource with a different trigger
     */
    public SimplifiedReconciliation withTrigger(String newTrigger) {
        return new SimplifiedReconciliation(kind, namespace, name, newTrigger);
    }

    /**
     * Converts the simplified reconciliation to a proper reconciliation
     *
     * @return Reconciliation object
     */
    public Reconciliation toReconciliation() {
        return new Reconciliation(trigger, kind, namespace, name);
    }

    /**
     * Generates a lock name for this reconciliation and its resource. The lock name consists of the kind, name and
     * namespace.
     *
     * @return Name of the lock which should be used for this resource
     */
    public String lockName() {
        return kind + "::" + namespace + "::" + name;
    }

    /**
     * @return  Name of the resource
     */
    public String name() {
        return name;
    }

    /**
     * @return  What triggered this reconciliation
     */
    public String trigger() {
        return trigger;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o == null || getClass() != o.getClass()) {
            return false;
        } else {
            SimplifiedReconciliation reconciliation = (SimplifiedReconciliation) o;

            return Objects.equals(this.kind, reconciliation.kind)
                    && Objects.equals(this.name, reconciliation.name)
                    && Objects.equals(this.namespace, reconciliation.namespace);
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, namespace, name);
    }

    @Override
    public String toString() {
        return kind + "(" + (namespace != null ? namespace + "/" : "/") + name + ")";
    }
}
