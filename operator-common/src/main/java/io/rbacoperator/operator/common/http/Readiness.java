/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.common.http;

/**
 * A readiness check implemented by the operator and called by the {@link HealthCheckAndMetricsServer} when handling
 * a readiness check request.
 */
public interface Readiness {
    /**
     * Invoked on the HTTP request handling thread, so excessive blocking should be avoided.
     *
     * @return  True when the application is ready, false otherwise.
     */
    boolean isReady();
}
