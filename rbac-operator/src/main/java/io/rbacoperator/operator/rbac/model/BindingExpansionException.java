/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.rbac.model;

/**
 * Thrown when a binding cannot be expanded into the Kubernetes RBAC resources. Only the affected binding is skipped.
 */
public class BindingExpansionException extends Exception {
    private static final long serialVersionUID = 1L;

    private final String bindingName;

    /**
     * Constructor
     *
     * @param bindingName   Name of the binding which failed to expand
     * @param cause         The selector problem
     */
    public BindingExpansionException(String bindingName, SelectorException cause) {
        super("Binding " + bindingName + " cannot be expanded: " + cause.getMessage(), cause);
        this.bindingName = bindingName;
    }

    /**
     * Constructor
     *
     * @param bindingName   Name of the binding which failed to expand
     * @param reason        Why the binding cannot be expanded
     */
    public BindingExpansionException(String bindingName, String reason) {
        super("Binding " + bindingName + " cannot be expanded: " + reason);
        this.bindingName = bindingName;
    }

    /**
     * @return  Name of the binding which failed to expand
     */
    public String getBindingName() {
        return bindingName;
    }
}
