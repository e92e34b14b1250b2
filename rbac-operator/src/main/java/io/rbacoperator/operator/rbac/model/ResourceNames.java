/*
 * Copyright RBAC Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.rbacoperator.operator.rbac.model;

import io.rbacoperator.operator.common.Util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Generates the names of the RoleBindings and ClusterRoleBindings created for an RbacRule. The names are a
 * deterministic function of the rule name, binding name, kind of the generated resource and the role name.
 */
public class ResourceNames {
    /**
     * Kind token used for RoleBindings of Roles
     */
    public static final String ROLE = "role";

    /**
     * Kind token used for RoleBindings of ClusterRoles
     */
    public static final String CLUSTER_ROLE = "clusterrole";

    /**
     * Kind token used for ClusterRoleBindings
     */
    public static final String CLUSTER_ROLE_BINDING = "crb";

    /**
     * Maximal length of a Kubernetes resource name
     */
    public static final int MAX_NAME_LENGTH = 253;

    private static final Pattern PLAIN_SEGMENT = Pattern.compile("[a-z0-9]([a-z0-9.-]*[a-z0-9])?");

    private ResourceNames() { }

    /**
     * @param ruleName      Name of the RbacRule
     * @param bindingName   Name of the binding
     * @param role          Name of the Role
     *
     * @return  Name of the RoleBinding which binds the Role
     */
    public static String roleBindingForRole(String ruleName, String bindingName, String role) {
        return name(ruleName, bindingName, ROLE, role);
    }

    /**
     * @param ruleName      Name of the RbacRule
     * @param bindingName   Name of the binding
     * @param clusterRole   Name of the ClusterRole
     *
     * @return  Name of the RoleBinding which binds the ClusterRole in a namespace
     */
    public static String roleBindingForClusterRole(String ruleName, String bindingName, String clusterRole) {
        return name(ruleName, bindingName, CLUSTER_ROLE, clusterRole);
    }

    /**
     * @param ruleName      Name of the RbacRule
     * @param bindingName   Name of the binding
     * @param clusterRole   Name of the ClusterRole
     *
     * @return  Name of the ClusterRoleBinding
     */
    public static String clusterRoleBinding(String ruleName, String bindingName, String clusterRole) {
        return name(ruleName, bindingName, CLUSTER_ROLE_BINDING, clusterRole);
    }

    /**
     * Builds the name from its parts. When the binding name has no dash, both the binding and the role name are valid
     * in resource names as they are and the result fits into 253 characters, the name is just the parts joined with
     * dashes. Otherwise, the parts are lower cased, the characters which are not allowed in resource names are
     * replaced with dashes and a hash of the original parts is appended. Names over 253 characters are shortened
     * before the hash. Two different parts of the same rule therefore never give the same name.
     *
     * @param ruleName      Name of the RbacRule
     * @param bindingName   Name of the binding
     * @param kind          Kind token
     * @param roleName      Name of the role
     *
     * @return  Name of the generated resource
     */
    static String name(String ruleName, String bindingName, String kind, String roleName) {
        String binding = nullToEmpty(bindingName);
        String role = nullToEmpty(roleName);
        String name = String.join("-", nullToEmpty(ruleName), binding, kind, role);

        if (isPlainSegment(binding) && !binding.contains("-") && isPlainSegment(role) && name.length() <= MAX_NAME_LENGTH) {
            return name;
        }

        String hash = Util.hashStub(kind + "/" + binding.length() + "/" + binding + "/" + role);
        String sanitized = trimSeparators(name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9.-]", "-"));

        if (sanitized.length() > MAX_NAME_LENGTH - hash.length() - 1) {
            sanitized = trimSeparators(sanitized.substring(0, MAX_NAME_LENGTH - hash.length() - 1));
        }

        return sanitized.isEmpty() ? hash : sanitized + "-" + hash;
    }

    /**
     * @return  True when the segment is non-empty and can be used in a resource name without any changes
     */
    private static boolean isPlainSegment(String segment) {
        return PLAIN_SEGMENT.matcher(segment).matches();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private static String trimSeparators(String name) {
        int start = 0;
        int end = name.length();

        while (start < end && !Character.isLetterOrDigit(name.charAt(start))) {
            start++;
        }

        while (end > start && !Character.isLetterOrDigit(name.charAt(end - 1))) {
            end--;
        }

        return name.substring(start, end);
    }
}
