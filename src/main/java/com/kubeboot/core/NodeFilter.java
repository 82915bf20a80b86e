package com.kubeboot.core;

/**
 * Which nodes {@link ClusterClient#listNodes(NodeFilter)} returns.
 */
public enum NodeFilter {
    ALL(null),
    MASTER_ROLE_ONLY("node-role.kubernetes.io/master");

    private final String roleLabel;

    NodeFilter(String roleLabel) {
        this.roleLabel = roleLabel;
    }

    /** Label whose presence selects the nodes, or {@code null} for no filtering. */
    public String getRoleLabel() {
        return roleLabel;
    }
}
