package com.kubeboot.core;

/**
 * The two states of the unsupported unsafe non-HA override on the singleton
 * {@code etcds/cluster} operator resource. Each constant carries the JSON
 * merge patch that moves the resource into that state.
 */
public enum EtcdOverride {
    ENABLED("Patching etcd", "Failed to patch etcd",
            "{\"spec\":{\"unsupportedConfigOverrides\":{\"useUnsupportedUnsafeNonHANonProductionUnstableEtcd\":true}}}"),
    DISABLED("UnPatching etcd", "Failed to unpatch etcd",
            "{\"spec\":{\"unsupportedConfigOverrides\":null}}");

    public static final String RESOURCE_NAME = "cluster";
    public static final String OVERRIDE_FLAG = "useUnsupportedUnsafeNonHANonProductionUnstableEtcd";

    /** operator.openshift.io/v1 Etcd, cluster scoped. */
    public static final String GROUP = "operator.openshift.io";
    public static final String VERSION = "v1";
    public static final String PLURAL = "etcds";

    private final String action;
    private final String failureMessage;
    private final String patch;

    EtcdOverride(String action, String failureMessage, String patch) {
        this.action = action;
        this.failureMessage = failureMessage;
        this.patch = patch;
    }

    /** Log line emitted before the patch is sent. */
    public String getAction() {
        return action;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    /** Merge patch body, sent as {@code application/merge-patch+json}. */
    public String getPatch() {
        return patch;
    }
}
