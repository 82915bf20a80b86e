package com.kubeboot.core;

/**
 * Applying or reverting the etcd unsafe non-HA override failed.
 */
public class EtcdPatchException extends ClusterClientException {
    private final EtcdOverride override;

    public EtcdPatchException(EtcdOverride override, Throwable cause) {
        super(override.getFailureMessage(), cause);
        this.override = override;
    }

    /** The transition that was being applied. */
    public EtcdOverride getOverride() {
        return override;
    }
}
