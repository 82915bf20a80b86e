package com.kubeboot.core;

/**
 * A read against the API server failed.
 */
public class ClusterQueryException extends ClusterClientException {

    public ClusterQueryException(String message) {
        super(message);
    }

    public ClusterQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
