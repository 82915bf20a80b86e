package com.kubeboot.core;

import io.fabric8.kubernetes.client.KubernetesClientException;
import io.kubernetes.client.openapi.ApiException;

/**
 * Base class of every failure reported by {@link ClusterClient}.
 */
public class ClusterClientException extends Exception {
    private final int statusCode;

    public ClusterClientException(String message) {
        super(message);
        this.statusCode = 0;
    }

    public ClusterClientException(String message, Throwable cause) {
        super(message + ": " + describe(cause), cause);
        this.statusCode = statusOf(cause);
    }

    /** HTTP status returned by the API server, or 0 when the failure did not come from a response. */
    public int getStatusCode() {
        return statusCode;
    }

    static int statusOf(Throwable t) {
        if (t instanceof KubernetesClientException kce) {
            return kce.getCode();
        }
        if (t instanceof ApiException ae) {
            return ae.getCode();
        }
        if (t instanceof ClusterClientException cce) {
            return cce.getStatusCode();
        }
        return 0;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
