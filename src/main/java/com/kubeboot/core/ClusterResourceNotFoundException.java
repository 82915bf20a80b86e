package com.kubeboot.core;

/**
 * The requested object does not exist on the API server.
 */
public class ClusterResourceNotFoundException extends ClusterQueryException {

    public ClusterResourceNotFoundException(String message) {
        super(message);
    }

    @Override
    public int getStatusCode() {
        return 404;
    }
}
