package com.kubeboot.core;

/**
 * The API server rejected a CSR approval, typically because of a version
 * conflict or missing permission. Callers re-list and retry.
 */
public class CsrApprovalException extends ClusterClientException {
    private final String csrName;

    public CsrApprovalException(String csrName, Throwable cause) {
        super("Failed to approve csr " + csrName, cause);
        this.csrName = csrName;
    }

    public String getCsrName() {
        return csrName;
    }

    public boolean isConflict() {
        return getStatusCode() == 409;
    }
}
