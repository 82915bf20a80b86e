package com.kubeboot.core;

import io.kubernetes.client.openapi.models.V1CertificateSigningRequest;
import io.kubernetes.client.openapi.models.V1CertificateSigningRequestCondition;
import io.kubernetes.client.openapi.models.V1CertificateSigningRequestStatus;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * The condition appended to a certificate signing request when it is approved.
 */
public final class CsrApproval {
    public static final String TYPE = "Approved";
    public static final String STATUS = "True";
    public static final String REASON = "NodeCSRApprove";
    public static final String MESSAGE = "This CSR was approved by the assisted-installer-controller";

    private CsrApproval() {}

    /** Builds the approval condition stamped with the current time of {@code clock}. */
    public static V1CertificateSigningRequestCondition condition(Clock clock) {
        return new V1CertificateSigningRequestCondition()
                .type(TYPE)
                .status(STATUS)
                .reason(REASON)
                .message(MESSAGE)
                .lastUpdateTime(OffsetDateTime.now(clock));
    }

    /**
     * Returns a copy of {@code csr} whose conditions are the existing ones
     * followed by the approval condition. {@code csr} itself is left
     * untouched, so a failed submit can be repeated with the same object.
     */
    public static V1CertificateSigningRequest withApproval(V1CertificateSigningRequest csr, Clock clock) {
        V1CertificateSigningRequestStatus current = csr.getStatus();
        List<V1CertificateSigningRequestCondition> conditions = new ArrayList<>();
        V1CertificateSigningRequestStatus status = new V1CertificateSigningRequestStatus();
        if (current != null) {
            status.setCertificate(current.getCertificate());
            if (current.getConditions() != null) {
                conditions.addAll(current.getConditions());
            }
        }
        conditions.add(condition(clock));
        status.setConditions(conditions);
        return new V1CertificateSigningRequest()
                .apiVersion(csr.getApiVersion())
                .kind(csr.getKind())
                .metadata(csr.getMetadata())
                .spec(csr.getSpec())
                .status(status);
    }

    /** True when {@code csr} already carries an Approved condition. */
    public static boolean isApproved(V1CertificateSigningRequest csr) {
        if (csr.getStatus() == null || csr.getStatus().getConditions() == null) {
            return false;
        }
        return csr.getStatus().getConditions().stream().anyMatch(c -> TYPE.equals(c.getType()));
    }
}
