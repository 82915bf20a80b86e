package com.kubeboot.core;

import com.kubeboot.ops.CommandExecutionException;
import com.kubeboot.ops.HostOperations;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.NodeList;
import io.fabric8.kubernetes.api.model.Pod;
import io.kubernetes.client.openapi.models.V1CertificateSigningRequest;
import io.kubernetes.client.openapi.models.V1CertificateSigningRequestList;

import java.util.List;
import java.util.Map;

/**
 * Operations the bootstrap controller performs against a cluster that is
 * still being installed. Every call is synchronous and reads live state;
 * nothing is cached.
 */
public interface ClusterClient extends AutoCloseable {

    /** Lists nodes, optionally only those carrying the master role label. */
    NodeList listNodes(NodeFilter filter) throws ClusterQueryException;

    default NodeList listNodes() throws ClusterQueryException {
        return listNodes(NodeFilter.ALL);
    }

    default NodeList listMasterNodes() throws ClusterQueryException {
        return listNodes(NodeFilter.MASTER_ROLE_ONLY);
    }

    /** Applies the unsafe non-HA override to the etcd operator. */
    void patchEtcd() throws EtcdPatchException;

    /** Removes the unsafe non-HA override from the etcd operator. */
    void unPatchEtcd() throws EtcdPatchException;

    /**
     * Runs the cluster administration tool with {@code --kubeconfig=<path>}
     * prepended to {@code args}. Execution failures are thrown as produced
     * by {@code ops}.
     */
    String runAdminCommand(List<String> args, String kubeconfigPath, HostOperations ops) throws CommandExecutionException;

    /**
     * Approves {@code csr}, which must come from a recent {@link #listCsrs()}.
     * Conflicting updates are reported, not resolved.
     */
    void approveCsr(V1CertificateSigningRequest csr) throws CsrApprovalException;

    V1CertificateSigningRequestList listCsrs() throws ClusterQueryException;

    ConfigMap getConfigMap(String namespace, String name) throws ClusterQueryException;

    /** Returns logs of the pod; a non-positive {@code sinceSeconds} means no time bound. */
    String getPodLogs(String namespace, String podName, long sinceSeconds) throws ClusterQueryException;

    /** Lists pods, restricted to those matching every entry of {@code labelMatch} when given. */
    List<Pod> getPods(String namespace, Map<String, String> labelMatch) throws ClusterQueryException;

    @Override
    void close();
}
