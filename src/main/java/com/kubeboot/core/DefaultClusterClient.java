package com.kubeboot.core;

import com.kubeboot.ops.CommandExecutionException;
import com.kubeboot.ops.HostOperations;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.NodeList;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.PodResource;
import io.kubernetes.client.custom.V1Patch;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.models.V1CertificateSigningRequest;
import io.kubernetes.client.openapi.models.V1CertificateSigningRequestList;
import io.kubernetes.client.util.PatchUtils;
import okhttp3.Call;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ClusterClient} backed by a {@link ClusterConnection}. Core resources
 * go through the fabric8 client; the etcd operator resource, CSRs and pod log
 * streams go through the official client.
 */
public class DefaultClusterClient implements ClusterClient {
    private static final Logger log = LoggerFactory.getLogger(DefaultClusterClient.class);

    private final ClusterConnection connection;
    private final RetryPolicy retryPolicy;
    private final AdminCommandBridge adminCommand;
    private final Clock clock;
    private final Metrics metrics = Metrics.getInstance();

    public DefaultClusterClient(ClusterConnection connection) {
        this(connection, ClientSettings.defaults());
    }

    public DefaultClusterClient(ClusterConnection connection, ClientSettings settings) {
        this(connection, settings, Clock.systemUTC());
    }

    public DefaultClusterClient(ClusterConnection connection, ClientSettings settings, Clock clock) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.retryPolicy = settings.getRetryPolicy();
        this.adminCommand = new AdminCommandBridge(settings.getAdminCommand());
        this.clock = clock;
    }

    /** Default {@link ClusterClientBuilder}. */
    public static ClusterClient connect(String configPath) throws ClusterConfigException {
        return connect(configPath, ClientSettings.defaults());
    }

    public static ClusterClient connect(String configPath, ClientSettings settings) throws ClusterConfigException {
        return new DefaultClusterClient(ClusterConnection.connect(configPath, settings), settings);
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    @Override
    public NodeList listNodes(NodeFilter filter) throws ClusterQueryException {
        Objects.requireNonNull(filter, "filter");
        KubernetesClient client = connection.coreClient();
        String roleLabel = filter.getRoleLabel();
        log.debug("Listing nodes ({})", filter);
        try {
            return remote("list nodes", () -> roleLabel == null
                    ? client.nodes().list()
                    : client.nodes().withLabel(roleLabel).list());
        } catch (Exception e) {
            log.error("Failed to list nodes ({})", filter, e);
            throw new ClusterQueryException("Failed to list nodes", e);
        }
    }

    @Override
    public void patchEtcd() throws EtcdPatchException {
        applyEtcdOverride(EtcdOverride.ENABLED);
    }

    @Override
    public void unPatchEtcd() throws EtcdPatchException {
        applyEtcdOverride(EtcdOverride.DISABLED);
    }

    private void applyEtcdOverride(EtcdOverride override) throws EtcdPatchException {
        log.info(override.getAction());
        Object result;
        try {
            result = remote(override.getAction(), () -> PatchUtils.patch(Object.class,
                    () -> connection.operatorApi()
                            .patchClusterCustomObject(EtcdOverride.GROUP, EtcdOverride.VERSION, EtcdOverride.PLURAL,
                                    EtcdOverride.RESOURCE_NAME, new V1Patch(override.getPatch()))
                            .buildCall(null),
                    V1Patch.PATCH_FORMAT_JSON_MERGE_PATCH,
                    connection.operatorClient()));
        } catch (Exception e) {
            log.error(override.getFailureMessage(), e);
            throw new EtcdPatchException(override, e);
        }
        metrics.recordEtcdOverride(override);
        log.info("etcd {} unsupportedConfigOverrides is now {}", EtcdOverride.RESOURCE_NAME, unsupportedOverrides(result));
    }

    static Object unsupportedOverrides(Object etcd) {
        if (!(etcd instanceof Map<?, ?> resource)) {
            return null;
        }
        Object spec = resource.get("spec");
        return spec instanceof Map<?, ?> m ? m.get("unsupportedConfigOverrides") : null;
    }

    @Override
    public String runAdminCommand(List<String> args, String kubeconfigPath, HostOperations ops) throws CommandExecutionException {
        return adminCommand.run(args, kubeconfigPath, ops);
    }

    @Override
    public V1CertificateSigningRequestList listCsrs() throws ClusterQueryException {
        try {
            return remote("list csrs", () -> connection.certificatesApi().listCertificateSigningRequest().execute());
        } catch (Exception e) {
            log.error("Failed to get list of csrs", e);
            throw new ClusterQueryException("Failed to list csrs", e);
        }
    }

    @Override
    public void approveCsr(V1CertificateSigningRequest csr) throws CsrApprovalException {
        Objects.requireNonNull(csr, "csr");
        final String name = csr.getMetadata() != null ? csr.getMetadata().getName() : null;
        if (name == null || name.isEmpty()) {
            throw new CsrApprovalException("<unnamed>", new IllegalArgumentException("csr has no metadata.name"));
        }
        if (CsrApproval.isApproved(csr)) {
            log.info("csr {} already has an Approved condition, submitting approval again", name);
        }
        log.info("Approving csr {}", name);
        V1CertificateSigningRequest approval = CsrApproval.withApproval(csr, clock);
        try {
            remote("approve csr " + name, () -> connection.certificatesApi()
                    .replaceCertificateSigningRequestApproval(name, approval)
                    .execute());
        } catch (Exception e) {
            log.error("Failed to approve csr {}", name, e);
            throw new CsrApprovalException(name, e);
        }
        metrics.recordApproval();
    }

    @Override
    public ConfigMap getConfigMap(String namespace, String name) throws ClusterQueryException {
        ConfigMap cm;
        try {
            cm = remote("get configmap", () -> connection.coreClient().configMaps()
                    .inNamespace(namespace)
                    .withName(name)
                    .get());
        } catch (Exception e) {
            log.error("Failed to get configmap {}/{}", namespace, name, e);
            throw new ClusterQueryException("Failed to get configmap " + namespace + "/" + name, e);
        }
        if (cm == null) {
            log.error("Configmap {}/{} not found", namespace, name);
            throw new ClusterResourceNotFoundException("Configmap " + namespace + "/" + name + " not found");
        }
        return cm;
    }

    @Override
    public String getPodLogs(String namespace, String podName, long sinceSeconds) throws ClusterQueryException {
        Integer since = sinceSeconds > 0 ? (int) Math.min(sinceSeconds, Integer.MAX_VALUE) : null;
        log.debug("Reading logs of pod {}/{} (sinceSeconds={})", namespace, podName, since);
        try {
            return remote("get pod logs", () -> readLogs(namespace, podName, since));
        } catch (Exception e) {
            log.error("Failed to get logs of pod {}/{}", namespace, podName, e);
            throw new ClusterQueryException("Failed to get logs of pod " + namespace + "/" + podName, e);
        }
    }

    private String readLogs(String namespace, String podName, Integer sinceSeconds) throws ApiException, IOException {
        Call call = connection.coreApi()
                .readNamespacedPodLog(podName, namespace)
                .sinceSeconds(sinceSeconds)
                .buildCall(null);
        try (Response response = call.execute()) {
            if (!response.isSuccessful()) {
                throw new ApiException(response.code(), "reading logs of pod " + namespace + "/" + podName
                        + " returned HTTP " + response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                return "";
            }
            ByteArrayOutputStream buf = new ByteArrayOutputStream();
            body.byteStream().transferTo(buf);
            return buf.toString(StandardCharsets.UTF_8);
        }
    }

    @Override
    public List<Pod> getPods(String namespace, Map<String, String> labelMatch) throws ClusterQueryException {
        String selector = LabelSelectors.format(labelMatch);
        log.debug("Listing pods in {} (selector={})", namespace, selector);
        try {
            return remote("list pods", () -> {
                NonNamespaceOperation<Pod, PodList, PodResource> pods = connection.coreClient().pods().inNamespace(namespace);
                PodList list = selector == null ? pods.list() : pods.withLabelSelector(selector).list();
                return list.getItems();
            });
        } catch (Exception e) {
            log.error("Failed to list pods in {}", namespace, e);
            throw new ClusterQueryException("Failed to list pods in " + namespace, e);
        }
    }

    @Override
    public void close() {
        connection.close();
    }

    private <T> T remote(String operation, RetryPolicy.Call<T> call) throws Exception {
        try {
            T result = retryPolicy.execute(operation, call);
            metrics.recordSuccess();
            return result;
        } catch (Exception e) {
            metrics.recordFailure();
            throw e;
        }
    }
}
