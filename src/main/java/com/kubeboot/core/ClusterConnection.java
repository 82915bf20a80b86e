package com.kubeboot.core;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.apis.CertificatesV1Api;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.apis.CustomObjectsApi;
import io.kubernetes.client.util.ClientBuilder;
import io.kubernetes.client.util.KubeConfig;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Authenticated access to the API server derived from one bootstrap
 * kubeconfig. Holds the general resource client, the etcd operator resource
 * client and the CSR client. Either fully built or not returned at all.
 */
public final class ClusterConnection implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ClusterConnection.class);

    private final KubernetesClient coreClient;
    private final ApiClient operatorClient;
    private final ApiClient csrClient;
    private final CustomObjectsApi operatorApi;
    private final CertificatesV1Api certificatesApi;
    private final CoreV1Api coreApi;

    private ClusterConnection(KubernetesClient coreClient, ApiClient operatorClient, ApiClient csrClient) {
        this.coreClient = coreClient;
        this.operatorClient = operatorClient;
        this.csrClient = csrClient;
        this.operatorApi = new CustomObjectsApi(operatorClient);
        this.certificatesApi = new CertificatesV1Api(csrClient);
        this.coreApi = new CoreV1Api(csrClient);
    }

    public static ClusterConnection connect(String configPath) throws ClusterConfigException {
        return connect(configPath, ClientSettings.defaults());
    }

    /**
     * Builds every client from the kubeconfig at {@code configPath}. A failure
     * at any stage releases what was already built and is reported with the
     * failing {@link ClusterConfigException.Stage}.
     */
    public static ClusterConnection connect(String configPath, ClientSettings settings) throws ClusterConfigException {
        if (configPath == null || configPath.isEmpty()) {
            throw new ClusterConfigException(ClusterConfigException.Stage.LOAD_KUBECONFIG, "no kubeconfig path given");
        }
        Path path;
        Config config;
        try {
            path = Path.of(configPath);
            String contents = Files.readString(path);
            config = Config.fromKubeconfig(null, contents, configPath);
        } catch (IOException | RuntimeException e) {
            throw new ClusterConfigException(ClusterConfigException.Stage.LOAD_KUBECONFIG, e);
        }
        // retries are owned by RetryPolicy
        config.setRequestRetryBackoffLimit(0);
        int timeout = settings.getRequestTimeoutMillis();
        if (timeout > 0) {
            config.setRequestTimeout(timeout);
        }

        KubernetesClient client;
        try {
            client = new KubernetesClientBuilder().withConfig(config).build();
        } catch (RuntimeException e) {
            throw new ClusterConfigException(ClusterConfigException.Stage.CREATE_CORE_CLIENT, e);
        }

        ApiClient operatorClient;
        try {
            operatorClient = officialClient(path, timeout);
        } catch (IOException | RuntimeException e) {
            client.close();
            throw new ClusterConfigException(ClusterConfigException.Stage.CREATE_OPERATOR_CLIENT, e);
        }

        ApiClient csrClient;
        try {
            csrClient = officialClient(path, timeout);
        } catch (IOException | RuntimeException e) {
            release(operatorClient);
            client.close();
            throw new ClusterConfigException(ClusterConfigException.Stage.CREATE_CSR_CLIENT, e);
        }

        log.info("Connected to cluster at {}", config.getMasterUrl());
        return new ClusterConnection(client, operatorClient, csrClient);
    }

    private static ApiClient officialClient(Path path, int timeout) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            KubeConfig kubeConfig = KubeConfig.loadKubeConfig(reader);
            kubeConfig.setFile(path.toFile());
            ApiClient apiClient = ClientBuilder.kubeconfig(kubeConfig).build();
            if (timeout > 0) {
                apiClient.setReadTimeout(timeout);
            }
            return apiClient;
        }
    }

    private static void release(ApiClient apiClient) {
        OkHttpClient http = apiClient.getHttpClient();
        http.dispatcher().executorService().shutdown();
        http.connectionPool().evictAll();
    }

    public String getMasterUrl() {
        return coreClient.getConfiguration().getMasterUrl();
    }

    KubernetesClient coreClient() {
        return coreClient;
    }

    ApiClient operatorClient() {
        return operatorClient;
    }

    CustomObjectsApi operatorApi() {
        return operatorApi;
    }

    CertificatesV1Api certificatesApi() {
        return certificatesApi;
    }

    CoreV1Api coreApi() {
        return coreApi;
    }

    List<ApiClient> officialClients() {
        return List.of(operatorClient, csrClient);
    }

    @Override
    public void close() {
        release(operatorClient);
        release(csrClient);
        coreClient.close();
    }
}
