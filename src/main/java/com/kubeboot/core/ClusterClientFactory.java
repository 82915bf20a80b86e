package com.kubeboot.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Creates {@link ClusterClient} instances using configuration from system
 * properties, environment variables and an optional properties file.
 */
public class ClusterClientFactory {
    private static final Logger log = LoggerFactory.getLogger(ClusterClientFactory.class);

    private final Path propsPath;
    private final ClusterClientBuilder builder;

    public ClusterClientFactory() {
        this(getDefaultPath());
    }

    public ClusterClientFactory(String path) {
        this(Paths.get(path));
    }

    public ClusterClientFactory(Path path) {
        this.propsPath = path;
        this.builder = configPath -> DefaultClusterClient.connect(configPath, getSettings());
    }

    /** Current settings; the properties file is re-read on every call. */
    public ClientSettings getSettings() {
        return ClientSettings.resolve(loadProps());
    }

    /** Returns a client for the configured {@code KUBECONFIG}. */
    public ClusterClient getClient() throws ClusterConfigException {
        String kubeconfig = getSettings().getKubeconfigPath();
        if (kubeconfig == null) {
            throw new ClusterConfigException(ClusterConfigException.Stage.LOAD_KUBECONFIG, "KUBECONFIG is not set");
        }
        return getClient(kubeconfig);
    }

    /** Returns a client for an explicit kubeconfig path, other settings as configured. */
    public ClusterClient getClient(String kubeconfigPath) throws ClusterConfigException {
        if (!Metrics.init()) {
            log.warn("Could not register metrics MBean");
        }
        return builder.build(kubeconfigPath);
    }

    /** The builder this factory hands out clients with. */
    public ClusterClientBuilder getBuilder() {
        return builder;
    }

    private static Path getDefaultPath() {
        String p = System.getProperty("kubeboot.properties");
        if (p == null || p.isEmpty()) {
            p = System.getenv("KUBEBOOT_PROPERTIES");
        }
        if (p == null || p.isEmpty()) {
            p = "kubeboot.properties";
        }
        return Paths.get(p);
    }

    private Properties loadProps() {
        Properties p = new Properties();
        if (Files.exists(propsPath)) {
            try (var in = Files.newInputStream(propsPath)) {
                p.load(in);
            } catch (IOException e) {
                log.warn("Could not read {}, using defaults: {}", propsPath, e.getMessage());
            }
        }
        return p;
    }
}
