package com.kubeboot.core;

/**
 * Creates a {@link ClusterClient} for a kubeconfig path. Lets callers swap in
 * a fake client.
 */
@FunctionalInterface
public interface ClusterClientBuilder {
    ClusterClient build(String configPath) throws ClusterConfigException;
}
