package com.kubeboot.core;

import java.time.Duration;
import java.util.Properties;

/**
 * Settings for building a {@link DefaultClusterClient}. Values are resolved
 * from system properties, then environment variables, then an optional
 * properties file, then built-in defaults.
 */
public final class ClientSettings {
    public static final String DEFAULT_ADMIN_COMMAND = "oc";

    private final String kubeconfigPath;
    private final String adminCommand;
    private final RetryPolicy retryPolicy;
    private final int requestTimeoutMillis;

    public ClientSettings(String kubeconfigPath, String adminCommand, RetryPolicy retryPolicy, int requestTimeoutMillis) {
        this.kubeconfigPath = kubeconfigPath;
        this.adminCommand = adminCommand == null || adminCommand.isEmpty() ? DEFAULT_ADMIN_COMMAND : adminCommand;
        this.retryPolicy = retryPolicy == null ? RetryPolicy.none() : retryPolicy;
        this.requestTimeoutMillis = Math.max(0, requestTimeoutMillis);
    }

    /** No kubeconfig, {@code oc}, no retries, client default timeouts. */
    public static ClientSettings defaults() {
        return new ClientSettings(null, DEFAULT_ADMIN_COMMAND, RetryPolicy.none(), 0);
    }

    /** Resolves every setting, consulting {@code fileProps} after system properties and the environment. */
    public static ClientSettings resolve(Properties fileProps) {
        int attempts = parseInt(getConfig("RETRY_MAX_ATTEMPTS", null, fileProps), 1);
        long backoff = parseInt(getConfig("RETRY_BACKOFF_MILLIS", null, fileProps), 1000);
        return new ClientSettings(
                getConfig("KUBECONFIG", null, fileProps),
                getConfig("ADMIN_COMMAND", DEFAULT_ADMIN_COMMAND, fileProps),
                RetryPolicy.of(Math.max(1, attempts), Duration.ofMillis(Math.max(0, backoff))),
                parseInt(getConfig("REQUEST_TIMEOUT_MILLIS", null, fileProps), 0));
    }

    public ClientSettings withKubeconfigPath(String path) {
        return new ClientSettings(path, adminCommand, retryPolicy, requestTimeoutMillis);
    }

    public ClientSettings withRetryPolicy(RetryPolicy policy) {
        return new ClientSettings(kubeconfigPath, adminCommand, policy, requestTimeoutMillis);
    }

    public String getKubeconfigPath() {
        return kubeconfigPath;
    }

    public String getAdminCommand() {
        return adminCommand;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    /** 0 keeps the HTTP client's own default. */
    public int getRequestTimeoutMillis() {
        return requestTimeoutMillis;
    }

    static String getConfig(String key, String def, Properties fileProps) {
        String v = System.getProperty(key);
        if (v == null || v.isEmpty()) {
            v = System.getenv(key);
        }
        if ((v == null || v.isEmpty()) && fileProps != null) {
            v = fileProps.getProperty(key);
        }
        return v == null || v.isEmpty() ? def : v;
    }

    private static int parseInt(String v, int def) {
        if (v == null || v.isEmpty()) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }
}
