package com.kubeboot.core;

/**
 * Thrown when a {@link ClusterConnection} cannot be built. Never retried.
 */
public class ClusterConfigException extends ClusterClientException {

    /** Connection construction stage that failed. */
    public enum Stage {
        LOAD_KUBECONFIG("loading kubeconfig"),
        CREATE_CORE_CLIENT("creating a Kubernetes client"),
        CREATE_OPERATOR_CLIENT("creating a Kubernetes client"),
        CREATE_CSR_CLIENT("creating a Kubernetes client");

        private final String description;

        Stage(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final Stage stage;

    public ClusterConfigException(Stage stage, Throwable cause) {
        super(stage.getDescription(), cause);
        this.stage = stage;
    }

    public ClusterConfigException(Stage stage, String message) {
        super(stage.getDescription() + ": " + message);
        this.stage = stage;
    }

    public Stage getStage() {
        return stage;
    }
}
