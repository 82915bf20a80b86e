package com.kubeboot.core;

/**
 * JMX view of the bootstrap client's activity.
 */
public interface MetricsMBean {
    int getSuccessCount();
    int getFailureCount();
    int getApprovedCsrCount();
    boolean isEtcdOverrideActive();
}
