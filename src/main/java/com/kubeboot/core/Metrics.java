package com.kubeboot.core;

import javax.management.MBeanServer;
import javax.management.ObjectName;
import java.lang.management.ManagementFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts API calls made through {@link DefaultClusterClient} and exposes them via JMX.
 */
public final class Metrics implements MetricsMBean {
    private static final Metrics INSTANCE = new Metrics();

    private final AtomicInteger successCount = new AtomicInteger();
    private final AtomicInteger failureCount = new AtomicInteger();
    private final AtomicInteger approvedCsrCount = new AtomicInteger();
    private final AtomicBoolean etcdOverrideActive = new AtomicBoolean();

    private Metrics() {}

    public static Metrics getInstance() {
        return INSTANCE;
    }

    /**
     * Registers the Metrics MBean with the platform MBean server if not already registered.
     * Returns false when registration was refused.
     */
    public static boolean init() {
        try {
            MBeanServer server = ManagementFactory.getPlatformMBeanServer();
            ObjectName name = new ObjectName("com.kubeboot.core:type=Metrics");
            if (!server.isRegistered(name)) {
                server.registerMBean(INSTANCE, name);
            }
            return true;
        } catch (Exception e) {
            return false;
        }
    }

    public void recordSuccess() {
        successCount.incrementAndGet();
    }

    public void recordFailure() {
        failureCount.incrementAndGet();
    }

    public void recordApproval() {
        approvedCsrCount.incrementAndGet();
    }

    public void recordEtcdOverride(EtcdOverride override) {
        etcdOverrideActive.set(override == EtcdOverride.ENABLED);
    }

    @Override
    public int getSuccessCount() {
        return successCount.get();
    }

    @Override
    public int getFailureCount() {
        return failureCount.get();
    }

    @Override
    public int getApprovedCsrCount() {
        return approvedCsrCount.get();
    }

    @Override
    public boolean isEtcdOverrideActive() {
        return etcdOverrideActive.get();
    }

    static void reset() {
        INSTANCE.successCount.set(0);
        INSTANCE.failureCount.set(0);
        INSTANCE.approvedCsrCount.set(0);
        INSTANCE.etcdOverrideActive.set(false);
    }
}
