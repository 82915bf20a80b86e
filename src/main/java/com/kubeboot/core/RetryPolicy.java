package com.kubeboot.core;

import io.fabric8.kubernetes.client.KubernetesClientException;
import io.kubernetes.client.openapi.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Set;

/**
 * How often a remote call is attempted before its failure is handed to the
 * caller. Only transient failures (I/O errors, 429 and 5xx gateway/server
 * errors) are retried; a 409 conflict never is since the caller has to
 * re-fetch the object first.
 */
public final class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);
    private static final Set<Integer> TRANSIENT_CODES = Set.of(429, 500, 502, 503, 504);
    private static final RetryPolicy NONE = new RetryPolicy(1, Duration.ZERO);

    /** A remote call. */
    @FunctionalInterface
    public interface Call<T> {
        T run() throws Exception;
    }

    private final int maxAttempts;
    private final Duration backoff;

    private RetryPolicy(int maxAttempts, Duration backoff) {
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
    }

    /** Single attempt, failures go straight to the caller. */
    public static RetryPolicy none() {
        return NONE;
    }

    public static RetryPolicy of(int maxAttempts, Duration backoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        if (backoff == null || backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must be zero or positive");
        }
        return maxAttempts == 1 ? NONE : new RetryPolicy(maxAttempts, backoff);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getBackoff() {
        return backoff;
    }

    /**
     * Runs {@code call}, retrying transient failures. The last failure is
     * rethrown unchanged.
     */
    public <T> T execute(String operation, Call<T> call) throws Exception {
        int attempt = 1;
        while (true) {
            try {
                return call.run();
            } catch (Exception e) {
                if (attempt >= maxAttempts || !isTransient(e)) {
                    throw e;
                }
                log.warn("{} failed (attempt {}/{}), retrying in {} ms: {}",
                        operation, attempt, maxAttempts, backoff.toMillis(), e.getMessage());
                sleep();
                attempt++;
            }
        }
    }

    /** True for failures worth another attempt. */
    public static boolean isTransient(Throwable t) {
        if (t instanceof KubernetesClientException kce) {
            int code = kce.getCode();
            return code <= 0 ? kce.getCause() instanceof IOException : TRANSIENT_CODES.contains(code);
        }
        if (t instanceof ApiException ae) {
            int code = ae.getCode();
            return code == 0 || TRANSIENT_CODES.contains(code);
        }
        if (t instanceof ClusterClientException cce) {
            return TRANSIENT_CODES.contains(cce.getStatusCode());
        }
        return t instanceof IOException;
    }

    private void sleep() throws InterruptedException {
        if (backoff.isZero()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts + ", backoff=" + backoff + '}';
    }
}
