package com.kubeboot.core;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Helpers for building equality based label selectors.
 */
public final class LabelSelectors {
    private LabelSelectors() {}

    /**
     * Formats {@code labels} as {@code k1=v1,k2=v2}. Keys are sorted so the
     * same map always yields the same string. Returns {@code null} for a
     * null or empty map, meaning "no selector".
     */
    public static String format(Map<String, String> labels) {
        if (labels == null || labels.isEmpty()) {
            return null;
        }
        return new TreeMap<>(labels).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(","));
    }
}
