package io.vecbench.core.benchmark;

import io.vecbench.core.namespace.NamespaceCatalog;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for a recall sweep over namespaces x topK values. {@code runs} must be at least 2 so
 * every configuration has a sample standard deviation.
 */
public record RecallOptions(
    List<String> namespaces,
    List<Integer> topKValues,
    int num,
    int runs,
    long delayMs,
    Path output
) {
    public static final List<Integer> DEFAULT_TOP_K_VALUES = List.of(1, 5, 10, 20, 50, 100);
    public static final int DEFAULT_NUM = 20;
    public static final int DEFAULT_RUNS = 20;
    public static final long DEFAULT_DELAY_MS = 150;

    public RecallOptions {
        namespaces = NamespaceCatalog.resolve(namespaces);
        topKValues = normalizeTopK(topKValues);
        if (num <= 0) {
            throw new IllegalArgumentException("num must be > 0");
        }
        if (runs < 2) {
            throw new IllegalArgumentException("runs must be >= 2");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be >= 0");
        }
    }

    public static RecallOptions defaults() {
        return new RecallOptions(List.of(), DEFAULT_TOP_K_VALUES, DEFAULT_NUM, DEFAULT_RUNS, DEFAULT_DELAY_MS, null);
    }

    public int totalConfigs() {
        return namespaces.size() * topKValues.size();
    }

    public int totalCalls() {
        return totalConfigs() * runs;
    }

    private static List<Integer> normalizeTopK(List<Integer> requested) {
        if (requested == null || requested.isEmpty()) {
            return DEFAULT_TOP_K_VALUES;
        }
        List<Integer> values = new ArrayList<>();
        for (Integer topK : requested) {
            if (topK == null || topK <= 0) {
                throw new IllegalArgumentException("topK values must be > 0, got " + topK);
            }
            if (!values.contains(topK)) {
                values.add(topK);
            }
        }
        return List.copyOf(values);
    }
}
