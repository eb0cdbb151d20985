package io.vecbench.core.benchmark;

import io.vecbench.core.namespace.NamespaceCatalog;
import java.nio.file.Path;
import java.util.List;

/**
 * Settings for a sequential latency run. An empty namespace list means every catalog namespace;
 * a null output means a timestamped file in the data directory.
 */
public record LatencyOptions(
    List<String> namespaces,
    int numQueries,
    int topK,
    int warmupQueries,
    long delayMs,
    Path output
) {
    public static final int DEFAULT_NUM_QUERIES = 50;
    public static final int DEFAULT_TOP_K = 10;
    public static final int DEFAULT_WARMUP_QUERIES = 5;
    public static final long DEFAULT_DELAY_MS = 50;

    public LatencyOptions {
        namespaces = NamespaceCatalog.resolve(namespaces);
        if (numQueries <= 0) {
            throw new IllegalArgumentException("numQueries must be > 0");
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be > 0");
        }
        if (warmupQueries < 0) {
            throw new IllegalArgumentException("warmupQueries must be >= 0");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be >= 0");
        }
    }

    public static LatencyOptions defaults() {
        return new LatencyOptions(List.of(), DEFAULT_NUM_QUERIES, DEFAULT_TOP_K, DEFAULT_WARMUP_QUERIES, DEFAULT_DELAY_MS, null);
    }
}
