package io.vecbench.core.benchmark;

import io.vecbench.core.namespace.NamespaceCatalog;
import java.nio.file.Path;
import java.util.List;

public record ThroughputOptions(
    List<String> namespaces,
    int totalQueries,
    int topK,
    int concurrency,
    int warmupQueries,
    Path output
) {
    public static final int DEFAULT_TOTAL_QUERIES = 500;
    public static final int DEFAULT_TOP_K = 10;
    public static final int DEFAULT_CONCURRENCY = 10;
    public static final int DEFAULT_WARMUP_QUERIES = 20;

    public ThroughputOptions {
        namespaces = NamespaceCatalog.resolve(namespaces);
        if (totalQueries <= 0) {
            throw new IllegalArgumentException("totalQueries must be > 0");
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be > 0");
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be > 0");
        }
        if (warmupQueries < 0) {
            throw new IllegalArgumentException("warmupQueries must be >= 0");
        }
    }

    public static ThroughputOptions defaults() {
        return new ThroughputOptions(
            List.of(),
            DEFAULT_TOTAL_QUERIES,
            DEFAULT_TOP_K,
            DEFAULT_CONCURRENCY,
            DEFAULT_WARMUP_QUERIES,
            null
        );
    }
}
