package io.vecbench.core.benchmark;

import io.vecbench.core.namespace.NamespaceCatalog;
import java.nio.file.Path;

public record UpsertOptions(String namespace, int totalRecords, int batchSize, Path output) {
    public static final int DEFAULT_TOTAL_RECORDS = 10_000;
    public static final int DEFAULT_BATCH_SIZE = 256;

    public UpsertOptions {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace is required");
        }
        namespace = namespace.trim();
        NamespaceCatalog.dimensions(namespace);
        if (totalRecords <= 0) {
            throw new IllegalArgumentException("totalRecords must be > 0");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
    }

    public static UpsertOptions defaults(String namespace) {
        return new UpsertOptions(namespace, DEFAULT_TOTAL_RECORDS, DEFAULT_BATCH_SIZE, null);
    }

    public int numBatches() {
        return (totalRecords + batchSize - 1) / batchSize;
    }
}
