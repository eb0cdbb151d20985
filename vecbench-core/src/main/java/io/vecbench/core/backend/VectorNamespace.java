package io.vecbench.core.backend;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface VectorNamespace {
    void upsert(List<VectorRecord> records, boolean isFirstBatch) throws IOException;

    List<QueryResult> query(float[] vector, int topK, boolean includeVector) throws IOException;

    Optional<QueryResult> fetchById(String id) throws IOException;

    NamespaceStats stats() throws IOException;

    void deleteAll() throws IOException;
}
