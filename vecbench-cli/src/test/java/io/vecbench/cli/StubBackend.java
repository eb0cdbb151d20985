package io.vecbench.cli;

import io.vecbench.core.backend.BackendException;
import io.vecbench.core.backend.NamespaceNotFoundException;
import io.vecbench.core.backend.NamespaceStats;
import io.vecbench.core.backend.QueryResult;
import io.vecbench.core.backend.RecallProbe;
import io.vecbench.core.backend.RecallProbeResult;
import io.vecbench.core.backend.VectorBackend;
import io.vecbench.core.backend.VectorNamespace;
import io.vecbench.core.backend.VectorRecord;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Backend for command tests. Namespaces that were never stored answer 404.
 */
final class StubBackend implements VectorBackend {
    private final Map<String, StubNamespace> namespaces = new HashMap<>();
    private final boolean withRecallProbe;
    final List<String> deleted = Collections.synchronizedList(new ArrayList<>());

    StubBackend(boolean withRecallProbe) {
        this.withRecallProbe = withRecallProbe;
    }

    StubBackend store(String namespace, long rows, QueryResult document) {
        namespaces.put(namespace, new StubNamespace(namespace, rows, document));
        return this;
    }

    @Override
    public String name() {
        return "stub";
    }

    @Override
    public VectorNamespace namespace(String name) {
        return namespaces.getOrDefault(name, new StubNamespace(name, -1, null));
    }

    @Override
    public void ensureNamespace(String name) {
        namespaces.putIfAbsent(name, new StubNamespace(name, 0, null));
    }

    @Override
    public Optional<RecallProbe> recallProbe() {
        if (!withRecallProbe) {
            return Optional.empty();
        }
        return Optional.of((namespace, num, topK) -> new RecallProbeResult(topK == 1 ? 1.0 : 0.95, topK, topK));
    }

    final class StubNamespace implements VectorNamespace {
        private final String name;
        private final long rows;
        private final QueryResult document;

        StubNamespace(String name, long rows, QueryResult document) {
            this.name = name;
            this.rows = rows;
            this.document = document;
        }

        @Override
        public void upsert(List<VectorRecord> records, boolean isFirstBatch) {
        }

        @Override
        public List<QueryResult> query(float[] vector, int topK, boolean includeVector) throws IOException {
            requireExists();
            if (document == null) {
                return List.of();
            }
            if (document.vector().length != vector.length) {
                throw new BackendException(400, "dimension mismatch");
            }
            return List.of(document);
        }

        @Override
        public Optional<QueryResult> fetchById(String id) throws IOException {
            requireExists();
            return document != null && document.id().equals(id) ? Optional.of(document) : Optional.empty();
        }

        @Override
        public NamespaceStats stats() throws IOException {
            requireExists();
            return new NamespaceStats(rows);
        }

        @Override
        public void deleteAll() throws IOException {
            requireExists();
            deleted.add(name);
        }

        private void requireExists() throws NamespaceNotFoundException {
            if (rows < 0) {
                throw new NamespaceNotFoundException(name + " not found");
            }
        }
    }
}
