package io.vecbench.core.benchmark;

import io.vecbench.core.backend.NamespaceStats;
import io.vecbench.core.backend.QueryResult;
import io.vecbench.core.backend.RecallProbe;
import io.vecbench.core.backend.RecallProbeResult;
import io.vecbench.core.backend.VectorBackend;
import io.vecbench.core.backend.VectorNamespace;
import io.vecbench.core.backend.VectorRecord;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory backend for orchestrator tests. Failures are scripted per namespace.
 */
final class FakeVectorBackend implements VectorBackend {
    private final Map<String, FakeNamespace> namespaces = new ConcurrentHashMap<>();
    private final RecallProbe recallProbe;
    final List<String> ensured = Collections.synchronizedList(new ArrayList<>());

    FakeVectorBackend() {
        this(null);
    }

    FakeVectorBackend(RecallProbe recallProbe) {
        this.recallProbe = recallProbe;
    }

    FakeNamespace seed(String name, long rows, float[] vector) {
        FakeNamespace namespace = new FakeNamespace(rows, vector);
        namespaces.put(name, namespace);
        return namespace;
    }

    FakeNamespace get(String name) {
        return namespaces.computeIfAbsent(name, ignored -> new FakeNamespace(0, null));
    }

    @Override
    public String name() {
        return "fake";
    }

    @Override
    public VectorNamespace namespace(String name) {
        return get(name);
    }

    @Override
    public void ensureNamespace(String name) {
        ensured.add(name);
    }

    @Override
    public Optional<RecallProbe> recallProbe() {
        return Optional.ofNullable(recallProbe);
    }

    static final class FakeNamespace implements VectorNamespace {
        private final long rows;
        private final float[] vector;
        private final Deque<IOException> queryFailures = new ArrayDeque<>();
        final AtomicInteger queries = new AtomicInteger();
        final List<Integer> batchSizes = Collections.synchronizedList(new ArrayList<>());
        final List<Boolean> firstBatchFlags = Collections.synchronizedList(new ArrayList<>());
        final List<VectorRecord> upserted = Collections.synchronizedList(new ArrayList<>());
        volatile IOException statsFailure;
        volatile long queryDelayMs;
        volatile int failEveryNthQuery;

        FakeNamespace(long rows, float[] vector) {
            this.rows = rows;
            this.vector = vector;
        }

        synchronized void failNextQuery(IOException error) {
            queryFailures.add(error);
        }

        @Override
        public void upsert(List<VectorRecord> records, boolean isFirstBatch) {
            batchSizes.add(records.size());
            firstBatchFlags.add(isFirstBatch);
            upserted.addAll(records);
        }

        @Override
        public List<QueryResult> query(float[] query, int topK, boolean includeVector) throws IOException {
            int call = queries.incrementAndGet();
            IOException failure;
            synchronized (this) {
                failure = queryFailures.poll();
            }
            if (failure != null) {
                throw failure;
            }
            if (failEveryNthQuery > 0 && call % failEveryNthQuery == 0) {
                throw new IOException("scripted failure " + call);
            }
            if (queryDelayMs > 0) {
                try {
                    Thread.sleep(queryDelayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("interrupted", e);
                }
            }
            if (vector == null) {
                return List.of();
            }
            return List.of(new QueryResult("doc-1", 0.0, "Doc", "text", includeVector ? vector : null));
        }

        @Override
        public Optional<QueryResult> fetchById(String id) {
            return Optional.empty();
        }

        @Override
        public NamespaceStats stats() throws IOException {
            if (statsFailure != null) {
                throw statsFailure;
            }
            return new NamespaceStats(rows);
        }

        @Override
        public void deleteAll() {
        }
    }

    /**
     * Recall probe that records each call and fails on the scripted call numbers.
     */
    static final class ScriptedRecallProbe implements RecallProbe {
        final List<String> calls = Collections.synchronizedList(new ArrayList<>());
        private final Map<Integer, IOException> failures = new ConcurrentHashMap<>();

        void failOnCall(int callNumber, IOException error) {
            failures.put(callNumber, error);
        }

        @Override
        public RecallProbeResult recall(String namespace, int num, int topK) throws IOException {
            calls.add(namespace + ":" + topK);
            IOException failure = failures.remove(calls.size());
            if (failure != null) {
                throw failure;
            }
            double recall = 0.90 + (calls.size() % 5) / 100.0;
            return new RecallProbeResult(recall, topK * 1.5, 10_000);
        }
    }
}
