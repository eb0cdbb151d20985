package io.vecbench.core.benchmark;

import io.vecbench.core.backend.NamespaceStats;
import io.vecbench.core.backend.QueryResult;
import io.vecbench.core.backend.VectorNamespace;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds a real stored vector to query with: checks the namespace has rows, then takes the
 * nearest neighbour of a random unit vector. Any failure means the namespace is skipped.
 */
final class SampleVectorProbe {
    private static final Logger LOG = LoggerFactory.getLogger(SampleVectorProbe.class);

    private final BenchmarkRuntime runtime;

    SampleVectorProbe(BenchmarkRuntime runtime) {
        this.runtime = runtime;
    }

    Optional<float[]> sample(String namespace, VectorNamespace target, int dimensions) throws InterruptedIOException {
        try {
            NamespaceStats stats = runtime.retryExecutor().execute(target::stats, runtime.retryPolicy());
            if (stats.approxRowCount() <= 0) {
                LOG.info("{}: skipped, namespace is empty", namespace);
                return Optional.empty();
            }
            float[] probe = runtime.vectors().unitVector(dimensions);
            List<QueryResult> hits = runtime.retryExecutor().execute(
                () -> target.query(probe, 1, true),
                runtime.retryPolicy()
            );
            if (hits.isEmpty() || !hits.get(0).hasVector()) {
                LOG.info("{}: skipped, no stored vector returned", namespace);
                return Optional.empty();
            }
            return Optional.of(hits.get(0).vector());
        } catch (SocketTimeoutException e) {
            LOG.warn("{}: skipped, timed out sampling a vector: {}", namespace, e.getMessage());
            return Optional.empty();
        } catch (InterruptedIOException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            LOG.warn("{}: skipped, could not sample a vector: {}", namespace, e.getMessage());
            return Optional.empty();
        }
    }
}
