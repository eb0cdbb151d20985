package io.vecbench.core.benchmark;

import io.vecbench.core.backend.VectorBackend;
import io.vecbench.core.backend.VectorNamespace;
import io.vecbench.core.namespace.NamespaceCatalog;
import io.vecbench.core.pool.ConcurrencyPool;
import io.vecbench.core.pool.PoolResult;
import io.vecbench.core.report.BenchmarkArtifact;
import io.vecbench.core.report.ResultWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Queries per second under a fixed number of concurrent workers. Failed queries are counted as
 * errors and left out of the latency figures; they are not retried.
 */
public final class ThroughputBenchmark {
    private static final Logger LOG = LoggerFactory.getLogger(ThroughputBenchmark.class);

    private final VectorBackend backend;
    private final BenchmarkRuntime runtime;
    private final SampleVectorProbe probe;

    public ThroughputBenchmark(VectorBackend backend, BenchmarkRuntime runtime) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
        this.probe = new SampleVectorProbe(runtime);
    }

    public BenchmarkResult<ThroughputSummary> run(ThroughputOptions options) throws IOException {
        ProgressListener progress = runtime.progress();
        progress.line("Throughput Benchmark (QPS under load)");
        progress.line("Backend: " + backend.name() + ", total queries: " + options.totalQueries()
            + ", concurrency: " + options.concurrency() + ", top_k: " + options.topK()
            + ", warmup: " + options.warmupQueries());

        ConcurrencyPool pool = new ConcurrencyPool(options.concurrency());
        List<ThroughputSummary> summaries = new ArrayList<>();
        List<NamespaceMeasurements> raw = new ArrayList<>();
        for (String namespace : options.namespaces()) {
            VectorNamespace target = backend.namespace(namespace);
            Optional<float[]> sample = probe.sample(namespace, target, NamespaceCatalog.dimensions(namespace));
            if (sample.isEmpty()) {
                progress.line("  " + namespace + ": Skipped (no data or can't get vector)");
                continue;
            }
            float[] vector = sample.get();
            progress.line("  " + namespace + " (" + vector.length + "d): Running " + options.totalQueries()
                + " queries with concurrency " + options.concurrency() + "...");

            progress.status("    Warming up (" + options.warmupQueries() + " queries)...");
            for (int i = 0; i < options.warmupQueries(); i++) {
                runtime.retryExecutor().execute(
                    () -> target.query(vector, options.topK(), false),
                    runtime.retryPolicy(),
                    (attempt, maxRetries, delayMs, error) ->
                        LOG.warn("{}: warmup retry {}/{} in {}ms: {}", namespace, attempt, maxRetries, delayMs, error.getMessage())
                );
            }

            PoolResult result = pool.run(options.totalQueries(), index -> target.query(vector, options.topK(), false));
            if (result.errors() > 0) {
                LOG.warn("{}: {} of {} queries failed", namespace, result.errors(), options.totalQueries());
            }
            ThroughputSummary summary = ThroughputSummary.of(backend.name(), namespace, vector.length, options.concurrency(), result);
            progress.line(String.format(
                "    QPS: %.1f, Avg latency: %.0fms, P95: %.0fms, Errors: %d",
                summary.qps(), summary.avgLatencyMs(), summary.p95LatencyMs(), summary.errors()
            ));
            summaries.add(summary);
            raw.add(new NamespaceMeasurements(namespace, result.measurements()));
        }
        summaries.sort(Comparator.comparingDouble(ThroughputSummary::qps).reversed());

        Instant at = runtime.resultWriter().now();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("timestamp", ResultWriter.isoTimestamp(at));
        metadata.put("backend", backend.name());
        metadata.put("benchmark", "throughput");
        metadata.put("namespaces", options.namespaces());
        metadata.put("total_queries", options.totalQueries());
        metadata.put("top_k", options.topK());
        metadata.put("concurrency", options.concurrency());
        metadata.put("warmup_queries", options.warmupQueries());

        Path output = runtime.resultWriter().resolve(options.output(), "throughput-benchmark-" + backend.name(), at);
        runtime.resultWriter().write(output, new BenchmarkArtifact(metadata, raw, summaries));
        return new BenchmarkResult<>(summaries, output);
    }
}
