package io.vecbench.core.benchmark;

import io.vecbench.core.backend.VectorBackend;
import io.vecbench.core.backend.VectorNamespace;
import io.vecbench.core.model.Measurement;
import io.vecbench.core.namespace.NamespaceCatalog;
import io.vecbench.core.report.BenchmarkArtifact;
import io.vecbench.core.report.ResultWriter;
import io.vecbench.core.retry.RetryListener;
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
 * Sequential single-query latency per namespace. Namespaces that cannot be sampled are skipped;
 * a permanent error while warming up or measuring aborts the whole run.
 */
public final class LatencyBenchmark {
    private static final Logger LOG = LoggerFactory.getLogger(LatencyBenchmark.class);

    private final VectorBackend backend;
    private final BenchmarkRuntime runtime;
    private final SampleVectorProbe probe;

    public LatencyBenchmark(VectorBackend backend, BenchmarkRuntime runtime) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
        this.probe = new SampleVectorProbe(runtime);
    }

    public BenchmarkResult<LatencySummary> run(LatencyOptions options) throws IOException {
        ProgressListener progress = runtime.progress();
        progress.line("Single-Query Latency Benchmark");
        progress.line("Backend: " + backend.name() + ", queries per namespace: " + options.numQueries()
            + ", top_k: " + options.topK() + ", warmup: " + options.warmupQueries());

        List<LatencySummary> summaries = new ArrayList<>();
        List<NamespaceMeasurements> raw = new ArrayList<>();
        for (String namespace : options.namespaces()) {
            VectorNamespace target = backend.namespace(namespace);
            Optional<float[]> sample = probe.sample(namespace, target, NamespaceCatalog.dimensions(namespace));
            if (sample.isEmpty()) {
                progress.line("  " + namespace + ": Skipped (no data or can't get vector)");
                continue;
            }
            float[] vector = sample.get();
            progress.line("  " + namespace + " (" + vector.length + "d): Running " + options.numQueries() + " queries...");

            List<Measurement> measurements = measure(namespace, target, vector, options);
            List<Double> latencies = measurements.stream().map(Measurement::latencyMs).toList();
            LatencySummary summary = LatencySummary.of(backend.name(), namespace, vector.length, latencies);
            progress.line(String.format(
                "    Mean: %.0fms, Median: %.0fms, P95: %.0fms",
                summary.meanMs(), summary.medianMs(), summary.p95Ms()
            ));
            summaries.add(summary);
            raw.add(new NamespaceMeasurements(namespace, measurements));
        }
        summaries.sort(Comparator.comparingDouble(LatencySummary::medianMs));

        Instant at = runtime.resultWriter().now();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("timestamp", ResultWriter.isoTimestamp(at));
        metadata.put("backend", backend.name());
        metadata.put("benchmark", "latency");
        metadata.put("namespaces", options.namespaces());
        metadata.put("num_queries", options.numQueries());
        metadata.put("top_k", options.topK());
        metadata.put("warmup_queries", options.warmupQueries());
        metadata.put("delay_ms", options.delayMs());

        Path output = runtime.resultWriter().resolve(options.output(), "latency-benchmark-" + backend.name(), at);
        runtime.resultWriter().write(output, new BenchmarkArtifact(metadata, raw, summaries));
        return new BenchmarkResult<>(summaries, output);
    }

    private List<Measurement> measure(String namespace, VectorNamespace target, float[] vector, LatencyOptions options) throws IOException {
        RetryListener onRetry = retryListener(namespace);
        for (int i = 0; i < options.warmupQueries(); i++) {
            runtime.retryExecutor().execute(() -> target.query(vector, options.topK(), false), runtime.retryPolicy(), onRetry);
        }

        List<Measurement> measurements = new ArrayList<>(options.numQueries());
        for (int i = 0; i < options.numQueries(); i++) {
            double latencyMs = runtime.retryExecutor().execute(() -> {
                long start = System.nanoTime();
                target.query(vector, options.topK(), false);
                return (System.nanoTime() - start) / 1_000_000.0;
            }, runtime.retryPolicy(), onRetry);
            measurements.add(Measurement.success(latencyMs));
            progress(namespace, i + 1, options.numQueries());
            if (options.delayMs() > 0 && i < options.numQueries() - 1) {
                runtime.sleeper().sleep(options.delayMs());
            }
        }
        return measurements;
    }

    private void progress(String namespace, int done, int total) {
        runtime.progress().status("    " + namespace + ": " + done + "/" + total);
    }

    private RetryListener retryListener(String namespace) {
        return (attempt, maxRetries, delayMs, error) -> {
            LOG.warn("{}: {} retry {}/{} in {}ms", namespace, error.getMessage(), attempt, maxRetries, delayMs);
            runtime.progress().status("    " + namespace + ": retry " + attempt + "/" + maxRetries);
        };
    }
}
