package io.vecbench.core.benchmark;

import io.vecbench.core.backend.VectorBackend;
import io.vecbench.core.backend.VectorNamespace;
import io.vecbench.core.backend.VectorRecord;
import io.vecbench.core.model.Measurement;
import io.vecbench.core.namespace.NamespaceCatalog;
import io.vecbench.core.report.BenchmarkArtifact;
import io.vecbench.core.report.ResultWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write throughput: synthetic records upserted batch by batch. The records are left in place
 * afterwards; {@code delete} removes them.
 */
public final class UpsertBenchmark {
    private static final Logger LOG = LoggerFactory.getLogger(UpsertBenchmark.class);
    private static final int PROGRESS_EVERY = 10;

    private final VectorBackend backend;
    private final BenchmarkRuntime runtime;

    public UpsertBenchmark(VectorBackend backend, BenchmarkRuntime runtime) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
    }

    public BenchmarkResult<UpsertSummary> run(UpsertOptions options) throws IOException {
        ProgressListener progress = runtime.progress();
        String namespace = options.namespace();
        int dimensions = NamespaceCatalog.dimensions(namespace);
        progress.line("Upsert Benchmark (Write Performance)");
        progress.line("Backend: " + backend.name() + ", namespace: " + namespace + " (" + dimensions + "d), records: "
            + options.totalRecords() + ", batch size: " + options.batchSize());

        String idPrefix = "benchmark-" + runtime.clock().millis();
        List<VectorRecord> records = runtime.vectors().syntheticRecords(options.totalRecords(), dimensions, idPrefix);
        progress.line("Generated " + records.size() + " records");

        backend.ensureNamespace(namespace);
        VectorNamespace target = backend.namespace(namespace);

        int numBatches = options.numBatches();
        progress.line("Upserting in " + numBatches + " batches...");
        List<Measurement> measurements = new ArrayList<>(numBatches);
        long startedAt = System.nanoTime();
        for (int batchIndex = 0; batchIndex < numBatches; batchIndex++) {
            int from = batchIndex * options.batchSize();
            List<VectorRecord> batch = records.subList(from, Math.min(from + options.batchSize(), records.size()));
            boolean firstBatch = batchIndex == 0;
            int batchNumber = batchIndex + 1;

            double latencyMs = runtime.retryExecutor().execute(() -> {
                long start = System.nanoTime();
                target.upsert(batch, firstBatch);
                return (System.nanoTime() - start) / 1_000_000.0;
            }, runtime.retryPolicy(), (attempt, maxRetries, delayMs, error) ->
                LOG.warn("batch {}/{}: retry {}/{} in {}ms: {}", batchNumber, numBatches, attempt, maxRetries, delayMs, error.getMessage())
            );
            measurements.add(Measurement.success(latencyMs));

            if (batchNumber % PROGRESS_EVERY == 0 || batchNumber == numBatches) {
                double elapsedSeconds = (System.nanoTime() - startedAt) / 1_000_000_000.0;
                int written = from + batch.size();
                progress.status(String.format(
                    "  Batch %d/%d (%.1f%%) - %.0f records/sec",
                    batchNumber, numBatches, batchNumber * 100.0 / numBatches,
                    elapsedSeconds > 0 ? written / elapsedSeconds : 0.0
                ));
            }
        }
        double durationSeconds = (System.nanoTime() - startedAt) / 1_000_000_000.0;

        List<Double> batchLatencies = measurements.stream().map(Measurement::latencyMs).toList();
        UpsertSummary summary = UpsertSummary.of(backend.name(), options, dimensions, durationSeconds, batchLatencies);
        progress.line(String.format(
            "Total duration: %.2fs, records/second: %.1f, avg batch latency: %.0fms, P95 batch latency: %.0fms",
            summary.durationSeconds(), summary.recordsPerSecond(), summary.avgBatchLatencyMs(), summary.p95BatchLatencyMs()
        ));

        Instant at = runtime.resultWriter().now();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("timestamp", ResultWriter.isoTimestamp(at));
        metadata.put("backend", backend.name());
        metadata.put("benchmark", "upsert");
        metadata.put("namespace", namespace);
        metadata.put("dimensions", dimensions);
        metadata.put("total_records", options.totalRecords());
        metadata.put("batch_size", options.batchSize());

        Path output = runtime.resultWriter().resolve(
            options.output(),
            "upsert-benchmark-" + backend.name() + "-" + namespace,
            at
        );
        runtime.resultWriter().write(
            output,
            new BenchmarkArtifact(metadata, List.of(new NamespaceMeasurements(namespace, measurements)), List.of(summary))
        );
        return new BenchmarkResult<>(List.of(summary), output);
    }
}
