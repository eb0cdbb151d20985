package io.vecbench.core.benchmark;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.vecbench.core.stats.StatsAggregator;
import java.util.List;

public record UpsertSummary(
    @JsonProperty("backend") String backend,
    @JsonProperty("namespace") String namespace,
    @JsonProperty("dimensions") int dimensions,
    @JsonProperty("total_records") int totalRecords,
    @JsonProperty("batch_size") int batchSize,
    @JsonProperty("num_batches") int numBatches,
    @JsonProperty("duration_seconds") double durationSeconds,
    @JsonProperty("records_per_second") double recordsPerSecond,
    @JsonProperty("avg_batch_latency_ms") double avgBatchLatencyMs,
    @JsonProperty("p95_batch_latency_ms") double p95BatchLatencyMs
) {

    static UpsertSummary of(String backend, UpsertOptions options, int dimensions, double durationSeconds, List<Double> batchLatencies) {
        return new UpsertSummary(
            backend,
            options.namespace(),
            dimensions,
            options.totalRecords(),
            options.batchSize(),
            batchLatencies.size(),
            durationSeconds,
            durationSeconds > 0 ? options.totalRecords() / durationSeconds : 0.0,
            StatsAggregator.mean(batchLatencies),
            StatsAggregator.percentile(batchLatencies, 95)
        );
    }
}
