package io.vecbench.core.benchmark;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.vecbench.core.pool.PoolResult;
import io.vecbench.core.stats.StatsAggregator;
import java.util.List;

/**
 * Throughput of one namespace. {@code totalQueries} counts attempted queries; latency figures
 * cover successful queries only and are 0 when none succeeded.
 */
public record ThroughputSummary(
    @JsonProperty("backend") String backend,
    @JsonProperty("namespace") String namespace,
    @JsonProperty("dimensions") int dimensions,
    @JsonProperty("concurrency") int concurrency,
    @JsonProperty("total_queries") int totalQueries,
    @JsonProperty("successful_queries") int successfulQueries,
    @JsonProperty("errors") int errors,
    @JsonProperty("duration_seconds") double durationSeconds,
    @JsonProperty("qps") double qps,
    @JsonProperty("avg_latency_ms") double avgLatencyMs,
    @JsonProperty("p50_latency_ms") double p50LatencyMs,
    @JsonProperty("p95_latency_ms") double p95LatencyMs,
    @JsonProperty("p99_latency_ms") double p99LatencyMs
) {

    static ThroughputSummary of(String backend, String namespace, int dimensions, int concurrency, PoolResult result) {
        List<Double> latencies = result.successLatencies();
        double seconds = result.durationSeconds();
        boolean any = !latencies.isEmpty();
        return new ThroughputSummary(
            backend,
            namespace,
            dimensions,
            concurrency,
            result.successes() + result.errors(),
            result.successes(),
            result.errors(),
            seconds,
            seconds > 0 ? result.successes() / seconds : 0.0,
            any ? StatsAggregator.mean(latencies) : 0.0,
            any ? StatsAggregator.percentile(latencies, 50) : 0.0,
            any ? StatsAggregator.percentile(latencies, 95) : 0.0,
            any ? StatsAggregator.percentile(latencies, 99) : 0.0
        );
    }
}
