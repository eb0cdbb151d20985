package io.vecbench.core.benchmark;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.vecbench.core.stats.StatsAggregator;
import java.util.List;

public record LatencySummary(
    @JsonProperty("backend") String backend,
    @JsonProperty("namespace") String namespace,
    @JsonProperty("dimensions") int dimensions,
    @JsonProperty("queries") int queries,
    @JsonProperty("mean_ms") double meanMs,
    @JsonProperty("median_ms") double medianMs,
    @JsonProperty("p95_ms") double p95Ms,
    @JsonProperty("min_ms") double minMs,
    @JsonProperty("max_ms") double maxMs
) {

    static LatencySummary of(String backend, String namespace, int dimensions, List<Double> latencies) {
        return new LatencySummary(
            backend,
            namespace,
            dimensions,
            latencies.size(),
            StatsAggregator.mean(latencies),
            StatsAggregator.median(latencies),
            StatsAggregator.percentile(latencies, 95),
            StatsAggregator.min(latencies),
            StatsAggregator.max(latencies)
        );
    }
}
