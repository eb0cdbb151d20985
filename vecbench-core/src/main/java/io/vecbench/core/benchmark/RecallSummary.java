package io.vecbench.core.benchmark;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.vecbench.core.model.RecallRun;
import io.vecbench.core.stats.ConfidenceInterval;
import io.vecbench.core.stats.StatsAggregator;
import java.util.List;

/**
 * Rollup of every run of one {@code (namespace, top_k)} configuration.
 */
public record RecallSummary(
    @JsonProperty("namespace") String namespace,
    @JsonProperty("top_k") int topK,
    @JsonProperty("runs") int runs,
    @JsonProperty("recall") RecallStats recall,
    @JsonProperty("avg_ann_count") MeanStd avgAnnCount,
    @JsonProperty("avg_exhaustive_count") MeanStd avgExhaustiveCount,
    @JsonProperty("latency_ms") LatencyStats latencyMs
) {

    public record RecallStats(
        @JsonProperty("mean") double mean,
        @JsonProperty("std") double std,
        @JsonProperty("ci95_lower") double ci95Lower,
        @JsonProperty("ci95_upper") double ci95Upper,
        @JsonProperty("min") double min,
        @JsonProperty("max") double max,
        @JsonProperty("median") double median
    ) {
    }

    public record MeanStd(@JsonProperty("mean") double mean, @JsonProperty("std") double std) {
    }

    public record LatencyStats(
        @JsonProperty("mean") double mean,
        @JsonProperty("std") double std,
        @JsonProperty("median") double median
    ) {
    }

    static RecallSummary of(String namespace, int topK, List<RecallRun> runs) {
        List<Double> recalls = runs.stream().map(RecallRun::avgRecall).toList();
        List<Double> annCounts = runs.stream().map(RecallRun::avgAnnCount).toList();
        List<Double> exhaustiveCounts = runs.stream().map(RecallRun::avgExhaustiveCount).toList();
        List<Double> latencies = runs.stream().map(RecallRun::latencyMs).toList();
        ConfidenceInterval ci = StatsAggregator.ci95(recalls);

        return new RecallSummary(
            namespace,
            topK,
            runs.size(),
            new RecallStats(
                StatsAggregator.mean(recalls),
                StatsAggregator.sampleStd(recalls),
                ci.lower(),
                ci.upper(),
                StatsAggregator.min(recalls),
                StatsAggregator.max(recalls),
                StatsAggregator.median(recalls)
            ),
            new MeanStd(StatsAggregator.mean(annCounts), StatsAggregator.sampleStd(annCounts)),
            new MeanStd(StatsAggregator.mean(exhaustiveCounts), StatsAggregator.sampleStd(exhaustiveCounts)),
            new LatencyStats(
                StatsAggregator.mean(latencies),
                StatsAggregator.sampleStd(latencies),
                StatsAggregator.median(latencies)
            )
        );
    }
}
