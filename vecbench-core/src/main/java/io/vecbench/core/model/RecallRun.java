package io.vecbench.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public record RecallRun(
    @JsonProperty("namespace") String namespace,
    @JsonProperty("top_k") int topK,
    @JsonProperty("run") int run,
    @JsonProperty("avg_recall") double avgRecall,
    @JsonProperty("avg_ann_count") double avgAnnCount,
    @JsonProperty("avg_exhaustive_count") double avgExhaustiveCount,
    @JsonProperty("latency_ms") double latencyMs
) {

    public static String configKey(String namespace, int topK) {
        return namespace + ":" + topK;
    }

    @JsonIgnore
    public String configKey() {
        return configKey(namespace, topK);
    }
}
