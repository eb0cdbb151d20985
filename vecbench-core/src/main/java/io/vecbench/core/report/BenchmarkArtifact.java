package io.vecbench.core.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The JSON document written once at the end of a benchmark run.
 */
public record BenchmarkArtifact(
    @JsonProperty("metadata") Map<String, Object> metadata,
    @JsonProperty("raw_measurements") List<?> rawMeasurements,
    @JsonProperty("summaries") List<?> summaries
) {
    public BenchmarkArtifact {
        metadata = metadata == null ? Map.of() : new LinkedHashMap<>(metadata);
        rawMeasurements = rawMeasurements == null ? List.of() : List.copyOf(rawMeasurements);
        summaries = summaries == null ? List.of() : List.copyOf(summaries);
    }
}
