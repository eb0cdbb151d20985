package io.vecbench.core.benchmark;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.vecbench.core.model.Measurement;
import java.util.List;

public record NamespaceMeasurements(
    @JsonProperty("namespace") String namespace,
    @JsonProperty("measurements") List<Measurement> measurements
) {
    public NamespaceMeasurements {
        measurements = List.copyOf(measurements);
    }
}
