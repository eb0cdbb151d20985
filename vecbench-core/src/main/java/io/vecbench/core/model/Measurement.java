package io.vecbench.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Measurement(
    @JsonProperty("latency_ms") double latencyMs,
    @JsonProperty("success") boolean success,
    @JsonProperty("error_kind") String errorKind
) {

    public static Measurement success(double latencyMs) {
        return new Measurement(latencyMs, true, null);
    }

    public static Measurement failure(double latencyMs, Throwable error) {
        return new Measurement(latencyMs, false, error.getClass().getSimpleName());
    }
}
