package io.vecbench.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BenchConfig(
    BackendsConfig backends,
    BenchmarkSettings benchmark
) {

    public static BenchConfig defaults() {
        return new BenchConfig(
            BackendsConfig.defaults(),
            BenchmarkSettings.defaults()
        );
    }
}
