package io.vecbench.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BenchmarkSettings(
    @JsonAlias({"data_dir"}) String dataDir,
    @JsonAlias({"http_timeout_seconds"}) int httpTimeoutSeconds,
    @JsonAlias({"max_retries"}) int maxRetries,
    @JsonAlias({"retry_base_delay_ms"}) long retryBaseDelayMs
) {

    public static BenchmarkSettings defaults() {
        return new BenchmarkSettings("data", 60, 3, 1000);
    }
}
