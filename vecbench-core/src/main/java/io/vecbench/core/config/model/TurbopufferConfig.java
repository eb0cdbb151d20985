package io.vecbench.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TurbopufferConfig(
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"region"}) String region,
    @JsonAlias({"api_base"}) String apiBase
) {

    public static TurbopufferConfig defaults() {
        return new TurbopufferConfig("", "", "");
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String resolvedApiBase() {
        if (apiBase != null && !apiBase.isBlank()) {
            return apiBase;
        }
        if (region != null && !region.isBlank()) {
            return "https://" + region.trim() + ".turbopuffer.com";
        }
        return "https://api.turbopuffer.com";
    }
}
