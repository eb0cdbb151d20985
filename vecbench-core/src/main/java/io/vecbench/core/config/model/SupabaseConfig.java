package io.vecbench.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SupabaseConfig(
    @JsonAlias({"url"}) String url,
    @JsonAlias({"anon_key"}) String anonKey
) {

    public static SupabaseConfig defaults() {
        return new SupabaseConfig("", "");
    }

    public boolean configured() {
        return url != null && !url.isBlank() && anonKey != null && !anonKey.isBlank();
    }
}
