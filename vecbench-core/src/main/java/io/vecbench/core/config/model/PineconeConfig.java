package io.vecbench.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PineconeConfig(
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"control_plane_url"}) String controlPlaneUrl,
    @JsonAlias({"region"}) String region,
    @JsonAlias({"cloud"}) String cloud
) {

    public static PineconeConfig defaults() {
        return new PineconeConfig("", "https://api.pinecone.io", "us-east-1", "aws");
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
