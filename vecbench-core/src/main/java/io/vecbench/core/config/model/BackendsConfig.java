package io.vecbench.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BackendsConfig(
    TurbopufferConfig tpuf,
    PineconeConfig pinecone,
    SupabaseConfig supabase
) {

    public static BackendsConfig defaults() {
        return new BackendsConfig(
            TurbopufferConfig.defaults(),
            PineconeConfig.defaults(),
            SupabaseConfig.defaults()
        );
    }

    /**
     * Fills blank credentials from environment variables; values in the config file win.
     */
    public BackendsConfig withEnvironment(Map<String, String> env) {
        return new BackendsConfig(
            new TurbopufferConfig(
                pick(tpuf.apiKey(), env, "TURBOPUFFER_API_KEY"),
                pick(tpuf.region(), env, "TURBOPUFFER_REGION"),
                tpuf.apiBase()
            ),
            new PineconeConfig(
                pick(pinecone.apiKey(), env, "PINECONE_API_KEY"),
                pinecone.controlPlaneUrl(),
                pick(pinecone.region(), env, "PINECONE_REGION"),
                pinecone.cloud()
            ),
            new SupabaseConfig(
                pick(supabase.url(), env, "SUPABASE_URL"),
                pick(supabase.anonKey(), env, "SUPABASE_ANON_KEY")
            )
        );
    }

    private static String pick(String configured, Map<String, String> env, String key) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        String value = env.get(key);
        return value == null || value.isBlank() ? configured : value.trim();
    }
}
