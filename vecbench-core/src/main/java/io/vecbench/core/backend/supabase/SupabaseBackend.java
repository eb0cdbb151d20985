package io.vecbench.core.backend.supabase;

import io.vecbench.core.backend.BackendType;
import io.vecbench.core.backend.VectorBackend;
import io.vecbench.core.backend.VectorNamespace;
import io.vecbench.core.backend.http.BackendHttpClient;
import io.vecbench.core.config.model.SupabaseConfig;
import io.vecbench.core.namespace.NamespaceCatalog;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Supabase pgvector through PostgREST. Tables and match functions need elevated privileges to
 * create, so {@link #ensureNamespace(String)} only logs the SQL from {@link SupabaseSchema}.
 */
public final class SupabaseBackend implements VectorBackend {
    private static final Logger LOG = LoggerFactory.getLogger(SupabaseBackend.class);

    private final HttpUrl restBase;
    private final BackendHttpClient http;
    private final Map<String, String> headers;

    public SupabaseBackend(SupabaseConfig config, BackendHttpClient http) {
        Objects.requireNonNull(config, "config must not be null");
        if (config.url() == null || config.url().isBlank()) {
            throw new IllegalArgumentException("Supabase URL is required (SUPABASE_URL)");
        }
        if (config.anonKey() == null || config.anonKey().isBlank()) {
            throw new IllegalArgumentException("Supabase anon key is required (SUPABASE_ANON_KEY)");
        }
        this.restBase = HttpUrl.get(config.url()).newBuilder().addPathSegments("rest/v1").build();
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.headers = Map.of("apikey", config.anonKey(), "Authorization", "Bearer " + config.anonKey());
    }

    @Override
    public String name() {
        return BackendType.SUPABASE.id();
    }

    @Override
    public VectorNamespace namespace(String name) {
        return new SupabaseNamespace(SupabaseSchema.tableName(name), restBase, http, headers);
    }

    @Override
    public void ensureNamespace(String name) {
        int dimensions = NamespaceCatalog.dimensions(name);
        LOG.info(
            "Ensure the following SQL has been run in your Supabase project:\n\n{}",
            SupabaseSchema.extensionSql() + "\n\n" + SupabaseSchema.namespaceSql(name, dimensions)
        );
    }
}
