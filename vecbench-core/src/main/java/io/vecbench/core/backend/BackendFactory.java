package io.vecbench.core.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vecbench.core.backend.http.BackendHttpClient;
import io.vecbench.core.backend.pinecone.PineconeBackend;
import io.vecbench.core.backend.supabase.SupabaseBackend;
import io.vecbench.core.backend.tpuf.TurbopufferBackend;
import io.vecbench.core.config.model.BackendsConfig;
import io.vecbench.core.config.model.BenchmarkSettings;
import io.vecbench.core.retry.Sleeper;
import java.time.Duration;
import java.util.Objects;
import okhttp3.OkHttpClient;

/**
 * Builds the backend for a {@link BackendType}. Missing credentials fail here with an
 * {@link IllegalArgumentException}, before any request is sent.
 */
public final class BackendFactory {
    private final BackendsConfig backends;
    private final BackendHttpClient http;
    private final Sleeper sleeper;

    public BackendFactory(BackendsConfig backends, BenchmarkSettings settings) {
        this(backends, new BackendHttpClient(httpClient(settings), new ObjectMapper()), Sleeper.SYSTEM);
    }

    public BackendFactory(BackendsConfig backends, BackendHttpClient http, Sleeper sleeper) {
        this.backends = Objects.requireNonNull(backends, "backends must not be null");
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    public VectorBackend create(BackendType type) {
        Objects.requireNonNull(type, "type must not be null");
        return switch (type) {
            case TURBOPUFFER -> new TurbopufferBackend(backends.tpuf(), http);
            case PINECONE -> new PineconeBackend(backends.pinecone(), http, sleeper);
            case SUPABASE -> new SupabaseBackend(backends.supabase(), http);
        };
    }

    static OkHttpClient httpClient(BenchmarkSettings settings) {
        int timeoutSeconds = settings == null || settings.httpTimeoutSeconds() <= 0 ? 60 : settings.httpTimeoutSeconds();
        return new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(timeoutSeconds))
            .writeTimeout(Duration.ofSeconds(timeoutSeconds))
            .build();
    }
}
