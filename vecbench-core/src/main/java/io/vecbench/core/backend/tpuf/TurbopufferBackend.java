package io.vecbench.core.backend.tpuf;

import com.fasterxml.jackson.databind.JsonNode;
import io.vecbench.core.backend.BackendException;
import io.vecbench.core.backend.BackendType;
import io.vecbench.core.backend.RecallProbe;
import io.vecbench.core.backend.RecallProbeResult;
import io.vecbench.core.backend.VectorBackend;
import io.vecbench.core.backend.VectorNamespace;
import io.vecbench.core.backend.http.BackendHttpClient;
import io.vecbench.core.backend.http.BackendReply;
import io.vecbench.core.config.model.TurbopufferConfig;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import okhttp3.HttpUrl;

/**
 * Turbopuffer REST client. Namespaces are created implicitly by the first write, and the
 * {@code _debug/recall} endpoint provides server-side recall measurement.
 */
public final class TurbopufferBackend implements VectorBackend {
    private final HttpUrl apiBase;
    private final BackendHttpClient http;
    private final Map<String, String> headers;

    public TurbopufferBackend(TurbopufferConfig config, BackendHttpClient http) {
        Objects.requireNonNull(config, "config must not be null");
        if (!config.configured()) {
            throw new IllegalArgumentException("Turbopuffer API key is required (TURBOPUFFER_API_KEY)");
        }
        this.apiBase = HttpUrl.get(config.resolvedApiBase());
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.headers = Map.of("Authorization", "Bearer " + config.apiKey());
    }

    @Override
    public String name() {
        return BackendType.TURBOPUFFER.id();
    }

    @Override
    public VectorNamespace namespace(String name) {
        return new TurbopufferNamespace(name, apiBase, http, headers);
    }

    @Override
    public void ensureNamespace(String name) {
        // created on first write
    }

    @Override
    public Optional<RecallProbe> recallProbe() {
        return Optional.of(this::recall);
    }

    RecallProbeResult recall(String namespace, int num, int topK) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("num", num);
        payload.put("top_k", topK);

        HttpUrl url = apiBase.newBuilder()
            .addPathSegments("v1/namespaces")
            .addPathSegment(namespace)
            .addPathSegments("_debug/recall")
            .build();
        BackendReply reply = http.send("POST", url, headers, payload);
        return new RecallProbeResult(
            requireNumber(reply, "avg_recall"),
            requireNumber(reply, "avg_ann_count"),
            requireNumber(reply, "avg_exhaustive_count")
        );
    }

    private static double requireNumber(BackendReply reply, String field) throws BackendException {
        JsonNode value = reply.body() == null ? null : reply.body().get(field);
        if (value == null || !value.isNumber()) {
            throw new BackendException(reply.status(), "recall reply has no numeric " + field);
        }
        return value.doubleValue();
    }
}
