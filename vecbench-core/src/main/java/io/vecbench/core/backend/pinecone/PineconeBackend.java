package io.vecbench.core.backend.pinecone;

import com.fasterxml.jackson.databind.JsonNode;
import io.vecbench.core.backend.BackendException;
import io.vecbench.core.backend.BackendType;
import io.vecbench.core.backend.NamespaceNotFoundException;
import io.vecbench.core.backend.VectorBackend;
import io.vecbench.core.backend.VectorNamespace;
import io.vecbench.core.backend.http.BackendHttpClient;
import io.vecbench.core.config.model.PineconeConfig;
import io.vecbench.core.namespace.NamespaceCatalog;
import io.vecbench.core.retry.Sleeper;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import okhttp3.HttpUrl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pinecone serverless client. Each benchmark namespace maps to an index of the same name; the
 * index's data-plane host comes from the control plane and is cached per index.
 */
public final class PineconeBackend implements VectorBackend {
    private static final Logger LOG = LoggerFactory.getLogger(PineconeBackend.class);
    static final String API_VERSION = "2024-10";
    static final long READY_POLL_MS = 2000;
    static final int READY_MAX_POLLS = 150;

    private final PineconeConfig config;
    private final HttpUrl controlPlane;
    private final BackendHttpClient http;
    private final Sleeper sleeper;
    private final Map<String, String> headers;
    private final Map<String, HttpUrl> hosts = new ConcurrentHashMap<>();

    public PineconeBackend(PineconeConfig config, BackendHttpClient http, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        if (!config.configured()) {
            throw new IllegalArgumentException("Pinecone API key is required (PINECONE_API_KEY)");
        }
        this.controlPlane = HttpUrl.get(config.controlPlaneUrl());
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
        this.headers = Map.of("Api-Key", config.apiKey(), "X-Pinecone-API-Version", API_VERSION);
    }

    @Override
    public String name() {
        return BackendType.PINECONE.id();
    }

    @Override
    public VectorNamespace namespace(String name) {
        return new PineconeNamespace(name, () -> host(name), http, headers);
    }

    @Override
    public void ensureNamespace(String name) throws IOException {
        try {
            describe(name);
            return;
        } catch (NamespaceNotFoundException e) {
            LOG.debug("Pinecone index {} not found, creating it", name);
        }

        int dimension = NamespaceCatalog.dimensions(name);
        String region = config.region() == null || config.region().isBlank() ? "us-east-1" : config.region();
        String cloud = config.cloud() == null || config.cloud().isBlank() ? "aws" : config.cloud();
        LOG.info("Creating Pinecone index \"{}\" ({}d) in {}...", name, dimension, region);

        Map<String, Object> serverless = new LinkedHashMap<>();
        serverless.put("cloud", cloud);
        serverless.put("region", region);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", name);
        payload.put("dimension", dimension);
        payload.put("metric", "cosine");
        payload.put("spec", Map.of("serverless", serverless));
        http.send("POST", indexesUrl(), headers, payload);

        awaitReady(name);
        LOG.info("Index \"{}\" is ready.", name);
    }

    private void awaitReady(String name) throws IOException {
        for (int poll = 0; poll < READY_MAX_POLLS; poll++) {
            JsonNode index = describe(name);
            if (index.path("status").path("ready").asBoolean(false)) {
                return;
            }
            sleeper.sleep(READY_POLL_MS);
        }
        throw new BackendException(503, "index " + name + " did not become ready");
    }

    HttpUrl host(String name) throws IOException {
        HttpUrl cached = hosts.get(name);
        if (cached != null) {
            return cached;
        }
        String host = describe(name).path("host").asText("");
        if (host.isBlank()) {
            throw new NamespaceNotFoundException("index " + name + " has no host yet");
        }
        HttpUrl resolved = HttpUrl.get(host.contains("://") ? host : "https://" + host);
        hosts.put(name, resolved);
        return resolved;
    }

    private JsonNode describe(String name) throws IOException {
        HttpUrl url = indexesUrl().newBuilder().addPathSegment(name).build();
        return http.send("GET", url, headers, null).body();
    }

    private HttpUrl indexesUrl() {
        return controlPlane.newBuilder().addPathSegment("indexes").build();
    }
}
