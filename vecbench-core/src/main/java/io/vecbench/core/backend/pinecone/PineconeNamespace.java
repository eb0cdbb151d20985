package io.vecbench.core.backend.pinecone;

import com.fasterxml.jackson.databind.JsonNode;
import io.vecbench.core.backend.NamespaceStats;
import io.vecbench.core.backend.QueryResult;
import io.vecbench.core.backend.VectorNamespace;
import io.vecbench.core.backend.VectorRecord;
import io.vecbench.core.backend.http.BackendHttpClient;
import io.vecbench.core.backend.http.JsonVectors;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import okhttp3.HttpUrl;

final class PineconeNamespace implements VectorNamespace {
    // serverless upsert limit per request
    static final int UPSERT_CHUNK = 100;

    @FunctionalInterface
    interface HostResolver {
        HttpUrl resolve() throws IOException;
    }

    private final String name;
    private final HostResolver hostResolver;
    private final BackendHttpClient http;
    private final Map<String, String> headers;

    PineconeNamespace(String name, HostResolver hostResolver, BackendHttpClient http, Map<String, String> headers) {
        this.name = name;
        this.hostResolver = hostResolver;
        this.http = http;
        this.headers = headers;
    }

    @Override
    public void upsert(List<VectorRecord> records, boolean isFirstBatch) throws IOException {
        HttpUrl url = dataPlane("vectors", "upsert");
        for (int start = 0; start < records.size(); start += UPSERT_CHUNK) {
            List<VectorRecord> chunk = records.subList(start, Math.min(start + UPSERT_CHUNK, records.size()));
            List<Map<String, Object>> vectors = new ArrayList<>(chunk.size());
            for (VectorRecord record : chunk) {
                Map<String, Object> vector = new LinkedHashMap<>();
                vector.put("id", record.id());
                vector.put("values", record.vector());
                vector.put("metadata", Map.of("title", record.title(), "text", record.text()));
                vectors.add(vector);
            }
            http.send("POST", url, headers, Map.of("vectors", vectors));
        }
    }

    @Override
    public List<QueryResult> query(float[] vector, int topK, boolean includeVector) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("vector", vector);
        payload.put("topK", topK);
        payload.put("includeMetadata", true);
        payload.put("includeValues", includeVector);

        JsonNode body = http.send("POST", dataPlane("query"), headers, payload).body();
        List<QueryResult> results = new ArrayList<>();
        for (JsonNode match : body.path("matches")) {
            results.add(toResult(match, 1.0 - match.path("score").asDouble(0.0)));
        }
        return results;
    }

    @Override
    public Optional<QueryResult> fetchById(String id) throws IOException {
        HttpUrl url = dataPlane("vectors", "fetch").newBuilder().addQueryParameter("ids", id).build();
        JsonNode record = http.send("GET", url, headers, null).body().path("vectors").path(id);
        if (record.isMissingNode() || record.isNull()) {
            return Optional.empty();
        }
        return Optional.of(toResult(record, 0.0));
    }

    @Override
    public NamespaceStats stats() throws IOException {
        JsonNode body = http.send("POST", dataPlane("describe_index_stats"), headers, Map.of()).body();
        JsonNode count = body.has("totalVectorCount") ? body.get("totalVectorCount") : body.path("totalRecordCount");
        return new NamespaceStats(count.asLong(0));
    }

    @Override
    public void deleteAll() throws IOException {
        http.send("POST", dataPlane("vectors", "delete"), headers, Map.of("deleteAll", true));
    }

    private QueryResult toResult(JsonNode node, double distance) {
        JsonNode metadata = node.path("metadata");
        return new QueryResult(
            node.path("id").asText(),
            distance,
            metadata.path("title").asText(""),
            metadata.path("text").asText(""),
            JsonVectors.read(node.get("values"))
        );
    }

    private HttpUrl dataPlane(String... segments) throws IOException {
        HttpUrl.Builder builder = hostResolver.resolve().newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "PineconeNamespace[" + name + "]";
    }
}
