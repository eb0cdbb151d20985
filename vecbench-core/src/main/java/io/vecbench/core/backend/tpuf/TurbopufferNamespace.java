package io.vecbench.core.backend.tpuf;

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

final class TurbopufferNamespace implements VectorNamespace {
    // attribute values are capped at 4096 bytes; leaves room for multi-byte characters
    static final int TEXT_LIMIT = 3500;

    private final String name;
    private final HttpUrl apiBase;
    private final BackendHttpClient http;
    private final Map<String, String> headers;

    TurbopufferNamespace(String name, HttpUrl apiBase, BackendHttpClient http, Map<String, String> headers) {
        this.name = name;
        this.apiBase = apiBase;
        this.http = http;
        this.headers = headers;
    }

    @Override
    public void upsert(List<VectorRecord> records, boolean isFirstBatch) throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>(records.size());
        for (VectorRecord record : records) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", record.id());
            row.put("vector", record.vector());
            row.put("title", record.title());
            row.put("text", JsonVectors.truncate(record.text(), TEXT_LIMIT));
            rows.add(row);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("upsert_rows", rows);
        payload.put("distance_metric", "cosine_distance");
        if (isFirstBatch) {
            payload.put("schema", Map.of("title", fullTextAttribute(), "text", fullTextAttribute()));
        }
        http.send("POST", v2(), headers, payload);
    }

    @Override
    public List<QueryResult> query(float[] vector, int topK, boolean includeVector) throws IOException {
        List<String> attributes = new ArrayList<>(List.of("title", "text"));
        if (includeVector) {
            attributes.add("vector");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("rank_by", List.of("vector", "ANN", vector));
        payload.put("top_k", topK);
        payload.put("include_attributes", attributes);
        return readRows(http.send("POST", queryUrl(), headers, payload).body());
    }

    @Override
    public Optional<QueryResult> fetchById(String id) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("filters", List.of("id", "Eq", id));
        payload.put("top_k", 1);
        payload.put("include_attributes", List.of("title", "text", "vector"));
        List<QueryResult> rows = readRows(http.send("POST", queryUrl(), headers, payload).body());
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public NamespaceStats stats() throws IOException {
        HttpUrl url = apiBase.newBuilder()
            .addPathSegments("v1/namespaces")
            .addPathSegment(name)
            .addPathSegment("metadata")
            .build();
        JsonNode body = http.send("GET", url, headers, null).body();
        return new NamespaceStats(body.path("approx_row_count").asLong(0));
    }

    @Override
    public void deleteAll() throws IOException {
        http.send("DELETE", v2(), headers, null);
    }

    private List<QueryResult> readRows(JsonNode body) {
        List<QueryResult> results = new ArrayList<>();
        for (JsonNode row : body.path("rows")) {
            results.add(new QueryResult(
                row.path("id").asText(),
                row.path("$dist").asDouble(0.0),
                row.path("title").asText(""),
                row.path("text").asText(""),
                JsonVectors.read(row.get("vector"))
            ));
        }
        return results;
    }

    private static Map<String, Object> fullTextAttribute() {
        Map<String, Object> fullText = new LinkedHashMap<>();
        fullText.put("stemming", true);
        fullText.put("remove_stopwords", true);
        fullText.put("case_sensitive", false);

        Map<String, Object> attribute = new LinkedHashMap<>();
        attribute.put("type", "string");
        attribute.put("full_text_search", fullText);
        return attribute;
    }

    private HttpUrl v2() {
        return apiBase.newBuilder()
            .addPathSegments("v2/namespaces")
            .addPathSegment(name)
            .build();
    }

    private HttpUrl queryUrl() {
        return v2().newBuilder().addPathSegment("query").build();
    }
}
