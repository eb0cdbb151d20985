package io.vecbench.core.backend.supabase;

import com.fasterxml.jackson.databind.JsonNode;
import io.vecbench.core.backend.BackendException;
import io.vecbench.core.backend.NamespaceNotFoundException;
import io.vecbench.core.backend.NamespaceStats;
import io.vecbench.core.backend.QueryResult;
import io.vecbench.core.backend.VectorNamespace;
import io.vecbench.core.backend.VectorRecord;
import io.vecbench.core.backend.http.BackendHttpClient;
import io.vecbench.core.backend.http.BackendReply;
import io.vecbench.core.backend.http.JsonVectors;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import okhttp3.HttpUrl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class SupabaseNamespace implements VectorNamespace {
    private static final Logger LOG = LoggerFactory.getLogger(SupabaseNamespace.class);
    static final int UPSERT_CHUNK = 500;
    static final int TEXT_LIMIT = 4000;
    private static final String UNDEFINED_TABLE = "42P01";

    private final String table;
    private final HttpUrl restBase;
    private final BackendHttpClient http;
    private final Map<String, String> headers;

    SupabaseNamespace(String table, HttpUrl restBase, BackendHttpClient http, Map<String, String> headers) {
        this.table = table;
        this.restBase = restBase;
        this.http = http;
        this.headers = headers;
    }

    @Override
    public void upsert(List<VectorRecord> records, boolean isFirstBatch) throws IOException {
        HttpUrl url = tableUrl().newBuilder().addQueryParameter("on_conflict", "id").build();
        Map<String, String> upsertHeaders = withHeader("Prefer", "resolution=merge-duplicates,return=minimal");
        for (int start = 0; start < records.size(); start += UPSERT_CHUNK) {
            List<VectorRecord> chunk = records.subList(start, Math.min(start + UPSERT_CHUNK, records.size()));
            List<Map<String, Object>> rows = new ArrayList<>(chunk.size());
            for (VectorRecord record : chunk) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("id", record.id());
                row.put("title", record.title());
                row.put("text", JsonVectors.truncate(record.text(), TEXT_LIMIT));
                row.put("embedding", record.vector());
                rows.add(row);
            }
            http.send("POST", url, upsertHeaders, rows);
        }
    }

    @Override
    public List<QueryResult> query(float[] vector, int topK, boolean includeVector) throws IOException {
        HttpUrl url = restBase.newBuilder()
            .addPathSegment("rpc")
            .addPathSegment("match_" + table)
            .build();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query_embedding", vector);
        payload.put("match_count", topK);

        JsonNode body = http.send("POST", url, headers, payload).body();
        List<QueryResult> results = new ArrayList<>();
        for (JsonNode row : body) {
            results.add(toResult(row, 1.0 - row.path("similarity").asDouble(0.0)));
        }
        return results;
    }

    @Override
    public Optional<QueryResult> fetchById(String id) throws IOException {
        HttpUrl url = tableUrl().newBuilder()
            .addQueryParameter("select", "id,title,text,embedding")
            .addQueryParameter("id", "eq." + id)
            .build();
        JsonNode body = http.send("GET", url, headers, null).body();
        if (!body.isArray() || body.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toResult(body.get(0), 0.0));
    }

    @Override
    public NamespaceStats stats() throws IOException {
        HttpUrl url = tableUrl().newBuilder().addQueryParameter("select", "*").build();
        try {
            BackendReply reply = http.send("HEAD", url, withHeader("Prefer", "count=exact"), null);
            return new NamespaceStats(parseCount(reply.headers().get("Content-Range")));
        } catch (NamespaceNotFoundException e) {
            return new NamespaceStats(0);
        } catch (BackendException e) {
            if (isUndefinedTable(e)) {
                return new NamespaceStats(0);
            }
            throw e;
        }
    }

    @Override
    public void deleteAll() throws IOException {
        HttpUrl url = tableUrl().newBuilder().addQueryParameter("id", "neq.").build();
        try {
            http.send("DELETE", url, headers, null);
        } catch (BackendException e) {
            if (!(e instanceof NamespaceNotFoundException) && !isUndefinedTable(e)) {
                throw e;
            }
            LOG.debug("Table {} does not exist, nothing to delete", table);
        }
    }

    /**
     * Total from a PostgREST {@code Content-Range} header such as {@code 0-24/3573}.
     */
    static long parseCount(String contentRange) {
        if (contentRange == null) {
            return 0L;
        }
        int slash = contentRange.lastIndexOf('/');
        if (slash < 0) {
            return 0L;
        }
        String total = contentRange.substring(slash + 1).trim();
        try {
            return Long.parseLong(total);
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private static boolean isUndefinedTable(BackendException e) {
        return e.getMessage() != null && e.getMessage().contains(UNDEFINED_TABLE);
    }

    private QueryResult toResult(JsonNode row, double distance) {
        return new QueryResult(
            row.path("id").asText(),
            distance,
            row.path("title").asText(""),
            row.path("text").asText(""),
            JsonVectors.read(row.get("embedding"))
        );
    }

    private Map<String, String> withHeader(String name, String value) {
        Map<String, String> merged = new LinkedHashMap<>(headers);
        merged.put(name, value);
        return merged;
    }

    private HttpUrl tableUrl() {
        return restBase.newBuilder().addPathSegment(table).build();
    }
}
