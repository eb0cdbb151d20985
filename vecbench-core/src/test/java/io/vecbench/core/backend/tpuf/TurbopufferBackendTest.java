package io.vecbench.core.backend.tpuf;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vecbench.core.backend.BackendException;
import io.vecbench.core.backend.NamespaceNotFoundException;
import io.vecbench.core.backend.QueryResult;
import io.vecbench.core.backend.RecallProbeResult;
import io.vecbench.core.backend.VectorNamespace;
import io.vecbench.core.backend.VectorRecord;
import io.vecbench.core.backend.http.BackendHttpClient;
import io.vecbench.core.config.model.TurbopufferConfig;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TurbopufferBackendTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;
    private TurbopufferBackend backend;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        backend = new TurbopufferBackend(
            new TurbopufferConfig("tpuf-key", "", server.url("/").toString()),
            new BackendHttpClient(new OkHttpClient(), mapper)
        );
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldWriteRowsWithSchemaOnFirstBatch() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"status\":\"OK\"}"));
        server.enqueue(new MockResponse().setBody("{\"status\":\"OK\"}"));
        VectorNamespace namespace = backend.namespace("wiki-gte");

        namespace.upsert(List.of(new VectorRecord("doc-1", "Title", "x".repeat(4000), new float[] {0.6f, 0.8f})), true);
        namespace.upsert(List.of(new VectorRecord("doc-2", "Title", "short", new float[] {1f, 0f})), false);

        RecordedRequest first = server.takeRequest();
        assertThat(first.getMethod()).isEqualTo("POST");
        assertThat(first.getPath()).isEqualTo("/v2/namespaces/wiki-gte");
        assertThat(first.getHeader("Authorization")).isEqualTo("Bearer tpuf-key");
        JsonNode body = mapper.readTree(first.getBody().readUtf8());
        assertThat(body.path("distance_metric").asText()).isEqualTo("cosine_distance");
        assertThat(body.path("upsert_rows").get(0).path("id").asText()).isEqualTo("doc-1");
        assertThat(body.path("upsert_rows").get(0).path("text").asText()).hasSize(3500);
        assertThat(body.path("schema").path("text").path("full_text_search").path("stemming").asBoolean()).isTrue();

        JsonNode second = mapper.readTree(server.takeRequest().getBody().readUtf8());
        assertThat(second.has("schema")).isFalse();
    }

    @Test
    void shouldQueryAndMapRows() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "rows": [
                    { "id": 42, "$dist": 0.125, "title": "Alan Turing", "text": "Mathematician", "vector": [0.1, 0.2, 0.3] },
                    { "id": "b", "$dist": 0.5 }
                  ]
                }
                """));

        List<QueryResult> results = backend.namespace("wiki-gte").query(new float[] {0.1f, 0.2f, 0.3f}, 2, true);

        assertThat(results).hasSize(2);
        assertThat(results.get(0).id()).isEqualTo("42");
        assertThat(results.get(0).score()).isEqualTo(0.125);
        assertThat(results.get(0).vector()).hasSize(3);
        assertThat(results.get(1).title()).isEqualTo("Unknown");
        assertThat(results.get(1).hasVector()).isFalse();

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v2/namespaces/wiki-gte/query");
        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("rank_by").get(1).asText()).isEqualTo("ANN");
        assertThat(body.path("top_k").asInt()).isEqualTo(2);
        assertThat(body.path("include_attributes").toString()).contains("vector");
    }

    @Test
    void shouldFetchByIdThroughEqualityFilter() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"rows\":[]}"));

        Optional<QueryResult> result = backend.namespace("wiki-gte").fetchById("doc-9");

        assertThat(result).isEmpty();
        JsonNode body = mapper.readTree(server.takeRequest().getBody().readUtf8());
        assertThat(body.path("filters").toString()).isEqualTo("[\"id\",\"Eq\",\"doc-9\"]");
    }

    @Test
    void shouldReadStatsAndDeleteNamespace() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"approx_row_count\": 1234}"));
        server.enqueue(new MockResponse().setBody("{\"status\":\"ok\"}"));

        assertThat(backend.namespace("wiki-gte").stats().approxRowCount()).isEqualTo(1234);
        backend.namespace("wiki-gte").deleteAll();

        RecordedRequest stats = server.takeRequest();
        assertThat(stats.getMethod()).isEqualTo("GET");
        assertThat(stats.getPath()).isEqualTo("/v1/namespaces/wiki-gte/metadata");
        RecordedRequest delete = server.takeRequest();
        assertThat(delete.getMethod()).isEqualTo("DELETE");
        assertThat(delete.getPath()).isEqualTo("/v2/namespaces/wiki-gte");
    }

    @Test
    void shouldRunServerSideRecall() throws Exception {
        server.enqueue(new MockResponse().setBody("""
            { "avg_recall": 0.97, "avg_ann_count": 10.0, "avg_exhaustive_count": 10.0 }
            """));

        RecallProbeResult result = backend.recallProbe().orElseThrow().recall("wiki-openai", 20, 10);

        assertThat(result.avgRecall()).isEqualTo(0.97);
        assertThat(result.avgExhaustiveCount()).isEqualTo(10.0);
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/namespaces/wiki-openai/_debug/recall");
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"num\":20,\"top_k\":10}");
    }

    @Test
    void shouldRejectRecallReplyWithoutMeasurements() {
        server.enqueue(new MockResponse().setBody("{}"));
        server.enqueue(new MockResponse().setBody("{ \"avg_recall\": \"high\", \"avg_ann_count\": 10, \"avg_exhaustive_count\": 10 }"));

        assertThatThrownBy(() -> backend.recallProbe().orElseThrow().recall("wiki-openai", 20, 10))
            .isInstanceOf(BackendException.class)
            .hasMessageContaining("avg_recall");
        assertThatThrownBy(() -> backend.recallProbe().orElseThrow().recall("wiki-openai", 20, 10))
            .isInstanceOfSatisfying(BackendException.class, error -> assertThat(error.isTransient()).isFalse());
    }

    @Test
    void shouldMapErrorStatuses() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"error\":\"namespace not found\"}"));
        server.enqueue(new MockResponse().setResponseCode(503).setHeader("Retry-After", "2").setBody("busy"));

        assertThatThrownBy(() -> backend.namespace("wiki-gte").stats())
            .isInstanceOf(NamespaceNotFoundException.class)
            .hasMessageContaining("namespace not found");
        assertThatThrownBy(() -> backend.namespace("wiki-gte").stats())
            .isInstanceOfSatisfying(BackendException.class, error -> {
                assertThat(error.statusCode()).isEqualTo(503);
                assertThat(error.isTransient()).isTrue();
                assertThat(error.retryAfterMs()).isEqualTo(2000);
            });
    }

    @Test
    void shouldRequireApiKey() {
        assertThatThrownBy(() -> new TurbopufferBackend(
            TurbopufferConfig.defaults(),
            new BackendHttpClient(new OkHttpClient(), mapper)
        )).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("TURBOPUFFER_API_KEY");
    }
}
