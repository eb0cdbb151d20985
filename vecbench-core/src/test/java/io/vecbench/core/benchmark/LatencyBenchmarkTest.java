package io.vecbench.core.benchmark;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.vecbench.core.backend.BackendException;
import io.vecbench.core.backend.NamespaceNotFoundException;
import java.net.SocketTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LatencyBenchmarkTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldSkipUnusableNamespacesAndSortByMedian() throws Exception {
        BenchmarkTestSupport support = new BenchmarkTestSupport(tempDir);
        FakeVectorBackend backend = new FakeVectorBackend();
        backend.seed("wiki-openai", 100, BenchmarkTestSupport.vector(1536)).queryDelayMs = 5;
        backend.seed("wiki-gte", 100, BenchmarkTestSupport.vector(384));
        backend.seed("wiki-minilm", 0, BenchmarkTestSupport.vector(384));
        backend.seed("wiki-3-small", 100, BenchmarkTestSupport.vector(512)).statsFailure =
            new NamespaceNotFoundException("/v1/namespaces/wiki-3-small/metadata");

        BenchmarkResult<LatencySummary> result = new LatencyBenchmark(backend, support.runtime).run(
            new LatencyOptions(List.of("wiki-openai", "wiki-minilm", "wiki-gte", "wiki-3-small"), 6, 10, 2, 50, null)
        );

        assertThat(result.summaries()).extracting(LatencySummary::namespace).containsExactly("wiki-gte", "wiki-openai");
        assertThat(result.summaries()).extracting(LatencySummary::queries).containsOnly(6);
        assertThat(result.summaries().get(1).dimensions()).isEqualTo(1536);
        assertThat(result.summaries().get(1).minMs()).isGreaterThanOrEqualTo(5.0);
        assertThat(backend.get("wiki-gte").queries.get()).isEqualTo(1 + 2 + 6);
        assertThat(backend.get("wiki-minilm").queries.get()).isZero();
        assertThat(support.sleeps).containsOnly(50L).hasSize(2 * 5);

        assertThat(result.outputPath())
            .isEqualTo(tempDir.resolve("latency-benchmark-fake-" + BenchmarkTestSupport.FILE_TIMESTAMP + ".json"));
        String json = Files.readString(result.outputPath());
        assertThat(json).contains("\"raw_measurements\"", "\"median_ms\"", "\"timestamp\" : \"2026-10-19T08:30:15.123Z\"");
    }

    @Test
    void shouldSkipNamespaceWhoseSamplingTimesOut() throws Exception {
        BenchmarkTestSupport support = new BenchmarkTestSupport(tempDir);
        FakeVectorBackend backend = new FakeVectorBackend();
        backend.seed("wiki-gte", 100, BenchmarkTestSupport.vector(384)).statsFailure =
            new SocketTimeoutException("timeout");
        backend.seed("wiki-minilm", 100, BenchmarkTestSupport.vector(384));

        BenchmarkResult<LatencySummary> result = new LatencyBenchmark(backend, support.runtime).run(
            new LatencyOptions(List.of("wiki-gte", "wiki-minilm"), 3, 10, 0, 0, null)
        );

        assertThat(result.summaries()).extracting(LatencySummary::namespace).containsExactly("wiki-minilm");
        assertThat(backend.get("wiki-gte").queries.get()).isZero();
        assertThat(support.sleeps).isEmpty();
    }

    @Test
    void shouldRetryTransientErrorsWithoutExtraMeasurements() throws Exception {
        BenchmarkTestSupport support = new BenchmarkTestSupport(tempDir);
        FakeVectorBackend backend = new FakeVectorBackend();
        FakeVectorBackend.FakeNamespace namespace = backend.seed("wiki-gte", 10, BenchmarkTestSupport.vector(384));

        LatencyBenchmark benchmark = new LatencyBenchmark(backend, support.runtime);
        namespace.failNextQuery(new BackendException(503, "busy"));
        BenchmarkResult<LatencySummary> result = benchmark.run(
            new LatencyOptions(List.of("wiki-gte"), 4, 10, 0, 0, tempDir.resolve("out/latency.json"))
        );

        // the probe query absorbed the scripted failure
        assertThat(result.summaries().get(0).queries()).isEqualTo(4);
        assertThat(support.sleeps).containsExactly(1000L);
        assertThat(Files.exists(tempDir.resolve("out/latency.json"))).isTrue();
    }

    @Test
    void shouldAbortOnPermanentErrorDuringMeasurement() {
        BenchmarkTestSupport support = new BenchmarkTestSupport(tempDir);
        FakeVectorBackend backend = new FakeVectorBackend();
        backend.seed("wiki-gte", 10, BenchmarkTestSupport.vector(384)).failEveryNthQuery = 3;

        assertThatThrownBy(() -> new LatencyBenchmark(backend, support.runtime).run(
            new LatencyOptions(List.of("wiki-gte"), 5, 10, 0, 0, null)
        )).hasMessageContaining("scripted failure 3");

        assertThat(tempDir).isEmptyDirectory();
    }

    @Test
    void shouldRejectInvalidOptionsBeforeAnyCall() {
        assertThatThrownBy(() -> new LatencyOptions(List.of("wiki-gte"), 0, 10, 0, 0, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LatencyOptions(List.of("nope"), 5, 10, 0, 0, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Invalid namespace");
    }
}
