package io.vecbench.core.benchmark;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.vecbench.core.backend.VectorRecord;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class UpsertBenchmarkTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldUpsertInBatchesFlaggingOnlyTheFirst() throws Exception {
        BenchmarkTestSupport support = new BenchmarkTestSupport(tempDir);
        FakeVectorBackend backend = new FakeVectorBackend();

        BenchmarkResult<UpsertSummary> result = new UpsertBenchmark(backend, support.runtime).run(
            new UpsertOptions("wiki-gte", 1000, 256, null)
        );

        FakeVectorBackend.FakeNamespace namespace = backend.get("wiki-gte");
        assertThat(backend.ensured).containsExactly("wiki-gte");
        assertThat(namespace.batchSizes).containsExactly(256, 256, 256, 232);
        assertThat(namespace.firstBatchFlags).containsExactly(true, false, false, false);
        assertThat(namespace.upserted).hasSize(1000);
        assertThat(namespace.upserted.get(0).id()).isEqualTo("benchmark-" + BenchmarkTestSupport.NOW.toEpochMilli() + "-0");
        assertThat(namespace.upserted).extracting(VectorRecord::vector).allSatisfy(vector -> assertThat(vector).hasSize(384));

        UpsertSummary summary = result.summaries().get(0);
        assertThat(summary.numBatches()).isEqualTo(4);
        assertThat(summary.totalRecords()).isEqualTo(1000);
        assertThat(summary.dimensions()).isEqualTo(384);
        assertThat(result.outputPath().getFileName().toString())
            .isEqualTo("upsert-benchmark-fake-wiki-gte-" + BenchmarkTestSupport.FILE_TIMESTAMP + ".json");
        assertThat(Files.readString(result.outputPath())).contains("\"records_per_second\"");
    }

    @Test
    void shouldRequireKnownNamespace() {
        assertThatThrownBy(() -> new UpsertOptions("wiki-unknown", 10, 5, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new UpsertOptions(null, 10, 5, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(UpsertOptions.defaults("wiki-openai").numBatches()).isEqualTo(40);
    }
}
