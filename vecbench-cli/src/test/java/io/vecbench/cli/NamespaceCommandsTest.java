package io.vecbench.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.vecbench.core.backend.QueryResult;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NamespaceCommandsTest {

    @TempDir
    Path tempDir;

    @Test
    void statsShouldReportRowsAndMissingNamespaces() throws Exception {
        StubBackend backend = new StubBackend(false)
            .store("wiki-openai", 12_500, null)
            .store("wiki-gte", 0, null);
        CliContext context = CommandRunner.context(tempDir, (type, config) -> backend);

        CommandRunner.Outcome outcome = CommandRunner.run(new StatsCommand(context));

        assertThat(outcome.exitCode()).isZero();
        assertThat(outcome.out()).contains(
            "wiki-openai: 12,500 rows",
            "wiki-gte: 0 rows",
            "wiki-minilm: (not found)",
            "wiki-3-large: (not found)"
        );
    }

    @Test
    void queryShouldSearchNamespacesWithMatchingDimensions() throws Exception {
        StubBackend backend = new StubBackend(false)
            .store("wiki-minilm", 10, BenchmarkCommandsTest.document("doc-7", 384))
            .store("wiki-gte", 10, new QueryResult("doc-9", 0.1234, "Alan Turing", "", new float[384]))
            .store("wiki-openai", 10, BenchmarkCommandsTest.document("doc-1", 1536));
        CliContext context = CommandRunner.context(tempDir, (type, config) -> backend);

        CommandRunner.Outcome outcome = CommandRunner.run(new QueryCommand(context), "--doc-id", "doc-7", "-k", "3");

        assertThat(outcome.exitCode()).isZero();
        assertThat(outcome.out()).contains(
            "Source document: \"Ada Lovelace\" (from wiki-minilm)",
            "Vector dimensions: 384",
            "wiki-openai: Skipped (dimension mismatch)",
            "1. [0.1234] Alan Turing"
        );
    }

    @Test
    void queryShouldFailWhenDocumentIsMissing() throws Exception {
        CliContext context = CommandRunner.context(tempDir, (type, config) -> new StubBackend(false));

        CommandRunner.Outcome outcome = CommandRunner.run(new QueryCommand(context), "-d", "nope");

        assertThat(outcome.exitCode()).isEqualTo(1);
        assertThat(outcome.out()).contains("Document nope not found in any namespace.");
    }

    @Test
    void deleteWithoutConfirmShouldOnlyListTargets() throws Exception {
        CliContext context = CommandRunner.context(tempDir, (type, config) -> {
            throw new AssertionError("backend must not be opened on a dry run");
        });

        CommandRunner.Outcome outcome = CommandRunner.run(new DeleteCommand(context));

        assertThat(outcome.exitCode()).isZero();
        assertThat(outcome.out()).contains("  - wiki-openai", "  - wiki-3-large", "Run with --confirm to actually delete.");
    }

    @Test
    void deleteWithConfirmShouldDeleteAndSkipMissing() throws Exception {
        StubBackend backend = new StubBackend(false).store("wiki-gte", 5, null);
        CliContext context = CommandRunner.context(tempDir, (type, config) -> backend);

        CommandRunner.Outcome deleted = CommandRunner.run(new DeleteCommand(context), "-n", "wiki-gte", "--confirm");
        CommandRunner.Outcome skipped = CommandRunner.run(new DeleteCommand(context), "-n", "wiki-minilm", "--confirm");

        assertThat(deleted.exitCode()).isZero();
        assertThat(deleted.out()).contains("Deleted: wiki-gte");
        assertThat(skipped.exitCode()).isZero();
        assertThat(skipped.out()).contains("Skipped: wiki-minilm (not found)");
        assertThat(backend.deleted).containsExactly("wiki-gte");
    }

    @Test
    void supabaseSqlShouldPrintSetupScript() {
        CommandRunner.Outcome outcome = CommandRunner.run(new SupabaseSqlCommand());

        assertThat(outcome.exitCode()).isZero();
        assertThat(outcome.out()).contains("CREATE EXTENSION IF NOT EXISTS vector;", "CREATE TABLE IF NOT EXISTS wiki_3_large");
    }
}
