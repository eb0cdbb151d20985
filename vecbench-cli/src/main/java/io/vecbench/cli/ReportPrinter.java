package io.vecbench.cli;

import io.vecbench.core.benchmark.LatencySummary;
import io.vecbench.core.benchmark.RecallSummary;
import io.vecbench.core.benchmark.ThroughputSummary;
import io.vecbench.core.benchmark.UpsertSummary;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Markdown-style summary tables printed after each benchmark.
 */
final class ReportPrinter {
    private final PrintStream out;

    ReportPrinter(PrintStream out) {
        this.out = out;
    }

    void latency(List<LatencySummary> summaries) {
        banner("RESULTS SUMMARY (sorted by median latency)", 80);
        out.println("| Namespace | Dims | Mean | Median | P95 | Min | Max |");
        out.println("|-----------|------|------|--------|-----|-----|-----|");
        for (LatencySummary summary : summaries) {
            out.println(format(
                "| %s | %d | %.0fms | %.0fms | %.0fms | %.0fms | %.0fms |",
                summary.namespace(),
                summary.dimensions(),
                summary.meanMs(),
                summary.medianMs(),
                summary.p95Ms(),
                summary.minMs(),
                summary.maxMs()
            ));
        }
    }

    void throughput(List<ThroughputSummary> summaries) {
        banner("RESULTS SUMMARY (sorted by QPS)", 100);
        out.println("| Namespace | Dims | QPS | Avg Lat | P50 | P95 | P99 | Errors |");
        out.println("|-----------|------|-----|---------|-----|-----|-----|--------|");
        for (ThroughputSummary summary : summaries) {
            out.println(format(
                "| %s | %d | %.1f | %.0fms | %.0fms | %.0fms | %.0fms | %d |",
                summary.namespace(),
                summary.dimensions(),
                summary.qps(),
                summary.avgLatencyMs(),
                summary.p50LatencyMs(),
                summary.p95LatencyMs(),
                summary.p99LatencyMs(),
                summary.errors()
            ));
        }
    }

    void upsert(UpsertSummary summary) {
        out.println();
        out.println("Results:");
        out.println(format("  Total duration: %.2fs", summary.durationSeconds()));
        out.println(format("  Records/second: %.1f", summary.recordsPerSecond()));
        out.println(format("  Avg batch latency: %.0fms", summary.avgBatchLatencyMs()));
        out.println(format("  P95 batch latency: %.0fms", summary.p95BatchLatencyMs()));
    }

    void recall(List<RecallSummary> summaries) {
        out.println();
        out.println("Results Summary:");
        out.println("-".repeat(90));
        out.println(format(
            "%-14s %6s %9s %8s %19s %10s %10s",
            "Namespace", "top_k", "Recall", "Std", "95% CI", "ANN", "Latency"
        ));
        out.println("-".repeat(90));
        for (RecallSummary summary : summaries) {
            RecallSummary.RecallStats recall = summary.recall();
            out.println(format(
                "%-14s %6d %9.4f %8.4f %19s %10.1f %8.0fms",
                summary.namespace(),
                summary.topK(),
                recall.mean(),
                recall.std(),
                format("[%.4f, %.4f]", recall.ci95Lower(), recall.ci95Upper()),
                summary.avgAnnCount().mean(),
                summary.latencyMs().mean()
            ));
        }
        out.println("-".repeat(90));
    }

    void saved(Path output) {
        out.println();
        out.println("Results saved to: " + output);
    }

    private void banner(String title, int width) {
        out.println();
        out.println("=".repeat(width));
        out.println(title);
        out.println("=".repeat(width));
        out.println();
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
