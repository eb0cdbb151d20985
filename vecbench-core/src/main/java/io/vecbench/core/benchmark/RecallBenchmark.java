package io.vecbench.core.benchmark;

import io.vecbench.core.backend.RecallProbe;
import io.vecbench.core.backend.RecallProbeResult;
import io.vecbench.core.backend.VectorBackend;
import io.vecbench.core.checkpoint.Checkpoint;
import io.vecbench.core.checkpoint.CheckpointStore;
import io.vecbench.core.model.RecallRun;
import io.vecbench.core.report.BenchmarkArtifact;
import io.vecbench.core.report.ResultWriter;
import io.vecbench.core.retry.RetryListener;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resumable ANN recall sweep over every (namespace, top_k) pair.
 *
 * <p>Each pair gets {@code runs} recall-probe calls. Once all runs of a pair are in, its key is
 * added to the checkpoint and the checkpoint is saved, so a restarted sweep never measures that
 * pair again. The checkpoint is cleared only after the result artifact has been written.
 */
public final class RecallBenchmark {
    private static final Logger LOG = LoggerFactory.getLogger(RecallBenchmark.class);

    private final VectorBackend backend;
    private final RecallProbe probe;
    private final CheckpointStore checkpointStore;
    private final BenchmarkRuntime runtime;

    public RecallBenchmark(VectorBackend backend, CheckpointStore checkpointStore, BenchmarkRuntime runtime) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.checkpointStore = Objects.requireNonNull(checkpointStore, "checkpointStore must not be null");
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
        this.probe = backend.recallProbe().orElseThrow(() -> new IllegalArgumentException(
            "Recall benchmark is not supported by backend " + backend.name() + " (no server-side recall measurement)"
        ));
    }

    public BenchmarkResult<RecallSummary> run(RecallOptions options) throws IOException {
        ProgressListener progress = runtime.progress();
        int totalCalls = options.totalCalls();

        Checkpoint loaded = checkpointStore.load();
        Checkpoint checkpoint = loaded.withoutIncompleteConfigs();
        if (!checkpoint.equals(loaded)) {
            LOG.warn(
                "Checkpoint had inconsistent entries; re-measuring {} config(s) and discarding {} stray run(s)",
                loaded.completedConfigs().size() - checkpoint.completedConfigs().size(),
                loaded.rawRuns().size() - checkpoint.rawRuns().size()
            );
        }
        int resumedConfigs = countCompleted(checkpoint, options);
        if (resumedConfigs > 0) {
            progress.line("Resuming from checkpoint (" + resumedConfigs + "/" + options.totalConfigs() + " configs completed)");
        }
        progress.line("Recall Benchmark Configuration:");
        progress.line("  Namespaces: " + String.join(", ", options.namespaces()));
        progress.line("  top_k values: " + options.topKValues());
        progress.line("  Queries per call (num): " + options.num());
        progress.line("  Runs per config: " + options.runs());
        progress.line("  Total API calls: " + totalCalls);
        progress.line("  Delay between calls: " + options.delayMs() + "ms");

        int completedCalls = resumedConfigs * options.runs();
        for (String namespace : options.namespaces()) {
            for (int topK : options.topKValues()) {
                String key = RecallRun.configKey(namespace, topK);
                if (checkpoint.isCompleted(key)) {
                    continue;
                }

                List<RecallRun> pairRuns = new ArrayList<>(options.runs());
                for (int run = 1; run <= options.runs(); run++) {
                    completedCalls++;
                    String position = "[" + completedCalls + "/" + totalCalls + "] " + namespace
                        + " top_k=" + topK + " run=" + run + "/" + options.runs();
                    progress.status(position);

                    pairRuns.add(measure(namespace, topK, run, options.num(), position));

                    if (completedCalls < totalCalls && options.delayMs() > 0) {
                        runtime.sleeper().sleep(options.delayMs());
                    }
                }

                checkpoint = checkpoint.withCompleted(key, pairRuns);
                checkpointStore.save(checkpoint);
                LOG.debug("Checkpointed {} ({} runs)", key, pairRuns.size());
            }
        }

        List<RecallRun> sweepRuns = new ArrayList<>();
        List<RecallSummary> summaries = new ArrayList<>();
        for (String namespace : options.namespaces()) {
            for (int topK : options.topKValues()) {
                List<RecallRun> pairRuns = runsFor(checkpoint, namespace, topK);
                sweepRuns.addAll(pairRuns);
                summaries.add(RecallSummary.of(namespace, topK, pairRuns));
            }
        }

        Instant at = runtime.resultWriter().now();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("timestamp", ResultWriter.isoTimestamp(at));
        metadata.put("backend", backend.name());
        metadata.put("benchmark", "recall");
        metadata.put("num", options.num());
        metadata.put("runs_per_config", options.runs());
        metadata.put("top_k_values", options.topKValues());
        metadata.put("namespaces", options.namespaces());
        metadata.put("total_calls", totalCalls);

        Path output = runtime.resultWriter().resolve(options.output(), "recall-benchmark", at);
        runtime.resultWriter().write(output, new BenchmarkArtifact(metadata, sweepRuns, summaries));
        checkpointStore.clear();
        return new BenchmarkResult<>(summaries, output);
    }

    private RecallRun measure(String namespace, int topK, int run, int num, String position) throws IOException {
        RetryListener onRetry = (attempt, maxRetries, delayMs, error) -> {
            LOG.warn("{} retry {}/{} in {}ms: {}", position, attempt, maxRetries, delayMs, error.getMessage());
            runtime.progress().status(position + " retry " + attempt + "/" + maxRetries);
        };
        TimedResult timed = runtime.retryExecutor().execute(() -> {
            long start = System.nanoTime();
            RecallProbeResult result = probe.recall(namespace, num, topK);
            return new TimedResult(result, (System.nanoTime() - start) / 1_000_000.0);
        }, runtime.retryPolicy(), onRetry);

        return new RecallRun(
            namespace,
            topK,
            run,
            timed.result().avgRecall(),
            timed.result().avgAnnCount(),
            timed.result().avgExhaustiveCount(),
            Math.round(timed.latencyMs())
        );
    }

    private static int countCompleted(Checkpoint checkpoint, RecallOptions options) {
        int count = 0;
        for (String namespace : options.namespaces()) {
            for (int topK : options.topKValues()) {
                if (checkpoint.isCompleted(RecallRun.configKey(namespace, topK))) {
                    count++;
                }
            }
        }
        return count;
    }

    private static List<RecallRun> runsFor(Checkpoint checkpoint, String namespace, int topK) {
        return checkpoint.rawRuns().stream()
            .filter(run -> run.namespace().equals(namespace) && run.topK() == topK)
            .toList();
    }

    private record TimedResult(RecallProbeResult result, double latencyMs) {
    }
}
