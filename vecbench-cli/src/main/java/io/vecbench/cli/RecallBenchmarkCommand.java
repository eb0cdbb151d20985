package io.vecbench.cli;

import io.vecbench.core.benchmark.BenchmarkResult;
import io.vecbench.core.benchmark.RecallBenchmark;
import io.vecbench.core.benchmark.RecallOptions;
import io.vecbench.core.benchmark.RecallSummary;
import io.vecbench.core.checkpoint.FileCheckpointStore;
import io.vecbench.core.config.ConfigPaths;
import io.vecbench.core.config.model.BenchConfig;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "recall-benchmark",
    description = "Run recall benchmarks across namespaces and top_k values (resumes from checkpoint)"
)
public final class RecallBenchmarkCommand extends BackendCommand {

    @Option(names = {"-r", "--runs"}, defaultValue = "20", description = "Number of runs per configuration")
    int runs;

    @Option(names = {"-n", "--num"}, defaultValue = "20", description = "Number of queries per recall call")
    int num;

    @Option(names = {"-k", "--top-k"}, split = ",", description = "Comma-separated top_k values")
    List<Integer> topKValues = new ArrayList<>();

    @Option(names = "--namespace", split = ",", description = "Comma-separated namespace names")
    List<String> namespaces = new ArrayList<>();

    @Option(names = {"-o", "--output"}, description = "Output file path for JSON results")
    Path output;

    public RecallBenchmarkCommand(CliContext context) {
        super(context);
    }

    @Override
    String commandLabel() {
        return "Recall benchmark";
    }

    @Override
    int execute() throws Exception {
        RecallOptions options = new RecallOptions(
            namespaces,
            topKValues,
            num,
            runs,
            RecallOptions.DEFAULT_DELAY_MS,
            output
        );
        BenchConfig config = loadConfig();
        FileCheckpointStore checkpointStore = new FileCheckpointStore(ConfigPaths.checkpointPath(dataDir(config)));
        RecallBenchmark benchmark = new RecallBenchmark(openBackend(config), checkpointStore, runtime(config));
        BenchmarkResult<RecallSummary> result = benchmark.run(options);

        ReportPrinter printer = new ReportPrinter(System.out);
        printer.recall(result.summaries());
        printer.saved(result.outputPath());
        return 0;
    }
}
