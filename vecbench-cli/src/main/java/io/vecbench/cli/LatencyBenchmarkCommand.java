package io.vecbench.cli;

import io.vecbench.core.benchmark.BenchmarkResult;
import io.vecbench.core.benchmark.LatencyBenchmark;
import io.vecbench.core.benchmark.LatencyOptions;
import io.vecbench.core.benchmark.LatencySummary;
import io.vecbench.core.config.model.BenchConfig;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "latency-benchmark", description = "Run single-query latency benchmarks")
public final class LatencyBenchmarkCommand extends BackendCommand {

    @Option(names = {"-q", "--queries"}, defaultValue = "50", description = "Number of queries per namespace")
    int queries;

    @Option(names = {"-k", "--top-k"}, defaultValue = "10", description = "Number of results per query")
    int topK;

    @Option(names = {"-w", "--warmup"}, defaultValue = "5", description = "Warmup queries before timing")
    int warmup;

    @Option(names = {"-d", "--delay"}, defaultValue = "50", description = "Delay between queries (ms)")
    long delayMs;

    @Option(names = "--namespace", split = ",", description = "Comma-separated namespace names")
    List<String> namespaces = new ArrayList<>();

    @Option(names = {"-o", "--output"}, description = "Output file path for JSON results")
    Path output;

    public LatencyBenchmarkCommand(CliContext context) {
        super(context);
    }

    @Override
    String commandLabel() {
        return "Latency benchmark";
    }

    @Override
    int execute() throws Exception {
        LatencyOptions options = new LatencyOptions(namespaces, queries, topK, warmup, delayMs, output);
        BenchConfig config = loadConfig();
        LatencyBenchmark benchmark = new LatencyBenchmark(openBackend(config), runtime(config));
        BenchmarkResult<LatencySummary> result = benchmark.run(options);

        ReportPrinter printer = new ReportPrinter(System.out);
        printer.latency(result.summaries());
        printer.saved(result.outputPath());
        return 0;
    }
}
