package io.vecbench.cli;

import io.vecbench.core.benchmark.BenchmarkResult;
import io.vecbench.core.benchmark.ThroughputBenchmark;
import io.vecbench.core.benchmark.ThroughputOptions;
import io.vecbench.core.benchmark.ThroughputSummary;
import io.vecbench.core.config.model.BenchConfig;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "throughput-benchmark", description = "Run throughput benchmarks (QPS under load)")
public final class ThroughputBenchmarkCommand extends BackendCommand {

    @Option(names = {"-q", "--queries"}, defaultValue = "500", description = "Total queries to run")
    int queries;

    @Option(names = {"-c", "--concurrency"}, defaultValue = "10", description = "Concurrent queries")
    int concurrency;

    @Option(names = {"-k", "--top-k"}, defaultValue = "10", description = "Number of results per query")
    int topK;

    @Option(names = {"-w", "--warmup"}, defaultValue = "20", description = "Warmup queries before timing")
    int warmup;

    @Option(names = "--namespace", split = ",", description = "Comma-separated namespace names")
    List<String> namespaces = new ArrayList<>();

    @Option(names = {"-o", "--output"}, description = "Output file path for JSON results")
    Path output;

    public ThroughputBenchmarkCommand(CliContext context) {
        super(context);
    }

    @Override
    String commandLabel() {
        return "Throughput benchmark";
    }

    @Override
    int execute() throws Exception {
        ThroughputOptions options = new ThroughputOptions(namespaces, queries, topK, concurrency, warmup, output);
        BenchConfig config = loadConfig();
        ThroughputBenchmark benchmark = new ThroughputBenchmark(openBackend(config), runtime(config));
        BenchmarkResult<ThroughputSummary> result = benchmark.run(options);

        ReportPrinter printer = new ReportPrinter(System.out);
        printer.throughput(result.summaries());
        printer.saved(result.outputPath());
        return 0;
    }
}
