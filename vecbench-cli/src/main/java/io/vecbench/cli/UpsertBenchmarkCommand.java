package io.vecbench.cli;

import io.vecbench.core.benchmark.BenchmarkResult;
import io.vecbench.core.benchmark.UpsertBenchmark;
import io.vecbench.core.benchmark.UpsertOptions;
import io.vecbench.core.benchmark.UpsertSummary;
import io.vecbench.core.config.model.BenchConfig;
import java.nio.file.Path;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "upsert-benchmark", description = "Run upsert/write performance benchmarks")
public final class UpsertBenchmarkCommand extends BackendCommand {

    @Option(names = {"-n", "--namespace"}, required = true, description = "Namespace to benchmark")
    String namespace;

    @Option(names = {"-r", "--records"}, defaultValue = "10000", description = "Total records to upsert")
    int records;

    @Option(names = {"-b", "--batch-size"}, defaultValue = "256", description = "Batch size for upserts")
    int batchSize;

    @Option(names = {"-o", "--output"}, description = "Output file path for JSON results")
    Path output;

    public UpsertBenchmarkCommand(CliContext context) {
        super(context);
    }

    @Override
    String commandLabel() {
        return "Upsert benchmark";
    }

    @Override
    int execute() throws Exception {
        UpsertOptions options = new UpsertOptions(namespace, records, batchSize, output);
        BenchConfig config = loadConfig();
        UpsertBenchmark benchmark = new UpsertBenchmark(openBackend(config), runtime(config));
        BenchmarkResult<UpsertSummary> result = benchmark.run(options);

        ReportPrinter printer = new ReportPrinter(System.out);
        printer.upsert(result.summaries().get(0));
        printer.saved(result.outputPath());
        return 0;
    }
}
