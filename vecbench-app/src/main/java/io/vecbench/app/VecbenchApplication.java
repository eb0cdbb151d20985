package io.vecbench.app;

import io.vecbench.cli.CliContext;
import io.vecbench.cli.DeleteCommand;
import io.vecbench.cli.InitCommand;
import io.vecbench.cli.LatencyBenchmarkCommand;
import io.vecbench.cli.QueryCommand;
import io.vecbench.cli.RecallBenchmarkCommand;
import io.vecbench.cli.StatsCommand;
import io.vecbench.cli.StatusCommand;
import io.vecbench.cli.SupabaseSqlCommand;
import io.vecbench.cli.ThroughputBenchmarkCommand;
import io.vecbench.cli.UpsertBenchmarkCommand;
import io.vecbench.cli.VecbenchCliCommand;
import io.vecbench.core.config.ConfigPaths;
import io.vecbench.core.config.ConfigService;
import java.nio.file.Path;
import picocli.CommandLine;

public final class VecbenchApplication {

    private VecbenchApplication() {
    }

    public static void main(String[] args) {
        CliContext context = new CliContext(new ConfigService(), resolveConfigPath(), System.getenv());

        CommandLine commandLine = new CommandLine(new VecbenchCliCommand());
        commandLine.addSubcommand("latency-benchmark", new LatencyBenchmarkCommand(context));
        commandLine.addSubcommand("throughput-benchmark", new ThroughputBenchmarkCommand(context));
        commandLine.addSubcommand("upsert-benchmark", new UpsertBenchmarkCommand(context));
        commandLine.addSubcommand("recall-benchmark", new RecallBenchmarkCommand(context));
        commandLine.addSubcommand("stats", new StatsCommand(context));
        commandLine.addSubcommand("query", new QueryCommand(context));
        commandLine.addSubcommand("delete", new DeleteCommand(context));
        commandLine.addSubcommand("supabase-sql", new SupabaseSqlCommand());
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("init", new InitCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static Path resolveConfigPath() {
        String raw = System.getenv("VECBENCH_CONFIG");
        if (raw == null || raw.isBlank()) {
            return ConfigPaths.defaultConfigPath();
        }
        if (raw.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(raw.substring(2));
        }
        return Path.of(raw);
    }
}
