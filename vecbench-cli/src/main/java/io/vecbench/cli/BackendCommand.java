package io.vecbench.cli;

import io.vecbench.core.backend.VectorBackend;
import io.vecbench.core.benchmark.BenchmarkRuntime;
import io.vecbench.core.config.ConfigPaths;
import io.vecbench.core.config.model.BenchConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Mixin;

/**
 * Shared plumbing for commands that talk to a backend: config loading, backend selection and
 * the top-level failure report.
 */
abstract class BackendCommand implements Callable<Integer> {
    protected final CliContext context;

    @Mixin
    BackendOption backendOption = new BackendOption();

    BackendCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public final Integer call() {
        try {
            return execute();
        } catch (Exception e) {
            System.err.println(commandLabel() + " failed: " + e.getMessage());
            return 1;
        }
    }

    abstract String commandLabel();

    abstract int execute() throws Exception;

    BenchConfig loadConfig() throws IOException {
        return context.configService().load(context.configPath());
    }

    VectorBackend openBackend(BenchConfig config) {
        return context.backendProvider().create(backendOption.type(), config);
    }

    Path dataDir(BenchConfig config) {
        return ConfigPaths.resolveDataDir(config.benchmark().dataDir());
    }

    BenchmarkRuntime runtime(BenchConfig config) {
        return BenchmarkRuntime.create(config.benchmark(), dataDir(config), context.clock(), new ConsoleProgress(System.out));
    }
}
