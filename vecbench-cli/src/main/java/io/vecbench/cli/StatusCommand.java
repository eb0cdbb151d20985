package io.vecbench.cli;

import io.vecbench.core.config.ConfigPaths;
import io.vecbench.core.config.model.BackendsConfig;
import io.vecbench.core.config.model.BenchConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and backend credential status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            BenchConfig config = context.configService().load(context.configPath());
            BackendsConfig backends = config.backends().withEnvironment(context.env());
            Path dataDir = ConfigPaths.resolveDataDir(config.benchmark().dataDir());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Data directory: " + dataDir.toAbsolutePath());
            System.out.println("Recall checkpoint present: " + Files.exists(ConfigPaths.checkpointPath(dataDir)));
            System.out.println("HTTP timeout: " + config.benchmark().httpTimeoutSeconds() + "s");
            System.out.println("Retries: " + config.benchmark().maxRetries() + " (base delay " + config.benchmark().retryBaseDelayMs() + "ms)");
            System.out.println("Turbopuffer configured: " + backends.tpuf().configured() + " (" + backends.tpuf().resolvedApiBase() + ")");
            System.out.println("Pinecone configured: " + backends.pinecone().configured());
            System.out.println("Supabase configured: " + backends.supabase().configured());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
