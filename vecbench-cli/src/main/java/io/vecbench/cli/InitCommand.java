package io.vecbench.cli;

import io.vecbench.core.config.InitResult;
import io.vecbench.core.config.model.BackendsConfig;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "init", description = "Create or refresh the config file and data directory")
public final class InitCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Overwrite existing config with defaults")
    boolean overwrite;

    public InitCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            InitResult result = context.configService().init(context.configPath(), overwrite, context.env());
            if (result.createdConfig()) {
                System.out.println("Created config: " + result.configPath());
            } else if (result.overwrittenConfig()) {
                System.out.println("Overwrote config with defaults: " + result.configPath());
            } else {
                System.out.println("Refreshed config with new defaults: " + result.configPath());
            }
            System.out.println("Data directory ready: " + result.dataDir());

            BackendsConfig backends = result.backends();
            System.out.println("Turbopuffer configured: " + backends.tpuf().configured());
            System.out.println("Pinecone configured: " + backends.pinecone().configured());
            System.out.println("Supabase configured: " + backends.supabase().configured());
            if (!backends.tpuf().configured() && !backends.pinecone().configured() && !backends.supabase().configured()) {
                System.out.println("No backend credentials found; set them in the config file or the environment");
            }
            if (result.checkpointPresent()) {
                System.out.println("Recall checkpoint found: " + result.checkpointPath()
                    + " (the next recall run resumes from it)");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Init failed: " + e.getMessage());
            return 1;
        }
    }
}
