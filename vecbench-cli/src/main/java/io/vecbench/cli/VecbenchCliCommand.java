package io.vecbench.cli;

import picocli.CommandLine.Command;

@Command(
    name = "vecbench",
    mixinStandardHelpOptions = true,
    version = "vecbench 1.0.0",
    description = "Benchmark vector databases against seeded embedding namespaces"
)
public final class VecbenchCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
