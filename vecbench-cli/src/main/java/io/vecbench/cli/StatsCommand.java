package io.vecbench.cli;

import io.vecbench.core.backend.NamespaceNotFoundException;
import io.vecbench.core.backend.NamespaceStats;
import io.vecbench.core.backend.VectorBackend;
import io.vecbench.core.namespace.NamespaceCatalog;
import java.io.IOException;
import java.util.Locale;
import picocli.CommandLine.Command;

@Command(name = "stats", description = "Show namespace statistics")
public final class StatsCommand extends BackendCommand {

    public StatsCommand(CliContext context) {
        super(context);
    }

    @Override
    String commandLabel() {
        return "Stats command";
    }

    @Override
    int execute() throws Exception {
        VectorBackend backend = openBackend(loadConfig());
        System.out.println();
        System.out.println("Namespace Statistics (" + backend.name() + "):");
        System.out.println("-".repeat(60));
        for (String namespace : NamespaceCatalog.all()) {
            try {
                NamespaceStats stats = backend.namespace(namespace).stats();
                System.out.println(String.format(Locale.ROOT, "%s: %,d rows", namespace, stats.approxRowCount()));
            } catch (NamespaceNotFoundException e) {
                System.out.println(namespace + ": (not found)");
            } catch (IOException e) {
                System.out.println(namespace + ": Error - " + e.getMessage());
            }
        }
        return 0;
    }
}
