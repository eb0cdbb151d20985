package io.vecbench.cli;

import io.vecbench.core.backend.NamespaceNotFoundException;
import io.vecbench.core.backend.VectorBackend;
import io.vecbench.core.namespace.NamespaceCatalog;
import java.io.IOException;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "delete", description = "Delete wiki-* namespaces (dry run unless --confirm)")
public final class DeleteCommand extends BackendCommand {

    @Option(names = {"-n", "--namespace"}, description = "Delete only one namespace")
    String namespace;

    @Option(names = "--confirm", description = "Actually delete (required)")
    boolean confirm;

    public DeleteCommand(CliContext context) {
        super(context);
    }

    @Override
    String commandLabel() {
        return "Delete command";
    }

    @Override
    int execute() throws Exception {
        List<String> targets = namespace == null ? NamespaceCatalog.all() : NamespaceCatalog.resolve(List.of(namespace));

        if (!confirm) {
            System.out.println();
            System.out.println("The following namespaces would be deleted:");
            targets.forEach(target -> System.out.println("  - " + target));
            System.out.println();
            System.out.println("Run with --confirm to actually delete.");
            return 0;
        }

        VectorBackend backend = openBackend(loadConfig());
        System.out.println();
        System.out.println("Deleting namespaces...");
        int failures = 0;
        for (String target : targets) {
            try {
                backend.namespace(target).deleteAll();
                System.out.println("  Deleted: " + target);
            } catch (NamespaceNotFoundException e) {
                System.out.println("  Skipped: " + target + " (not found)");
            } catch (IOException e) {
                failures++;
                System.out.println("  Error deleting " + target + ": " + e.getMessage());
            }
        }
        return failures == 0 ? 0 : 1;
    }
}
