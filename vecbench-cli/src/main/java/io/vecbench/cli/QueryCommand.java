package io.vecbench.cli;

import io.vecbench.core.backend.NamespaceNotFoundException;
import io.vecbench.core.backend.QueryResult;
import io.vecbench.core.backend.VectorBackend;
import io.vecbench.core.namespace.NamespaceCatalog;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Looks a document up by id in the first namespace that has it, then runs its vector as a query
 * against every namespace of the same dimension.
 */
@Command(name = "query", description = "Query namespaces using a document's vector")
public final class QueryCommand extends BackendCommand {
    private static final Logger LOG = LoggerFactory.getLogger(QueryCommand.class);

    @Option(names = {"-d", "--doc-id"}, required = true, description = "Document ID to use as query source")
    String docId;

    @Option(names = {"-k", "--top-k"}, defaultValue = "10", description = "Number of results per namespace")
    int topK;

    public QueryCommand(CliContext context) {
        super(context);
    }

    @Override
    String commandLabel() {
        return "Query command";
    }

    @Override
    int execute() throws Exception {
        if (topK <= 0) {
            throw new IllegalArgumentException("top-k must be > 0");
        }
        VectorBackend backend = openBackend(loadConfig());
        System.out.println();
        System.out.println("Querying with document ID: " + docId);
        System.out.println("-".repeat(60));

        QueryResult source = null;
        String sourceNamespace = null;
        for (String namespace : NamespaceCatalog.all()) {
            Optional<QueryResult> found = fetch(backend, namespace);
            if (found.isPresent() && found.get().hasVector()) {
                source = found.get();
                sourceNamespace = namespace;
                break;
            }
        }
        if (source == null) {
            System.out.println("Document " + docId + " not found in any namespace.");
            return 1;
        }

        float[] vector = source.vector();
        System.out.println("Source document: \"" + source.title() + "\" (from " + sourceNamespace + ")");
        System.out.println("Vector dimensions: " + vector.length);

        for (String namespace : NamespaceCatalog.all()) {
            if (NamespaceCatalog.dimensions(namespace) != vector.length) {
                System.out.println(namespace + ": Skipped (dimension mismatch)");
                continue;
            }
            try {
                List<QueryResult> results = backend.namespace(namespace).query(vector, topK, false);
                if (results.isEmpty()) {
                    continue;
                }
                System.out.println();
                System.out.println(namespace + ":");
                System.out.println("-".repeat(60));
                for (int i = 0; i < results.size(); i++) {
                    QueryResult result = results.get(i);
                    System.out.println(String.format(Locale.ROOT, "  %d. [%.4f] %s", i + 1, result.score(), result.title()));
                }
            } catch (NamespaceNotFoundException e) {
                LOG.debug("{} not found, skipping", namespace);
            } catch (IOException e) {
                System.out.println(namespace + ": Error - " + e.getMessage());
            }
        }
        return 0;
    }

    private Optional<QueryResult> fetch(VectorBackend backend, String namespace) {
        try {
            return backend.namespace(namespace).fetchById(docId);
        } catch (IOException e) {
            LOG.debug("Fetch of {} from {} failed: {}", docId, namespace, e.getMessage());
            return Optional.empty();
        }
    }
}
