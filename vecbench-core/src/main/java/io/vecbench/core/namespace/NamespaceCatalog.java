package io.vecbench.core.namespace;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The seeded embedding datasets, one namespace per embedding model.
 */
public final class NamespaceCatalog {
    private static final Map<String, Integer> DIMENSIONS = new LinkedHashMap<>();

    static {
        DIMENSIONS.put("wiki-openai", 1536);
        DIMENSIONS.put("wiki-minilm", 384);
        DIMENSIONS.put("wiki-gte", 384);
        DIMENSIONS.put("wiki-3-small", 512);
        DIMENSIONS.put("wiki-3-large", 1024);
    }

    private NamespaceCatalog() {
    }

    public static List<String> all() {
        return List.copyOf(DIMENSIONS.keySet());
    }

    public static boolean contains(String namespace) {
        return DIMENSIONS.containsKey(namespace);
    }

    public static int dimensions(String namespace) {
        Integer dimensions = DIMENSIONS.get(namespace);
        if (dimensions == null) {
            throw invalid(namespace);
        }
        return dimensions;
    }

    /**
     * Returns the given namespaces in order, or every catalog namespace when none are given.
     */
    public static List<String> resolve(Collection<String> requested) {
        if (requested == null || requested.isEmpty()) {
            return all();
        }
        List<String> resolved = new ArrayList<>();
        for (String namespace : requested) {
            String trimmed = namespace == null ? "" : namespace.trim();
            if (!DIMENSIONS.containsKey(trimmed)) {
                throw invalid(trimmed);
            }
            if (!resolved.contains(trimmed)) {
                resolved.add(trimmed);
            }
        }
        return List.copyOf(resolved);
    }

    private static IllegalArgumentException invalid(String namespace) {
        return new IllegalArgumentException(
            "Invalid namespace: " + namespace + ". Valid namespaces: " + String.join(", ", DIMENSIONS.keySet())
        );
    }
}
