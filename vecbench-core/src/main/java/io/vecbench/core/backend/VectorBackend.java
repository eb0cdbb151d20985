package io.vecbench.core.backend;

import java.io.IOException;
import java.util.Optional;

public interface VectorBackend {
    String name();

    VectorNamespace namespace(String name);

    void ensureNamespace(String name) throws IOException;

    /**
     * Server-side recall measurement, present only on backends that can run ANN and
     * exhaustive search side by side.
     */
    default Optional<RecallProbe> recallProbe() {
        return Optional.empty();
    }
}
