package io.vecbench.core.backend;

import java.io.IOException;

@FunctionalInterface
public interface RecallProbe {
    /**
     * Runs {@code num} generated queries with both ANN and exhaustive search and reports the
     * average overlap.
     */
    RecallProbeResult recall(String namespace, int num, int topK) throws IOException;
}
