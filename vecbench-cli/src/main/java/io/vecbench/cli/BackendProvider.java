package io.vecbench.cli;

import io.vecbench.core.backend.BackendType;
import io.vecbench.core.backend.VectorBackend;
import io.vecbench.core.config.model.BenchConfig;

@FunctionalInterface
public interface BackendProvider {
    VectorBackend create(BackendType type, BenchConfig config);
}
