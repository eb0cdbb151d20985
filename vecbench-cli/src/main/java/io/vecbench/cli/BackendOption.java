package io.vecbench.cli;

import io.vecbench.core.backend.BackendType;
import picocli.CommandLine.Option;

final class BackendOption {

    @Option(
        names = "--backend",
        defaultValue = "tpuf",
        description = "Vector backend (tpuf, pinecone, supabase). Default: ${DEFAULT-VALUE}"
    )
    String backend;

    BackendType type() {
        return BackendType.fromId(backend);
    }
}
