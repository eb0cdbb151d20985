package io.vecbench.core.benchmark;

import java.nio.file.Path;
import java.util.List;

public record BenchmarkResult<S>(List<S> summaries, Path outputPath) {
    public BenchmarkResult {
        summaries = List.copyOf(summaries);
    }
}
