package io.vecbench.core.benchmark;

import io.vecbench.core.config.model.BenchmarkSettings;
import io.vecbench.core.namespace.VectorGenerator;
import io.vecbench.core.report.ResultWriter;
import io.vecbench.core.retry.RetryExecutor;
import io.vecbench.core.retry.RetryPolicy;
import io.vecbench.core.retry.Sleeper;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.Random;

/**
 * Collaborators shared by the benchmark orchestrators.
 */
public record BenchmarkRuntime(
    RetryExecutor retryExecutor,
    RetryPolicy retryPolicy,
    Sleeper sleeper,
    VectorGenerator vectors,
    Clock clock,
    ResultWriter resultWriter,
    ProgressListener progress
) {
    public BenchmarkRuntime {
        Objects.requireNonNull(retryExecutor, "retryExecutor must not be null");
        Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        Objects.requireNonNull(sleeper, "sleeper must not be null");
        Objects.requireNonNull(vectors, "vectors must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(resultWriter, "resultWriter must not be null");
        progress = progress == null ? ProgressListener.NONE : progress;
    }

    public static BenchmarkRuntime create(BenchmarkSettings settings, Path dataDir, Clock clock, ProgressListener progress) {
        BenchmarkSettings effective = settings == null ? BenchmarkSettings.defaults() : settings;
        return new BenchmarkRuntime(
            new RetryExecutor(Sleeper.SYSTEM),
            RetryPolicy.of(Math.max(0, effective.maxRetries()), Math.max(0, effective.retryBaseDelayMs())),
            Sleeper.SYSTEM,
            new VectorGenerator(new Random()),
            clock,
            new ResultWriter(dataDir, clock),
            progress
        );
    }
}
