package io.vecbench.core.pool;

import io.vecbench.core.model.Measurement;
import java.time.Duration;
import java.util.List;

public record PoolResult(List<Measurement> measurements, int successes, int errors, Duration duration) {
    public PoolResult {
        measurements = List.copyOf(measurements);
    }

    public double durationSeconds() {
        return duration.toNanos() / 1_000_000_000.0;
    }

    public List<Double> successLatencies() {
        return measurements.stream()
            .filter(Measurement::success)
            .map(Measurement::latencyMs)
            .toList();
    }
}
