package io.vecbench.core.stats;

public record ConfidenceInterval(double lower, double upper) {
}
