package io.vecbench.core.backend;

public record RecallProbeResult(double avgRecall, double avgAnnCount, double avgExhaustiveCount) {
}
