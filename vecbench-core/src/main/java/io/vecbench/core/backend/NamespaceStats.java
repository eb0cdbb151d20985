package io.vecbench.core.backend;

public record NamespaceStats(long approxRowCount) {
}
