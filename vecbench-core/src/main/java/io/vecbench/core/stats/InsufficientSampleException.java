package io.vecbench.core.stats;

/**
 * Raised when a statistic is undefined for the sample size, e.g. a sample
 * standard deviation over a single value.
 */
public final class InsufficientSampleException extends IllegalArgumentException {
    public InsufficientSampleException(String message) {
        super(message);
    }
}
