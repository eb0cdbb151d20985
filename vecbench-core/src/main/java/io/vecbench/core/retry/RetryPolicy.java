package io.vecbench.core.retry;

import io.vecbench.core.backend.BackendException;
import java.util.Objects;
import java.util.function.Predicate;

public record RetryPolicy(int maxRetries, long baseDelayMs, Predicate<Exception> retryable) {
    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must be >= 0");
        }
        Objects.requireNonNull(retryable, "retryable must not be null");
    }

    public static RetryPolicy of(int maxRetries, long baseDelayMs) {
        return new RetryPolicy(maxRetries, baseDelayMs, RetryPolicy::isTransient);
    }

    public static RetryPolicy none() {
        return new RetryPolicy(0, 0, error -> false);
    }

    public static boolean isTransient(Exception error) {
        return error instanceof BackendException backendError && backendError.isTransient();
    }

    /**
     * Backoff before retry number {@code attempt} (1-based), never shorter than the server's
     * retry-after hint.
     */
    public long delayFor(int attempt, Exception error) {
        long computed = baseDelayMs * (1L << Math.min(30, attempt - 1));
        if (error instanceof BackendException backendError && backendError.retryAfterMs() > computed) {
            return backendError.retryAfterMs();
        }
        return computed;
    }
}
