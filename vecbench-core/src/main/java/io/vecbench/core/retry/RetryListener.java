package io.vecbench.core.retry;

@FunctionalInterface
public interface RetryListener {
    RetryListener NONE = (attempt, maxRetries, delayMs, error) -> {
    };

    void onRetry(int attempt, int maxRetries, long delayMs, Exception error);
}
