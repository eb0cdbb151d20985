package io.vecbench.core.retry;

import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one remote call, retrying transient failures with exponential backoff. There is no
 * jitter, so callers sharing a backend retry in lockstep.
 */
public final class RetryExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(RetryExecutor.class);

    private final Sleeper sleeper;

    public RetryExecutor(Sleeper sleeper) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    public <T> T execute(RetryableCall<T> call, RetryPolicy policy) throws IOException {
        return execute(call, policy, RetryListener.NONE);
    }

    public <T> T execute(RetryableCall<T> call, RetryPolicy policy, RetryListener listener) throws IOException {
        int attempt = 0;
        while (true) {
            try {
                return call.call();
            } catch (IOException | RuntimeException e) {
                if (!policy.retryable().test(e) || attempt >= policy.maxRetries()) {
                    throw e;
                }
                attempt++;
                long delayMs = policy.delayFor(attempt, e);
                LOG.debug("Retry {}/{} in {}ms after: {}", attempt, policy.maxRetries(), delayMs, e.getMessage());
                listener.onRetry(attempt, policy.maxRetries(), delayMs, e);
                sleeper.sleep(delayMs);
            }
        }
    }
}
