package io.vecbench.core.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.vecbench.core.backend.BackendException;
import io.vecbench.core.backend.NamespaceNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class RetryExecutorTest {

    private final List<Long> sleeps = new ArrayList<>();
    private final RetryExecutor executor = new RetryExecutor(sleeps::add);

    @Test
    void shouldRetryTransientFailuresWithExponentialBackoff() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        List<Integer> notified = new ArrayList<>();

        String result = executor.execute(() -> {
            if (calls.incrementAndGet() <= 2) {
                throw new BackendException(503, "unavailable");
            }
            return "ok";
        }, RetryPolicy.of(3, 1000), (attempt, maxRetries, delayMs, error) -> notified.add(attempt));

        assertThat(result).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(3);
        assertThat(sleeps).containsExactly(1000L, 2000L);
        assertThat(notified).containsExactly(1, 2);
    }

    @Test
    void shouldNotRetryPermanentFailures() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute(() -> {
            calls.incrementAndGet();
            throw new NamespaceNotFoundException("/v2/namespaces/wiki-gte");
        }, RetryPolicy.of(3, 1000)))
            .isInstanceOf(NamespaceNotFoundException.class);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void shouldRethrowLastErrorWhenRetriesAreExhausted() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute(() -> {
            throw new BackendException(429, "slow down " + calls.incrementAndGet());
        }, RetryPolicy.of(3, 100)))
            .isInstanceOf(BackendException.class)
            .hasMessageContaining("slow down 4");

        assertThat(calls.get()).isEqualTo(4);
        assertThat(sleeps).containsExactly(100L, 200L, 400L);
    }

    @Test
    void shouldHonourLargerRetryAfterHint() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        executor.execute(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new BackendException(429, "rate limited", 5000);
            }
            return null;
        }, RetryPolicy.of(3, 1000));

        assertThat(sleeps).containsExactly(5000L);
    }

    @Test
    void shouldNotRetryPlainIoErrorsByDefault() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute(() -> {
            calls.incrementAndGet();
            throw new IOException("connection reset");
        }, RetryPolicy.of(3, 1000)))
            .isInstanceOf(IOException.class)
            .hasMessage("connection reset");

        assertThat(calls.get()).isEqualTo(1);
    }
}
