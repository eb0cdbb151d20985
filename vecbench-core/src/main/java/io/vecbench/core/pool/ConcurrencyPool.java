package io.vecbench.core.pool;

import io.vecbench.core.model.Measurement;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed number of workers draining a shared index counter. Each index in
 * {@code [0, totalOperations)} is claimed by exactly one worker and produces exactly one
 * {@link Measurement}; failures are recorded, never retried here.
 */
public final class ConcurrencyPool {
    private final int concurrency;

    public ConcurrencyPool(int concurrency) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be > 0");
        }
        this.concurrency = concurrency;
    }

    public int concurrency() {
        return concurrency;
    }

    public PoolResult run(int totalOperations, WorkUnit unit) throws InterruptedIOException {
        if (totalOperations < 0) {
            throw new IllegalArgumentException("totalOperations must be >= 0");
        }
        AtomicInteger nextIndex = new AtomicInteger();
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger errors = new AtomicInteger();
        Queue<Measurement> measurements = new ConcurrentLinkedQueue<>();

        Runnable worker = () -> {
            int index;
            while ((index = nextIndex.getAndIncrement()) < totalOperations) {
                long start = System.nanoTime();
                try {
                    unit.run(index);
                    measurements.add(Measurement.success(elapsedMs(start)));
                    successes.incrementAndGet();
                } catch (Exception e) {
                    measurements.add(Measurement.failure(elapsedMs(start), e));
                    errors.incrementAndGet();
                }
            }
        };

        int workers = Math.max(1, Math.min(concurrency, totalOperations));
        ExecutorService executor = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "vecbench-worker");
            thread.setDaemon(true);
            return thread;
        });
        long startedAt = System.nanoTime();
        try {
            List<Future<?>> futures = new ArrayList<>(workers);
            for (int i = 0; i < workers; i++) {
                futures.add(executor.submit(worker));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while waiting for workers");
        } catch (ExecutionException ee) {
            throw new IllegalStateException("worker terminated unexpectedly", ee.getCause());
        } finally {
            executor.shutdownNow();
        }
        Duration duration = Duration.ofNanos(System.nanoTime() - startedAt);

        return new PoolResult(new ArrayList<>(measurements), successes.get(), errors.get(), duration);
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
