package com.acdm.market.acdm_market.execution;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs market calls one at a time on a single dedicated thread, giving all
 * incoming requests one total order.
 */
@Slf4j
public class MarketExecutor implements AutoCloseable {

    private final ExecutorService executor;
    private final long timeoutMillis;

    public MarketExecutor(long timeoutMillis) {
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "market-executor");
            thread.setDaemon(true);
            return thread;
        });
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * Submit a call and wait for its outcome. Exceptions thrown by the call are rethrown unchanged.
     *
     * @throws MarketCallTimeoutException if the call did not finish in time; a call
     *     that had not started by then never runs
     */
    public <T> T submit(Callable<T> call) {
        AtomicBoolean claimed = new AtomicBoolean();
        Future<T> future = executor.submit(() -> {
            if (!claimed.compareAndSet(false, true)) {
                throw new CancellationException("Market call abandoned before it started");
            }
            return call.call();
        });
        try {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Market call failed", cause);
        } catch (TimeoutException e) {
            if (claimed.compareAndSet(false, true)) {
                future.cancel(false);
                log.warn("Market call did not start within {} ms and was cancelled", timeoutMillis);
                throw new MarketCallTimeoutException(timeoutMillis, false);
            }
            log.error("Market call did not finish within {} ms, its outcome is unknown", timeoutMillis);
            throw new MarketCallTimeoutException(timeoutMillis, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for market call", e);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
