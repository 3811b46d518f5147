package com.acdm.market.acdm_market.execution;

import com.acdm.market.acdm_market.exception.ValidationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class MarketExecutorTest {

    private final MarketExecutor executor = new MarketExecutor(2_000);

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    void runsCallsOnTheMarketThread() {
        assertEquals("market-executor", executor.submit(() -> Thread.currentThread().getName()));
    }

    @Test
    void rethrowsMarketExceptionsUnchanged() {
        ValidationException e = assertThrows(ValidationException.class, () -> executor.submit(() -> {
            throw new ValidationException("Not valid amount");
        }));
        assertEquals("Not valid amount", e.getMessage());
    }

    @Test
    void wrapsCheckedFailures() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> executor.submit(() -> {
            throw new Exception("boom");
        }));
        assertEquals("boom", e.getCause().getMessage());
    }

    @Test
    void callsFromManyThreadsNeverOverlap() throws Exception {
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        int[] inFlight = {0};
        ExecutorService clients = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(200);
        for (int i = 0; i < 200; i++) {
            int n = i;
            clients.execute(() -> {
                executor.submit(() -> {
                    inFlight[0]++;
                    seen.add(inFlight[0]);
                    inFlight[0]--;
                    return n;
                });
                done.countDown();
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        clients.shutdown();
        assertEquals(200, seen.size());
        assertTrue(seen.stream().allMatch(count -> count == 1));
    }

    @Test
    void slowCallsTimeOutWithAnUnknownOutcome() {
        MarketExecutor impatient = new MarketExecutor(50);
        try {
            MarketCallTimeoutException e = assertThrows(MarketCallTimeoutException.class,
                    () -> impatient.submit(() -> {
                        Thread.sleep(1_000);
                        return null;
                    }));
            assertTrue(e.isStarted());
        } finally {
            impatient.close();
        }
    }

    @Test
    void queuedCallThatTimesOutNeverRuns() throws Exception {
        MarketExecutor impatient = new MarketExecutor(100);
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean ran = new AtomicBoolean();
        ExecutorService client = Executors.newSingleThreadExecutor();
        try {
            client.execute(() -> {
                try {
                    impatient.submit(() -> {
                        running.countDown();
                        return release.await(5, TimeUnit.SECONDS);
                    });
                } catch (MarketCallTimeoutException ignored) {
                    // the blocking call outlives its own timeout on purpose
                }
            });
            assertTrue(running.await(5, TimeUnit.SECONDS));

            MarketCallTimeoutException e = assertThrows(MarketCallTimeoutException.class,
                    () -> impatient.submit(() -> {
                        ran.set(true);
                        return null;
                    }));
            assertFalse(e.isStarted());
        } finally {
            release.countDown();
            impatient.close();
            client.shutdown();
        }
        assertFalse(ran.get());
    }
}
