package gr.engine.limiter;

import gr.core.clock.SystemClock;
import gr.core.clock.ThreadSleeper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrency tests for DualBudgetRateLimiter on the real clock.
 *
 * Focus:
 * - No over-grant under contention
 * - Waiters do not hold the lock while sleeping
 * - Interruption of a waiting thread
 */
class DualBudgetRateLimiterConcurrencyTest {

    @Test
    void testConcurrent_neverGrantsMoreThanBudget() throws InterruptedException {
        SystemClock clock = SystemClock.instance();
        // 100 requests and 1000 tokens per minute: refill is negligible within the test
        DualBudgetRateLimiter limiter = new DualBudgetRateLimiter(
            clock, ThreadSleeper.instance(), RateLimiterConfig.perMinute(100, 1_000));

        int numThreads = 20;
        int callsPerThread = 10;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);

        AtomicInteger granted = new AtomicInteger(0);
        AtomicLong grantedTokens = new AtomicLong(0);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        long startNanos = clock.nowNanos();

        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < callsPerThread; j++) {
                        AcquireResult result = limiter.acquire(1, 7, Deadline.after(clock, Duration.ofMillis(50)));
                        if (result.granted()) {
                            granted.incrementAndGet();
                            grantedTokens.addAndGet(7);
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS), "Test timed out");

        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS), "Executor did not terminate");

        double elapsedSeconds = (clock.nowNanos() - startNanos) / 1_000_000_000.0;
        double countBound = 100 + 100 / 60.0 * elapsedSeconds;
        double tokenBound = 1_000 + 1_000 / 60.0 * elapsedSeconds;

        assertTrue(granted.get() <= countBound, "granted " + granted.get() + " > " + countBound);
        assertTrue(grantedTokens.get() <= tokenBound, "granted tokens " + grantedTokens.get() + " > " + tokenBound);
        // 1000 tokens / 7 per call = 142 calls, so the request budget (100) is what runs out
        assertTrue(granted.get() >= 100, "the full request budget should have been handed out");

        BudgetSnapshot snapshot = limiter.snapshot();
        assertTrue(snapshot.countAvailable() >= 0);
        assertTrue(snapshot.throughputAvailable() >= 0);
    }

    @Test
    void testWaiterDoesNotBlockOtherCallers() throws Exception {
        SystemClock clock = SystemClock.instance();
        // throughput refills ~1.7 tokens/sec, so a 100-token deficit means a long wait
        DualBudgetRateLimiter limiter = new DualBudgetRateLimiter(
            clock, ThreadSleeper.instance(), RateLimiterConfig.perMinute(60, 100));
        assertTrue(limiter.acquire(1, 100).granted());

        ExecutorService executor = Executors.newSingleThreadExecutor();
        CountDownLatch waiting = new CountDownLatch(1);
        Future<AcquireResult> waiter = executor.submit(() -> {
            waiting.countDown();
            return limiter.acquire(1, 100, Deadline.after(clock, Duration.ofMillis(500)));
        });

        assertTrue(waiting.await(5, TimeUnit.SECONDS));
        Thread.sleep(50);

        long before = System.nanoTime();
        AcquireResult small = limiter.acquire(1, 0, Deadline.after(clock, Duration.ofMillis(100)));
        long tookMillis = (System.nanoTime() - before) / 1_000_000;

        assertTrue(small.granted(), "count-only call should pass while another caller waits");
        assertTrue(tookMillis < 100, "call was blocked for " + tookMillis + "ms");

        AcquireResult waited = waiter.get(5, TimeUnit.SECONDS);
        assertEquals(AcquireResult.Outcome.TIMED_OUT, waited.outcome());
        assertEquals(Budget.THROUGHPUT, waited.blockingBudget());

        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
    }

    @Test
    void testInterruptingWaiter_stopsTheWait() throws Exception {
        SystemClock clock = SystemClock.instance();
        DualBudgetRateLimiter limiter = new DualBudgetRateLimiter(
            clock, ThreadSleeper.instance(), RateLimiterConfig.perMinute(1, 100));
        assertTrue(limiter.acquire(1, 0).granted());

        CompletableFuture<Throwable> outcome = new CompletableFuture<>();
        Thread waiter = new Thread(() -> {
            try {
                limiter.acquire(1, 0);
                outcome.complete(null);
            } catch (Throwable t) {
                outcome.complete(t);
            }
        });
        waiter.start();
        Thread.sleep(100);
        waiter.interrupt();

        Throwable thrown = outcome.get(5, TimeUnit.SECONDS);
        assertTrue(thrown instanceof InterruptedException, "expected InterruptedException, got " + thrown);
        assertEquals(0.0, limiter.snapshot().countAvailable(), 0.01);
    }
}
