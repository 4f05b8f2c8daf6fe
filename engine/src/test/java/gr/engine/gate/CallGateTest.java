package gr.engine.gate;

import gr.core.clock.ManualClock;
import gr.engine.config.GateSettings;
import gr.engine.error.CallGateException;
import gr.engine.error.ErrorKind;
import gr.engine.error.PermanentOperationException;
import gr.engine.error.RateLimitTimedOutException;
import gr.engine.error.RateLimitUnsatisfiableException;
import gr.engine.error.RetriesExhaustedException;
import gr.engine.error.TransientOperationException;
import gr.engine.limiter.Budget;
import gr.engine.limiter.Deadline;
import gr.engine.retry.FailureClassifier;
import gr.engine.retry.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CallGate: limit first, then retry, with outcomes passed through untouched.
 */
class CallGateTest {

    private static final long SECOND = 1_000_000_000L;

    private ManualClock clock;
    private CallGate gate;
    private AtomicInteger calls;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(0L);
        gate = CallGate.create(GateSettings.defaults(), clock, clock, FailureClassifier.standard());
        calls = new AtomicInteger();
    }

    private Callable<String> counting(String value) {
        return () -> {
            calls.incrementAndGet();
            return value;
        };
    }

    // ========== RATE LIMIT OUTCOMES ==========

    @Test
    void testUnsatisfiable_operationNeverInvoked() throws InterruptedException {
        RateLimitUnsatisfiableException e = assertThrows(RateLimitUnsatisfiableException.class,
            () -> gate.invoke(counting("never"), 100_000));

        assertEquals(0, calls.get());
        assertEquals(Budget.THROUGHPUT, e.budget());
        assertEquals(100_000, e.requestedCost());
        assertEquals(90_000, e.capacity());
        assertEquals(ErrorKind.RATE_LIMIT_UNSATISFIABLE, e.kind());
        assertTrue(e.kind().isRateLimit());
        assertTrue(clock.sleeps().isEmpty());
    }

    @Test
    void testTimedOut_operationNeverInvokedAndNotRetried() throws Exception {
        for (int i = 0; i < 60; i++) {
            gate.invoke(counting("ok"), 10);
        }
        calls.set(0);

        RateLimitTimedOutException e = assertThrows(RateLimitTimedOutException.class,
            () -> gate.invoke(counting("late"), 10, Deadline.after(clock, Duration.ofMillis(300))));

        assertEquals(0, calls.get());
        assertEquals(Budget.COUNT, e.budget());
        assertEquals(Duration.ofMillis(300), e.waited());
        assertEquals(List.of(300_000_000L), clock.sleeps(), "One limiter wait, no retry backoff");
        assertEquals("Rate limit reached, try again later", e.userMessage());
    }

    @Test
    void testSixtyFirstCall_waitsForBudgetThenRuns() throws Exception {
        for (int i = 0; i < 60; i++) {
            assertEquals("ok", gate.invoke(counting("ok"), 0));
        }
        assertTrue(clock.sleeps().isEmpty());

        assertEquals("ok", gate.invoke(counting("ok"), 0));

        assertEquals(61, calls.get());
        assertEquals(List.of(SECOND), clock.sleeps());
    }

    @Test
    void testDisabledRateLimiting_skipsAcquire() throws Exception {
        GateSettings disabled = new GateSettings(false, 1, 10, 3, 2, 10, 2);
        CallGate open = CallGate.create(disabled, clock, clock, FailureClassifier.standard());

        assertFalse(open.rateLimitingEnabled());
        for (int i = 0; i < 5; i++) {
            assertEquals("ok", open.invoke(counting("ok"), 1_000_000));
        }

        assertEquals(5, calls.get());
        assertTrue(clock.sleeps().isEmpty());
        assertEquals(1.0, open.limiter().snapshot().countAvailable(), 1e-9, "limiter never touched");
    }

    @Test
    void testNegativeCost_rejectedWhetherOrNotLimitingIsEnabled() {
        GateSettings disabled = new GateSettings(false, 1, 10, 3, 2, 10, 2);
        CallGate open = CallGate.create(disabled, clock, clock, FailureClassifier.standard());

        for (CallGate candidate : List.of(gate, open)) {
            IllegalArgumentException throughput = assertThrows(IllegalArgumentException.class,
                () -> candidate.invoke(counting("never"), -1));
            assertTrue(throughput.getMessage().contains("throughputCost"));

            IllegalArgumentException count = assertThrows(IllegalArgumentException.class,
                () -> candidate.invoke(counting("never"), -1, 10, Deadline.none(),
                    RetryPolicy.ofSeconds(1, 1, 1, 2), FailureClassifier.standard()));
            assertTrue(count.getMessage().contains("countCost"));
        }

        assertEquals(0, calls.get());
        assertTrue(clock.sleeps().isEmpty());
    }

    // ========== RETRY OUTCOMES ==========

    @Test
    void testTransientFailures_retriedAfterSingleAcquire() throws Exception {
        String result = gate.invoke(() -> {
            if (calls.incrementAndGet() < 3) throw new TransientOperationException("503");
            return "done";
        }, 500);

        assertEquals("done", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(2 * SECOND, 4 * SECOND), clock.sleeps());
        // charged once, not once per attempt; 6s of refill puts back the single request
        assertEquals(60.0, gate.limiter().snapshot().countAvailable(), 1e-6);
    }

    @Test
    void testRetriesExhausted_passedThroughVerbatim() {
        RetriesExhaustedException e = assertThrows(RetriesExhaustedException.class,
            () -> gate.invoke(() -> {
                calls.incrementAndGet();
                throw new TransientOperationException("timeout");
            }, 10));

        assertEquals(3, calls.get());
        assertEquals(3, e.attemptCount());
        assertEquals(ErrorKind.RETRIES_EXHAUSTED, e.kind());
        assertFalse(e.kind().isRateLimit());
    }

    @Test
    void testPermanentFailure_passedThroughVerbatim() {
        PermanentOperationException e = assertThrows(PermanentOperationException.class,
            () -> gate.invoke(() -> {
                calls.incrementAndGet();
                throw new IllegalArgumentException("invalid input");
            }, 10));

        assertEquals(1, calls.get());
        assertTrue(e.getCause() instanceof IllegalArgumentException);
        assertTrue(clock.sleeps().isEmpty());
    }

    @Test
    void testPerCallPolicyAndClassifier() {
        RetryPolicy twoQuickAttempts = RetryPolicy.ofSeconds(2, 0.5, 1, 2);

        RetriesExhaustedException e = assertThrows(RetriesExhaustedException.class,
            () -> gate.invoke(() -> {
                calls.incrementAndGet();
                throw new IllegalStateException("flaky");
            }, 1, 10, Deadline.none(), twoQuickAttempts, FailureClassifier.alwaysTransient()));

        assertEquals(2, calls.get());
        assertEquals(2, e.attemptCount());
        assertEquals(List.of(500_000_000L), clock.sleeps());
    }

    // ========== FALLBACK ==========

    @Test
    void testInvokeOrDefault_returnsFallbackOnGateError() throws InterruptedException {
        String result = gate.invokeOrDefault(() -> {
            calls.incrementAndGet();
            throw new IllegalArgumentException("bad");
        }, 10, "fallback");

        assertEquals("fallback", result);
        assertEquals(1, calls.get());
    }

    @Test
    void testInvokeOrDefault_returnsValueOnSuccess() throws InterruptedException {
        assertEquals("value", gate.invokeOrDefault(counting("value"), 10, "fallback"));
    }

    @Test
    void testInvokeOrDefault_rateLimitErrorAlsoFallsBack() throws InterruptedException {
        assertEquals("fallback", gate.invokeOrDefault(counting("never"), 1_000_000, "fallback"));
        assertEquals(0, calls.get());
    }

    @Test
    void testEveryGateErrorIsACallGateException() {
        CallGateException e = assertThrows(CallGateException.class, () -> gate.invoke(counting("x"), 1_000_000));
        assertTrue(e instanceof RateLimitUnsatisfiableException);
    }
}
