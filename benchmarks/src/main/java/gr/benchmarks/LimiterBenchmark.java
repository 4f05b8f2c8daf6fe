package gr.benchmarks;

import gr.core.clock.SystemClock;
import gr.core.clock.ThreadSleeper;
import gr.engine.config.GateSettings;
import gr.engine.gate.CallGate;
import gr.engine.limiter.DualBudgetRateLimiter;
import gr.engine.limiter.RateLimiterConfig;
import gr.engine.retry.FailureClassifier;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmarks for the dual-budget limiter and the full call gate.
 *
 * Measures throughput (ops/sec) across 3 scenarios:
 * - tryAcquire: one uncontended joint probe + commit
 * - parallel: 8 threads contending for the same lock
 * - gateInvoke: acquire + retry wrapper around a no-op operation
 *
 * Budgets are sized so nothing ever waits; this measures the bookkeeping cost only.
 *
 * Run:
 *   java -jar benchmarks/target/benchmarks.jar Limiter
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Benchmark)
public class LimiterBenchmark {

    private static final long HUGE = Long.MAX_VALUE / 4;

    private DualBudgetRateLimiter limiter;
    private CallGate gate;

    @Setup
    public void setup() {
        SystemClock clock = SystemClock.instance();
        limiter = new DualBudgetRateLimiter(
            clock, ThreadSleeper.instance(), new RateLimiterConfig(HUGE, 1e12, HUGE, 1e12));

        GateSettings settings = new GateSettings(true, HUGE, HUGE, 1, 0, 0, 2);
        gate = CallGate.create(settings, clock, ThreadSleeper.instance(), FailureClassifier.standard());
    }

    @Benchmark
    public void tryAcquire(Blackhole bh) {
        bh.consume(limiter.tryAcquire(1, 250));
    }

    @Benchmark
    @Threads(8)
    public void parallel(Blackhole bh) {
        bh.consume(limiter.tryAcquire(1, 250));
    }

    @Benchmark
    public Object gateInvoke() throws Exception {
        return gate.invoke(() -> Boolean.TRUE, 250);
    }
}
