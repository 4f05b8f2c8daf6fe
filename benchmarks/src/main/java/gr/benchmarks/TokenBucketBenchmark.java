package gr.benchmarks;

import gr.core.algorithms.token_bucket.TokenBucket;
import gr.core.clock.SystemClock;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmarks for the single token bucket.
 *
 * Measures throughput (ops/sec) for 3 scenarios:
 * - allow: Large capacity, always granted (hot path)
 * - reject: Exhausted bucket, always rejected with a retry-after
 * - unsatisfiable: Cost above capacity, rejected before any arithmetic on the deficit
 *
 * The bucket is not thread-safe, so state is per thread.
 *
 * Run:
 *   java -jar benchmarks/target/benchmarks.jar TokenBucket
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Thread)
public class TokenBucketBenchmark {

    private TokenBucket allowBucket;
    private TokenBucket rejectBucket;

    @Setup
    public void setup() {
        SystemClock clock = SystemClock.instance();

        allowBucket = new TokenBucket(clock, 1_000_000_000L, 1_000_000_000.0);

        // One token, refilled about once every 30 years
        rejectBucket = new TokenBucket(clock, 1, 1e-9);
        rejectBucket.tryConsume(1);
    }

    @Benchmark
    public void allow(Blackhole bh) {
        bh.consume(allowBucket.tryConsume(1));
    }

    @Benchmark
    public void reject(Blackhole bh) {
        bh.consume(rejectBucket.tryConsume(1));
    }

    @Benchmark
    public void unsatisfiable(Blackhole bh) {
        bh.consume(rejectBucket.tryConsume(2));
    }
}
