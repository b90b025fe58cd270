package com.typelift.basis.benchmarks;

import com.typelift.basis.functional.Trampoline;
import com.typelift.basis.functional.Trampolines;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static com.typelift.basis.functional.Trampoline.later;
import static com.typelift.basis.functional.Trampoline.now;

/**
 * Driver loop benchmarks.
 *
 * Measures evaluation of the common chain shapes:
 * - Left-nested binds (re-associated while resuming)
 * - Right-nested binds (each continuation builds the next bind)
 * - Mutual recursion through suspensions
 * - sequence over a list
 *
 * Construction of the prebuilt chains happens in setup so only evaluation is measured.
 *
 * Run with:
 * java -cp benchmarks/target/classes:... com.typelift.basis.benchmarks.TrampolineBenchmark
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 2, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 3, time = 3, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class TrampolineBenchmark {

    @Param({"1000", "100000"})
    private int depth;

    private Trampoline<Integer> leftNested;
    private Trampoline<List<Integer>> sequenced;

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(".*TrampolineBenchmark.*")
                .build();

        new Runner(opt).run();
    }

    @Setup
    public void setup() {
        Trampoline<Integer> t = now(0);
        for (int i = 0; i < depth; i++) {
            t = t.bind(x -> now(x + 1));
        }
        leftNested = t;

        List<Trampoline<Integer>> elements = new ArrayList<>(depth);
        for (int i = 0; i < depth; i++) {
            int value = i;
            elements.add(later(() -> now(value)));
        }
        sequenced = Trampolines.sequence(elements);
    }

    private static Trampoline<Integer> rightNested(int remaining, int acc) {
        if (remaining == 0) {
            return now(acc);
        }
        return now(acc).bind(x -> rightNested(remaining - 1, x + 1));
    }

    private static Trampoline<Boolean> isEven(int n) {
        return n == 0 ? now(true) : later(() -> isOdd(n - 1));
    }

    private static Trampoline<Boolean> isOdd(int n) {
        return n == 0 ? now(false) : later(() -> isEven(n - 1));
    }

    /**
     * Plain loop doing the same arithmetic, for scale.
     */
    @Benchmark
    public void baselineLoop(Blackhole bh) {
        int x = 0;
        for (int i = 0; i < depth; i++) {
            x = x + 1;
        }
        bh.consume(x);
    }

    @Benchmark
    public void leftNestedBinds(Blackhole bh) {
        bh.consume(leftNested.run());
    }

    @Benchmark
    public void rightNestedBinds(Blackhole bh) {
        bh.consume(rightNested(depth, 0).run());
    }

    @Benchmark
    public void mutualRecursion(Blackhole bh) {
        bh.consume(isEven(depth).run());
    }

    @Benchmark
    public void sequence(Blackhole bh) {
        bh.consume(sequenced.run());
    }
}
