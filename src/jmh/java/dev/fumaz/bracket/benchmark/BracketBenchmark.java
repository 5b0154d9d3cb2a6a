package dev.fumaz.bracket.benchmark;

import dev.fumaz.bracket.Bracket;
import dev.fumaz.bracket.outcome.Outcome;
import dev.fumaz.bracket.resource.SafeCloseable;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class BracketBenchmark {

    @State(Scope.Thread)
    public static class CounterState {

        long released;

        Counter open() {
            return new Counter(this);
        }
    }

    @Benchmark
    public long tryWithResources(CounterState state) {
        try (Counter counter = state.open()) {
            return counter.next();
        }
    }

    @Benchmark
    public Long bracket(CounterState state) {
        return Bracket.bracket(state::open, Counter::close, Counter::next);
    }

    @Benchmark
    public Long withResourceInfallible(CounterState state) {
        return Bracket.withResourceInfallible(state::open, Counter::next);
    }

    @Benchmark
    public void attemptWithFailingUse(CounterState state, Blackhole blackhole) {
        Outcome<Long> outcome = Bracket.attempt(state::open, Counter::close, counter -> {
            throw new IllegalStateException("failing use");
        });

        blackhole.consume(outcome);
    }

    static final class Counter implements SafeCloseable {

        private final CounterState state;

        Counter(CounterState state) {
            this.state = state;
        }

        long next() {
            return state.released + 1;
        }

        @Override
        public void close() {
            state.released++;
        }
    }
}
