package dev.dmcode.looping.executor;

import lombok.With;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

@With
public record LoopingThreadConfiguration(
    Duration period,
    boolean catchUp,
    boolean startRunning,
    String threadName
) {
    private static final Duration DEFAULT_PERIOD = Duration.ofSeconds(5);
    private static final String DEFAULT_THREAD_NAME_PREFIX = "looping-thread-";
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    public LoopingThreadConfiguration {
        requireValidPeriod(period);
        Objects.requireNonNull(threadName, "Thread name must be provided");
    }

    public static LoopingThreadConfiguration defaults() {
        return new LoopingThreadConfiguration(
            DEFAULT_PERIOD,
            true,
            true,
            DEFAULT_THREAD_NAME_PREFIX + THREAD_COUNTER.incrementAndGet()
        );
    }

    static Duration requireValidPeriod(Duration period) {
        Objects.requireNonNull(period, "Period must be provided");
        if (period.isNegative()) {
            throw new IllegalArgumentException("Period must not be negative");
        }
        try {
            period.toNanos();
        } catch (ArithmeticException exception) {
            throw new IllegalArgumentException("Period must be representable in nanoseconds: " + period, exception);
        }
        return period;
    }
}
