package dev.dmcode.looping.executor;

import org.junit.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class LoopingThreadScenarioTest {

    private static final Duration PERIOD = Duration.ofMillis(200);
    private static final long ROUTINE_MILLIS = 100;

    private final List<Long> started = new CopyOnWriteArrayList<>();
    private final AtomicInteger completed = new AtomicInteger();

    @Test
    public void testPauseWithoutResetKeepsSchedule() throws Exception {
        long start = System.nanoTime();
        try (var loopingThread = new LoopingThread(PERIOD, this::routine)) {
            Thread.sleep(360);
            loopingThread.pause(false);
            assertEquals(2, started.size());
            Thread.sleep(30);
            loopingThread.resume();
            Thread.sleep(400);
        }
        assertEquals(4, started.size());
        assertEquals(4, completed.get());
        assertWithin(410, 480, millisSince(start, 2));
        assertWithin(610, 680, millisSince(start, 3));
    }

    @Test
    public void testCloseWaitsForInvocationInFlight() throws Exception {
        long start = System.nanoTime();
        long closing;
        try (var loopingThread = new LoopingThread(PERIOD, this::routine)) {
            Thread.sleep(650);
            closing = System.nanoTime();
        }
        long closeMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - closing);
        assertEquals(4, started.size());
        assertEquals(4, completed.get());
        assertWithin(580, 660, millisSince(start, 3));
        assertTrue(closeMillis < PERIOD.toMillis());
    }

    private void routine() throws InterruptedException {
        started.add(System.nanoTime());
        Thread.sleep(ROUTINE_MILLIS);
        completed.incrementAndGet();
    }

    private long millisSince(long start, int invocation) {
        return TimeUnit.NANOSECONDS.toMillis(started.get(invocation) - start);
    }

    private static void assertWithin(long min, long max, long actual) {
        assertTrue("Expected " + actual + " within [" + min + ", " + max + "]", actual >= min && actual <= max);
    }
}
