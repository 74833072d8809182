package dev.dmcode.looping.executor;

import org.junit.Test;

import java.time.Duration;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class LoopingThreadConfigurationTest {

    @Test
    public void testDefaults() {
        var configuration = LoopingThreadConfiguration.defaults();
        assertEquals(Duration.ofSeconds(5), configuration.period());
        assertTrue(configuration.catchUp());
        assertTrue(configuration.startRunning());
        assertTrue(configuration.threadName().startsWith("looping-thread-"));
    }

    @Test
    public void testDefaultThreadNamesAreUnique() {
        assertNotEquals(
            LoopingThreadConfiguration.defaults().threadName(),
            LoopingThreadConfiguration.defaults().threadName()
        );
    }

    @Test
    public void testZeroPeriodAccepted() {
        assertEquals(Duration.ZERO, LoopingThreadConfiguration.defaults().withPeriod(Duration.ZERO).period());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativePeriodRejected() {
        LoopingThreadConfiguration.defaults().withPeriod(Duration.ofSeconds(-1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPeriodBeyondNanosecondRangeRejected() {
        LoopingThreadConfiguration.defaults().withPeriod(Duration.ofDays(365L * 1000));
    }

    @Test
    public void testLongestNanosecondPeriodAccepted() {
        var period = Duration.ofNanos(Long.MAX_VALUE);
        assertEquals(period, LoopingThreadConfiguration.defaults().withPeriod(period).period());
    }

    @Test(expected = NullPointerException.class)
    public void testMissingPeriodRejected() {
        LoopingThreadConfiguration.defaults().withPeriod(null);
    }

    @Test(expected = NullPointerException.class)
    public void testMissingThreadNameRejected() {
        LoopingThreadConfiguration.defaults().withThreadName(null);
    }
}
