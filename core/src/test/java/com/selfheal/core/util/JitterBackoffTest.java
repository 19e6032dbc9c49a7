package com.selfheal.core.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JitterBackoffTest {

    @Test
    void testExponentialGrowthIsCapped() {
        Duration base = Duration.ofMillis(200);
        Duration max = Duration.ofMillis(1000);

        assertEquals(200, JitterBackoff.next(0, base, max, Duration.ZERO).toMillis());
        assertEquals(400, JitterBackoff.next(1, base, max, Duration.ZERO).toMillis());
        assertEquals(800, JitterBackoff.next(2, base, max, Duration.ZERO).toMillis());
        assertEquals(1000, JitterBackoff.next(3, base, max, Duration.ZERO).toMillis());
        assertEquals(1000, JitterBackoff.next(60, base, max, Duration.ZERO).toMillis());
    }

    @Test
    void testJitterStaysWithinBound() {
        for (int i = 0; i < 100; i++) {
            long delay = JitterBackoff.next(0, Duration.ofMillis(100), Duration.ofSeconds(1), Duration.ofMillis(50)).toMillis();
            assertTrue(delay >= 100 && delay <= 150, "delay out of range: " + delay);
        }
    }

    @Test
    void testZeroBaseMeansNoWait() {
        assertEquals(Duration.ZERO, JitterBackoff.next(2, Duration.ZERO, Duration.ZERO, Duration.ZERO));
    }
}
