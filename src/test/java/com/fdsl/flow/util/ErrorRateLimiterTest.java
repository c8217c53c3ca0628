package com.fdsl.flow.util;

import org.apache.logging.log4j.LogManager;
import org.junit.Test;

import static org.junit.Assert.*;

public class ErrorRateLimiterTest {

    @Test
    public void testThrottling() {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), 60_000);

        assertTrue(limiter.log("first", null));
        assertFalse(limiter.log("second", null));
        assertFalse(limiter.log("third", new RuntimeException("x")));
        assertEquals(2, limiter.suppressedCount());
    }

    @Test
    public void testZeroIntervalNeverSuppresses() throws InterruptedException {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), 0);

        assertTrue(limiter.log("first", null));
        Thread.sleep(1);
        assertTrue(limiter.log("second", null));
        assertEquals(0, limiter.suppressedCount());
    }
}
