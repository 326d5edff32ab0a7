package com.obseq.util;

import org.apache.logging.log4j.LogManager;
import org.junit.Test;

import static org.junit.Assert.*;

public class ErrorRateLimiterTest {

    @Test
    public void testRepeatedFailuresAreThrottled() {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), 60_000);
        IllegalStateException failure = new IllegalStateException("expected in test");

        assertTrue(limiter.log("first", failure));
        for (int i = 0; i < 5; i++)
            assertFalse(limiter.log("again", failure));

        assertEquals(5, limiter.suppressed());
    }

    @Test
    public void testReportsAgainAfterTheInterval() throws Exception {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), 1);
        IllegalStateException failure = new IllegalStateException("expected in test");

        assertTrue(limiter.log("first", failure));
        limiter.log("maybe suppressed", failure);
        Thread.sleep(20);

        assertTrue(limiter.log("later", failure));
        // The written report carries the suppressed count
        assertEquals(0, limiter.suppressed());
    }
}
