package com.marketsim.emulator.core.support;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class RateLimitedLoggerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-05T10:00:00Z"));
    private final Logger delegate = mock(Logger.class);
    private final RateLimitedLogger logger = new RateLimitedLogger(delegate, clock, 15_000);

    @Test
    void testSameCategorySuppressedWithinWindow() {
        RuntimeException error = new RuntimeException("db down");
        logger.warn("flush", "Flush failed", error);
        logger.warn("flush", "Flush failed", error);
        clock.advance(Duration.ofSeconds(10));
        logger.warn("flush", "Flush failed", error);

        verify(delegate, times(1)).warn(anyString(), any(Object.class), any(Object.class));
    }

    @Test
    void testLogsAgainAfterWindow() {
        assertTrue(logger.tryAcquire("tick"));
        assertFalse(logger.tryAcquire("tick"));
        clock.advance(Duration.ofSeconds(15));
        assertTrue(logger.tryAcquire("tick"));
    }

    @Test
    void testCategoriesAreIndependent() {
        assertTrue(logger.tryAcquire("flush"));
        assertTrue(logger.tryAcquire("match"));
        assertFalse(logger.tryAcquire("flush"));
    }
}
