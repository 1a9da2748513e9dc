package com.marketsim.emulator.core.support;

import org.slf4j.Logger;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Suppresses repeats of the same error category within a window so that a storage outage
 * does not produce one log line per tick.
 */
public class RateLimitedLogger {

    private final Logger delegate;
    private final Clock clock;
    private final long intervalMs;
    private final Map<String, Long> lastLoggedAt = new ConcurrentHashMap<>();

    public RateLimitedLogger(Logger delegate, Clock clock, long intervalMs) {
        this.delegate = delegate;
        this.clock = clock;
        this.intervalMs = intervalMs;
    }

    public void warn(String category, String message, Throwable error) {
        if (tryAcquire(category)) {
            delegate.warn("{}: {}", message, error.getMessage());
        }
    }

    public void error(String category, String message, Throwable error) {
        if (tryAcquire(category)) {
            delegate.error(message, error);
        }
    }

    boolean tryAcquire(String category) {
        long now = clock.millis();
        boolean[] acquired = {false};
        lastLoggedAt.compute(category, (key, previous) -> {
            if (previous == null || now - previous >= intervalMs) {
                acquired[0] = true;
                return now;
            }
            return previous;
        });
        return acquired[0];
    }
}
