package com.marketsim.emulator.core.model;

/**
 * Candle timeframes maintained by the aggregator.
 */
public enum CandleInterval {
    ONE_MINUTE(60_000L, "1m"),
    FIVE_MINUTES(300_000L, "5m"),
    FIFTEEN_MINUTES(900_000L, "15m"),
    ONE_HOUR(3_600_000L, "1h"),
    FOUR_HOURS(14_400_000L, "4h"),
    ONE_DAY(86_400_000L, "1D");

    private final long durationMs;
    private final String suffix;

    CandleInterval(long durationMs, String suffix) {
        this.durationMs = durationMs;
        this.suffix = suffix;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public String getSuffix() {
        return suffix;
    }

    /**
     * Floor-aligned start of the bucket containing {@code epochMs}.
     */
    public long bucketStart(long epochMs) {
        return Math.floorDiv(epochMs, durationMs) * durationMs;
    }

    /**
     * @throws IllegalArgumentException if no interval matches the suffix
     */
    public static CandleInterval fromSuffix(String suffix) {
        for (CandleInterval interval : values()) {
            if (interval.suffix.equals(suffix)) {
                return interval;
            }
        }
        throw new IllegalArgumentException("Unknown candle interval suffix: " + suffix);
    }
}
