package com.marketsim.emulator.core.price;

import com.marketsim.emulator.core.model.AssetClass;
import com.marketsim.emulator.core.model.MacroFactor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;

/**
 * Time-of-day multipliers. All session boundaries are in UTC.
 */
@Component
public class SessionClock {

    private static final LocalTime US_OPEN = LocalTime.of(13, 30);
    private static final LocalTime US_CLOSE = LocalTime.of(20, 0);
    private static final LocalTime LONDON_OVERLAP_START = LocalTime.of(12, 0);
    private static final LocalTime LONDON_OVERLAP_END = LocalTime.of(16, 0);
    private static final LocalTime US_OPENING_HOUR_END = LocalTime.of(14, 30);
    private static final LocalTime US_CLOSING_HOUR_START = LocalTime.of(19, 0);

    public boolean isUsSession(Instant at) {
        LocalTime time = timeOf(at);
        return !time.isBefore(US_OPEN) && time.isBefore(US_CLOSE);
    }

    public boolean isLondonOverlap(Instant at) {
        LocalTime time = timeOf(at);
        return !time.isBefore(LONDON_OVERLAP_START) && time.isBefore(LONDON_OVERLAP_END);
    }

    public double factorNoiseMultiplier(MacroFactor factor, Instant at) {
        switch (factor) {
            case RISK_ON:
            case VOL:
                return isUsSession(at) ? 1.25 : 1.0;
            case USD:
            case RATES:
                return isLondonOverlap(at) ? 1.2 : 1.0;
            default:
                return 1.0;
        }
    }

    public double volatilityMultiplier(AssetClass assetClass, Instant at) {
        if (!assetClass.followsEquitySession()) {
            return 1.0;
        }
        if (!isUsSession(at)) {
            return 0.6;
        }
        return isOpeningOrClosingHour(at) ? 1.3 : 1.0;
    }

    public double volumeMultiplier(AssetClass assetClass, Instant at) {
        if (assetClass == AssetClass.FOREX) {
            return isLondonOverlap(at) ? 1.3 : 1.0;
        }
        if (!assetClass.followsEquitySession()) {
            return 1.0;
        }
        if (!isUsSession(at)) {
            return 0.35;
        }
        return isOpeningOrClosingHour(at) ? 1.6 : 1.0;
    }

    private boolean isOpeningOrClosingHour(Instant at) {
        LocalTime time = timeOf(at);
        return time.isBefore(US_OPENING_HOUR_END) || !time.isBefore(US_CLOSING_HOUR_START);
    }

    private static LocalTime timeOf(Instant at) {
        return LocalTime.ofInstant(at, ZoneOffset.UTC);
    }
}
