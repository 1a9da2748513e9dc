package com.marketsim.emulator.core.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class Microstructure {
    double avgDailyDollarVolume;
    double baseSpreadBps;
    double impactCoeff;
    double commissionBps;
    double commissionMinUsd;
    double borrowAprShort;

    public void validate(String ticker) {
        if (avgDailyDollarVolume <= 0) {
            throw new IllegalArgumentException(ticker + ": avgDailyDollarVolume must be positive");
        }
        if (baseSpreadBps < 0 || impactCoeff < 0 || commissionBps < 0 || commissionMinUsd < 0 || borrowAprShort < 0) {
            throw new IllegalArgumentException(ticker + ": microstructure parameters must not be negative");
        }
    }
}
