package com.marketsim.emulator.core.query;

import com.marketsim.emulator.core.model.MacroFactor;
import com.marketsim.emulator.core.model.RegimeRecord;
import com.marketsim.emulator.core.model.RegimeType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class RegimeStatus {
    RegimeType regime;
    Instant since;
    RegimeRecord.Reason reason;
    double liquidityMultiplier;
    double volatilityMultiplier;
    double newsMultiplier;
    double borrowMultiplier;
    // 0 when no event-shock hold is active
    long shockHoldUntil;
    long nextReviewAt;
    Map<MacroFactor, Double> factors;
}
