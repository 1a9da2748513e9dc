package com.marketsim.emulator.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RegimeRecord {
    private UUID id;
    private RegimeType regime;
    private Instant startedAt;
    private Instant endedAt;
    private Reason reason;

    public boolean isActive() {
        return endedAt == null;
    }

    public RegimeRecord copy() {
        return toBuilder().build();
    }

    public enum Reason {
        INITIAL,
        SCHEDULED,
        NEWS_SHOCK,
        SHOCK_EXPIRED
    }
}
