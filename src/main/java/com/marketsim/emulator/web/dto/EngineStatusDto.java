package com.marketsim.emulator.web.dto;

import com.marketsim.emulator.core.model.RegimeType;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class EngineStatusDto {
    private boolean paused;
    private String pauseReason;
    private long tickCount;
    private RegimeType regime;
}
