package com.marketsim.emulator.web.dto;

import com.marketsim.emulator.core.model.RegimeType;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class NewsShockResponse {
    private String ticker;
    private double requestedImpactPct;
    private double appliedImpactPct;
    private RegimeType regime;
}
