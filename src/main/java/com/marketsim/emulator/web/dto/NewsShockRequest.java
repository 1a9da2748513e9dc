package com.marketsim.emulator.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NewsShockRequest {
    private String ticker;
    private Double impactPct; // fraction, 0.02 is +2%
}
