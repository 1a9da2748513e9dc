package com.marketsim.emulator.web.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class PositionDto {
    private String ticker;
    private long quantity;
    private BigDecimal averageCost;
    private BigDecimal accruedBorrow;
    private Double lastPrice;
    private BigDecimal marketValue;
    private BigDecimal unrealizedPnl;
}
