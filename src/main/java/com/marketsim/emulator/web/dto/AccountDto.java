package com.marketsim.emulator.web.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
public class AccountDto {
    private String userId;
    private BigDecimal cash;
    private BigDecimal startingCash;
    private BigDecimal equity;
    private List<PositionDto> positions;
    private List<FillDto> recentTrades;
}
