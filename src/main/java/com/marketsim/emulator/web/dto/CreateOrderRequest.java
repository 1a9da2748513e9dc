package com.marketsim.emulator.web.dto;

import com.marketsim.emulator.core.model.OrderSide;
import com.marketsim.emulator.core.model.OrderType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderRequest {
    private String userId;
    private String ticker;
    private OrderType type;
    private OrderSide side;
    private long quantity;
    private BigDecimal limitPrice; // LIMIT and STOP_LIMIT
    private BigDecimal stopPrice; // stops and TAKE_PROFIT
    private Double trailPct; // TRAILING_STOP, percent
    private String ocoId;
}
