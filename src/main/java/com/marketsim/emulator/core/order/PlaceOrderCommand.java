package com.marketsim.emulator.core.order;

import com.marketsim.emulator.core.model.OrderSide;
import com.marketsim.emulator.core.model.OrderType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class PlaceOrderCommand {
    String userId;
    String ticker;
    OrderType type;
    OrderSide side;
    long quantity;
    BigDecimal limitPrice;
    BigDecimal stopPrice;
    Double trailPct;
    String ocoId;
}
