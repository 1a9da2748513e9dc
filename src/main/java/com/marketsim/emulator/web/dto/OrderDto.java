package com.marketsim.emulator.web.dto;

import com.marketsim.emulator.core.model.Order;
import com.marketsim.emulator.core.model.OrderSide;
import com.marketsim.emulator.core.model.OrderType;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
public class OrderDto {
    private String id;
    private String userId;
    private String ticker;
    private OrderType type;
    private OrderSide side;
    private long quantity;
    private long filledQuantity;
    private BigDecimal limitPrice;
    private BigDecimal stopPrice;
    private Double trailPct;
    private String ocoId;
    private String status;
    private BigDecimal avgFillPrice;
    private Instant createdAt;
    private Instant filledAt;
    private Instant cancelledAt;

    public static OrderDto from(Order order) {
        return OrderDto.builder()
                .id(order.getId().toString())
                .userId(order.getUserId())
                .ticker(order.getTicker())
                .type(order.getType())
                .side(order.getSide())
                .quantity(order.getQuantity())
                .filledQuantity(order.getFilledQuantity())
                .limitPrice(order.getLimitPrice())
                .stopPrice(order.getStopPrice())
                .trailPct(order.getTrailPct())
                .ocoId(order.getOcoId())
                .status(order.getStatus().name())
                .avgFillPrice(order.getAvgFillPrice())
                .createdAt(order.getCreatedAt())
                .filledAt(order.getFilledAt())
                .cancelledAt(order.getCancelledAt())
                .build();
    }
}
