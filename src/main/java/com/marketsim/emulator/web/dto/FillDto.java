package com.marketsim.emulator.web.dto;

import com.marketsim.emulator.core.model.OrderSide;
import com.marketsim.emulator.core.model.Trade;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Wire form of a trade, used by the account view and the WebSocket fill message.
 */
@Data
@Builder
public class FillDto {
    private String orderId;
    private String tradeId;
    private String ticker;
    private OrderSide side;
    private long qty;
    private BigDecimal price;
    private BigDecimal total;
    private BigDecimal commission;
    private BigDecimal borrowCost;
    private BigDecimal slippageBps;
    private BigDecimal executionQualityScore;
    private BigDecimal netPnl;
    private String regime;
    private boolean marginCall;
    private Instant timestamp;

    public static FillDto from(Trade trade) {
        return FillDto.builder()
                .orderId(trade.getOrderId())
                .tradeId(trade.getId().toString())
                .ticker(trade.getTicker())
                .side(trade.getSide())
                .qty(trade.getQuantity())
                .price(trade.getPrice())
                .total(trade.getNotional())
                .commission(trade.getCommission())
                .borrowCost(trade.getBorrowCost())
                .slippageBps(trade.getSlippageBps())
                .executionQualityScore(trade.getExecutionQualityScore())
                .netPnl(trade.getPnl())
                .regime(trade.getRegime())
                .marginCall(trade.isMarginCall())
                .timestamp(trade.getExecutedAt())
                .build();
    }
}
