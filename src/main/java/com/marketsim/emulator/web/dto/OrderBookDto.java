package com.marketsim.emulator.web.dto;

import com.marketsim.emulator.core.model.OrderBook;
import com.marketsim.emulator.core.model.PriceLevel;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class OrderBookDto {
    private String ticker;
    private BigDecimal mid;
    private BigDecimal spread;
    private long timestamp;
    private List<PriceLevelDto> bids;
    private List<PriceLevelDto> asks;

    @Data
    @Builder
    public static class PriceLevelDto {
        private BigDecimal price;
        private long quantity;
        private long userQuantity;
        private int userOrdersCount;
    }

    public static OrderBookDto from(OrderBook book) {
        return OrderBookDto.builder()
                .ticker(book.getTicker())
                .mid(book.getMid())
                .spread(book.getSpread())
                .timestamp(book.getTimestamp())
                .bids(levels(book.getBids().values()))
                .asks(levels(book.getAsks().values()))
                .build();
    }

    private static List<PriceLevelDto> levels(Iterable<PriceLevel> levels) {
        List<PriceLevelDto> result = new ArrayList<>();
        for (PriceLevel level : levels) {
            result.add(PriceLevelDto.builder()
                    .price(level.getPrice())
                    .quantity(level.getTotalQuantity())
                    .userQuantity(level.getUserQuantity())
                    .userOrdersCount(level.getUserOrders().size())
                    .build());
        }
        return result;
    }
}
