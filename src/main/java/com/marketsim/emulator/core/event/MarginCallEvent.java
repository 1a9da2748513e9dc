package com.marketsim.emulator.core.event;

import com.marketsim.emulator.core.model.Trade;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.math.BigDecimal;
import java.util.List;

@Getter
public class MarginCallEvent extends ApplicationEvent {
    private final String userId;
    private final BigDecimal equity;
    private final BigDecimal shortExposure;
    private final List<Trade> liquidations;

    public MarginCallEvent(Object source, String userId, BigDecimal equity, BigDecimal shortExposure,
                           List<Trade> liquidations) {
        super(source);
        this.userId = userId;
        this.equity = equity;
        this.shortExposure = shortExposure;
        this.liquidations = List.copyOf(liquidations);
    }
}
