package com.marketsim.emulator.core.event;

import com.marketsim.emulator.core.model.Trade;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

@Getter
public class FillEvent extends ApplicationEvent {
    private final Trade trade;

    public FillEvent(Object source, Trade trade) {
        super(source);
        this.trade = trade;
    }
}
