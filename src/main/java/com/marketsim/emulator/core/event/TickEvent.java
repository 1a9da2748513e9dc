package com.marketsim.emulator.core.event;

import com.marketsim.emulator.core.model.RegimeType;
import com.marketsim.emulator.core.model.TickSnapshot;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.util.List;

@Getter
public class TickEvent extends ApplicationEvent {
    private final long tickNumber;
    private final RegimeType regime;
    private final List<TickSnapshot> ticks;

    public TickEvent(Object source, long tickNumber, RegimeType regime, List<TickSnapshot> ticks) {
        super(source);
        this.tickNumber = tickNumber;
        this.regime = regime;
        this.ticks = List.copyOf(ticks);
    }
}
