package com.marketsim.emulator.core.event;

import com.marketsim.emulator.core.model.RegimeRecord;
import com.marketsim.emulator.core.model.RegimeType;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

@Getter
public class RegimeChangedEvent extends ApplicationEvent {
    private final RegimeType previous;
    private final RegimeRecord current;

    public RegimeChangedEvent(Object source, RegimeType previous, RegimeRecord current) {
        super(source);
        this.previous = previous;
        this.current = current;
    }
}
