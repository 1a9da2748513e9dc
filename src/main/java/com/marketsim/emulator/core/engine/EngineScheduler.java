package com.marketsim.emulator.core.engine;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "emulator.engine", name = "enabled", havingValue = "true", matchIfMissing = true)
public class EngineScheduler {

    private final MarketEngine engine;

    @Scheduled(fixedRateString = "${emulator.engine.tick-interval-ms:1000}")
    public void tick() {
        engine.runTick();
    }
}
