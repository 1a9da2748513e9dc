package com.marketsim.emulator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

@Data
@Configuration
@ConfigurationProperties(prefix = "emulator")
public class EmulatorProperties {
    private Engine engine = new Engine();
    private Price price = new Price();
    private Regime regime = new Regime();
    private Execution execution = new Execution();
    private Margin margin = new Margin();
    private Borrow borrow = new Borrow();
    private Account account = new Account();

    @Data
    public static class Engine {
        private boolean enabled = true;
        private long tickIntervalMs = 1000;
        private int flushEveryTicks = 5;
        private Long randomSeed;
        private long errorLogIntervalMs = 15_000;
    }

    @Data
    public static class Price {
        private double garchAlpha = 0.06;
        private double garchBeta = 0.90;
        private double minVolFactor = 0.3;
        private double maxVolFactor = 5.0;
        private double volOfVol = 0.6;
        private double shockMultiplier = 1.0;
        private double spreadMultiplier = 1.0;
        private double dynamicAnchorWeight = 0.35;
        private double maxOrderFlowPct = 0.01;
        private double orderFlowDecay = 0.25;
        private double orderFlowSensitivity = 25.0;
        private double orderFlowNoiseFloorPct = 0.000001;
        private double volumeBase = 200;
        private double volumeJitter = 400;
        private double volumeMoveMultiplier = 50;
        private double volumeVolMultiplier = 10;
        private double newsVolatilitySpike = 2.5;
        private double startOffsetPct = 0.01;
    }

    @Data
    public static class Regime {
        private long reviewIntervalMs = 300_000;
        private double reviewJitterPct = 0.2;
        private long eventShockHoldMs = 120_000;
        private double eventShockThresholdPct = 0.015;
    }

    @Data
    public static class Execution {
        private boolean realismEnabled = true;
        private int maxAffordabilityIterations = 10_000;
        private long lockTimeoutMs = 250;
        private long metricsMemoryMs = 15 * 60 * 1000;
        private int maxFillMetrics = 5000;
    }

    @Data
    public static class Margin {
        private double maintenanceRatio = 1.1;
    }

    @Data
    public static class Borrow {
        private long accrualIntervalMs = 30_000;
    }

    @Data
    public static class Account {
        private BigDecimal initialBalance = new BigDecimal("100000");
    }
}
