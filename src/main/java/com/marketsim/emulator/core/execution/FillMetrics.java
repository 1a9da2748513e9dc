package com.marketsim.emulator.core.execution;

import lombok.Value;

@Value
public class FillMetrics {
    long windowMs;
    int count;
    double avgSlippageBps;
    double avgExecutionQuality;
}
