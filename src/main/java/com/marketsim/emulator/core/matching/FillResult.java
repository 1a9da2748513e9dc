package com.marketsim.emulator.core.matching;

import com.marketsim.emulator.core.model.Trade;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class FillResult {

    public enum Status {
        FILLED,
        CANCELLED,
        SKIPPED
    }

    Status status;
    Trade trade;
    List<UUID> cancelledSiblings;

    public static FillResult filled(Trade trade, List<UUID> cancelledSiblings) {
        return new FillResult(Status.FILLED, trade, List.copyOf(cancelledSiblings));
    }

    public static FillResult cancelled() {
        return new FillResult(Status.CANCELLED, null, List.of());
    }

    public static FillResult skipped() {
        return new FillResult(Status.SKIPPED, null, List.of());
    }

    public boolean isFilled() {
        return status == Status.FILLED;
    }
}
