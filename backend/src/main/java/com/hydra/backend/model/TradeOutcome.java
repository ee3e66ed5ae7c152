package com.hydra.backend.model;

import java.time.Instant;

public record TradeOutcome(
        String positionId,
        String strategyId,
        String asset,
        TradeDirection direction,
        double entryPrice,
        double exitPrice,
        double notional,
        double realizedPnl,
        double rMultiple,
        ExitReason exitReason,
        Instant openedAt,
        Instant closedAt
) {

    /**
     * Only a negative PnL is a loss; a breakeven exit counts as a win.
     */
    public boolean win() {
        return realizedPnl >= 0;
    }

    public enum ExitReason {
        STOP,
        TARGET,
        MANUAL
    }
}
