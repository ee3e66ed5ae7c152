package com.hydra.backend.model;

/**
 * A strategy's candidate trade before risk sizing. Consumed exactly once by the risk engine.
 * A {@code requestedNotional} of zero leaves sizing entirely to the risk engine.
 */
public record TradeProposal(
        String strategyId,
        String asset,
        TradeDirection direction,
        double entry,
        double stop,
        double target,
        double confidence,
        double rewardToRisk,
        double requestedNotional,
        boolean trailing,
        String rationale
) {

    public static TradeProposal of(String strategyId,
                                   String asset,
                                   TradeDirection direction,
                                   double entry,
                                   double stop,
                                   double target,
                                   double confidence,
                                   boolean trailing,
                                   String rationale) {
        double risk = Math.abs(entry - stop);
        double reward = Math.abs(target - entry);
        double rewardToRisk = risk > 0 ? reward / risk : 0.0;
        return new TradeProposal(strategyId, asset, direction, entry, stop, target,
                Math.max(0.0, Math.min(1.0, confidence)), rewardToRisk, 0.0, trailing, rationale);
    }

    public TradeProposal withRequestedNotional(double notional) {
        return new TradeProposal(strategyId, asset, direction, entry, stop, target, confidence,
                rewardToRisk, notional, trailing, rationale);
    }

    /**
     * Stop below and target above entry for longs, the mirror image for shorts.
     */
    public boolean isWellFormed() {
        if (entry <= 0 || stop <= 0 || target <= 0) {
            return false;
        }
        if (direction == TradeDirection.LONG) {
            return stop < entry && target > entry;
        }
        return stop > entry && target < entry;
    }

    public double stopDistanceFraction() {
        return entry > 0 ? Math.abs(entry - stop) / entry : 0.0;
    }
}
