package com.hydra.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An open position. Only the position lifecycle manager mutates it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String id;
    private String asset;
    private TradeDirection direction;
    private double entryPrice;
    private double initialStop;
    private double stop;
    private double target;
    private double notional;
    private Instant openedAt;
    private String owningStrategyId;

    private boolean trailingEnabled;
    private boolean trailingActive;
    private double bestPrice;

    private Double lastPrice;
    private boolean priceUnavailable;
    // set while a close order is with the broker
    private boolean closing;

    public double initialRiskPerUnit() {
        return Math.abs(entryPrice - initialStop);
    }

    public double quantity() {
        return entryPrice > 0 ? notional / entryPrice : 0.0;
    }

    public double pnlAt(double price) {
        return (price - entryPrice) * direction.sign() * quantity();
    }

    public double rMultipleAt(double price) {
        double risk = initialRiskPerUnit();
        if (risk <= 0) {
            return 0.0;
        }
        return (price - entryPrice) * direction.sign() / risk;
    }

    public boolean isStopHit(double price) {
        return direction == TradeDirection.LONG ? price <= stop : price >= stop;
    }

    public boolean isTargetHit(double price) {
        return direction == TradeDirection.LONG ? price >= target : price <= target;
    }
}
