package com.hydra.backend.trading.strategy;

import com.hydra.backend.config.RegimeProperties;
import com.hydra.backend.model.MarketSnapshot;
import com.hydra.backend.model.RegimeState;
import com.hydra.backend.model.TradeDirection;
import com.hydra.backend.model.TradeProposal;
import com.hydra.backend.trading.pipeline.RegimeDetector;

import java.util.List;

/**
 * Gates every strategy on regime eligibility and regime confidence before its own rule runs.
 */
public abstract class AbstractTradingStrategy implements TradingStrategy {

    private final RegimeProperties regimeProperties;

    protected AbstractTradingStrategy(RegimeProperties regimeProperties) {
        this.regimeProperties = regimeProperties;
    }

    @Override
    public final List<TradeProposal> propose(MarketSnapshot snapshot, RegimeState regime) {
        if (!RegimeDetector.isActive(regime, eligibleRegimes(), regimeProperties.getMinActivationConfidence())) {
            return List.of();
        }
        return generate(snapshot, regime);
    }

    protected abstract List<TradeProposal> generate(MarketSnapshot snapshot, RegimeState regime);

    /**
     * Proposal with stop and target placed at fixed fractions of {@code reference} on the losing and
     * winning side of the trade.
     */
    protected TradeProposal bracket(String asset, TradeDirection direction, double entry, double reference,
                                    double stopPct, double targetPct, double confidence, boolean trailing,
                                    String rationale) {
        int sign = direction.sign();
        double stop = reference * (1.0 - sign * stopPct);
        double target = reference * (1.0 + sign * targetPct);
        return TradeProposal.of(id(), asset, direction, entry, stop, target, confidence, trailing, rationale);
    }

    protected TradeProposal bracket(String asset, TradeDirection direction, double price, double stopPct,
                                    double targetPct, double confidence, boolean trailing, String rationale) {
        return bracket(asset, direction, price, price, stopPct, targetPct, confidence, trailing, rationale);
    }

    protected static String fmt(double value) {
        return String.format("%+.2f", value);
    }
}
