package com.hydra.backend.trading.strategy;

import com.hydra.backend.config.RegimeProperties;
import com.hydra.backend.config.StrategyProperties;
import com.hydra.backend.model.AggregatedScore;
import com.hydra.backend.model.MarketSnapshot;
import com.hydra.backend.model.Regime;
import com.hydra.backend.model.RegimeState;
import com.hydra.backend.model.TradeDirection;
import com.hydra.backend.model.TradeProposal;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Precious metals flow: margin hikes and physical premium moves. Confidence is capped because forced
 * liquidations reverse quickly.
 */
@Component
public class MarginFlowStrategy extends AbstractTradingStrategy {

    public static final String ID = "margin-flow";

    private final StrategyProperties.MarginFlow config;

    public MarginFlowStrategy(RegimeProperties regimeProperties, StrategyProperties strategyProperties) {
        super(regimeProperties);
        this.config = strategyProperties.getMarginFlow();
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<Regime> eligibleRegimes() {
        return EnumSet.of(Regime.HIGH_VOL_EXPANSION, Regime.CRASH, Regime.RECOVERY, Regime.MEAN_REVERTING);
    }

    @Override
    protected List<TradeProposal> generate(MarketSnapshot snapshot, RegimeState regime) {
        List<TradeProposal> proposals = new ArrayList<>();
        for (String asset : config.getAssets()) {
            AggregatedScore score = snapshot.score(asset);
            OptionalDouble price = snapshot.price(asset);
            if (price.isEmpty()
                    || score.confidence() < config.getMinConfidence()
                    || Math.abs(score.netDirection()) <= config.getMinDirection()) {
                continue;
            }
            double confidence = Math.min(config.getMaxConfidence(), score.confidence());
            proposals.add(bracket(asset, TradeDirection.of(score.netDirection()), price.getAsDouble(),
                    config.getStopPct(), config.getTargetPct(), confidence, config.isTrailing(),
                    "Metals flow " + fmt(score.netDirection()) + " led by " + score.dominantSource()));
        }
        return proposals;
    }
}
