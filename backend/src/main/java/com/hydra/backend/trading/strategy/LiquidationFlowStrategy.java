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
 * Trades crypto in the direction of corroborated liquidation and funding pressure, with a trailing stop.
 */
@Component
public class LiquidationFlowStrategy extends AbstractTradingStrategy {

    public static final String ID = "liquidation-flow";

    private final StrategyProperties.LiquidationFlow config;

    public LiquidationFlowStrategy(RegimeProperties regimeProperties, StrategyProperties strategyProperties) {
        super(regimeProperties);
        this.config = strategyProperties.getLiquidationFlow();
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<Regime> eligibleRegimes() {
        return EnumSet.of(Regime.HIGH_VOL_EXPANSION, Regime.CRASH, Regime.TRENDING_UP, Regime.TRENDING_DOWN);
    }

    @Override
    protected List<TradeProposal> generate(MarketSnapshot snapshot, RegimeState regime) {
        List<TradeProposal> proposals = new ArrayList<>();
        for (String asset : config.getAssets()) {
            AggregatedScore score = snapshot.score(asset);
            OptionalDouble price = snapshot.price(asset);
            if (price.isEmpty()
                    || score.confidence() < config.getMinConfidence()
                    || score.contributingSignalCount() < config.getMinSignals()
                    || Math.abs(score.netDirection()) <= config.getMinDirection()) {
                continue;
            }
            TradeDirection direction = TradeDirection.of(score.netDirection());
            proposals.add(bracket(asset, direction, price.getAsDouble(), config.getStopPct(), config.getTargetPct(),
                    score.confidence(), config.isTrailing(),
                    "Liquidation flow " + fmt(score.netDirection()) + " from " + score.contributingSignalCount()
                            + " signals, led by " + score.dominantSource()));
        }
        return proposals;
    }
}
