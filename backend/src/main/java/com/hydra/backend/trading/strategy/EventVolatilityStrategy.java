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
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Trades the post-release direction of macro events; the stop widens with the volatility level.
 */
@Component
public class EventVolatilityStrategy extends AbstractTradingStrategy {

    public static final String ID = "event-volatility";

    private final StrategyProperties.EventVolatility config;

    public EventVolatilityStrategy(RegimeProperties regimeProperties, StrategyProperties strategyProperties) {
        super(regimeProperties);
        this.config = strategyProperties.getEventVolatility();
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<Regime> eligibleRegimes() {
        return Regime.live();
    }

    @Override
    protected List<TradeProposal> generate(MarketSnapshot snapshot, RegimeState regime) {
        double volLevel = regime.features().volatilityLevel();
        double stopPct = config.getBaseStopPct() * Math.max(1.0, volLevel / config.getReferenceVolatility());
        double targetPct = stopPct * config.getRewardMultiple();

        List<TradeProposal> proposals = new ArrayList<>();
        for (String asset : config.getAssets()) {
            AggregatedScore score = snapshot.score(asset);
            OptionalDouble price = snapshot.price(asset);
            if (price.isEmpty()
                    || score.confidence() < config.getMinConfidence()
                    || Math.abs(score.netDirection()) <= config.getMinDirection()) {
                continue;
            }
            proposals.add(bracket(asset, TradeDirection.of(score.netDirection()), price.getAsDouble(), stopPct,
                    targetPct, score.confidence(), config.isTrailing(),
                    "Event move " + fmt(score.netDirection()) + " at vol " + String.format("%.1f", volLevel)));
        }
        return proposals;
    }
}
