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
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Blends an asset's own score with the scores of the assets that tend to lead it.
 */
@Component
public class CrossAssetGraphStrategy extends AbstractTradingStrategy {

    public static final String ID = "cross-asset-graph";

    private final StrategyProperties.CrossAssetGraph config;

    public CrossAssetGraphStrategy(RegimeProperties regimeProperties, StrategyProperties strategyProperties) {
        super(regimeProperties);
        this.config = strategyProperties.getCrossAssetGraph();
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<Regime> eligibleRegimes() {
        return EnumSet.of(Regime.TRENDING_DOWN, Regime.CRASH, Regime.HIGH_VOL_EXPANSION);
    }

    @Override
    protected List<TradeProposal> generate(MarketSnapshot snapshot, RegimeState regime) {
        List<TradeProposal> proposals = new ArrayList<>();
        for (Map.Entry<String, Map<String, Double>> node : config.getGraph().entrySet()) {
            String asset = node.getKey();
            AggregatedScore own = snapshot.score(asset);
            OptionalDouble price = snapshot.price(asset);
            if (price.isEmpty() || own.confidence() < config.getMinConfidence()) {
                continue;
            }
            double combined = combinedDirection(own, node.getValue(), snapshot);
            if (Math.abs(combined) <= config.getMinDirection()) {
                continue;
            }
            proposals.add(bracket(asset, TradeDirection.of(combined), price.getAsDouble(), config.getStopPct(),
                    config.getTargetPct(), own.confidence(), config.isTrailing(),
                    "Cross-asset " + fmt(combined) + " (own " + fmt(own.netDirection()) + ")"));
        }
        return proposals;
    }

    double combinedDirection(AggregatedScore own, Map<String, Double> leaders, MarketSnapshot snapshot) {
        double leaderDirection = 0.0;
        for (Map.Entry<String, Double> edge : leaders.entrySet()) {
            leaderDirection += edge.getValue() * snapshot.score(edge.getKey()).netDirection();
        }
        leaderDirection = Math.max(-1.0, Math.min(1.0, leaderDirection));
        double ownWeight = config.getOwnWeight();
        return ownWeight * own.netDirection() + (1.0 - ownWeight) * leaderDirection;
    }
}
