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
 * Sector narrative shocks read off the sector ETF: short structurally impaired names while the sector
 * sells off, and buy the temporarily punished names once a recovery is under way.
 */
@Component
public class NarrativeShockStrategy extends AbstractTradingStrategy {

    public static final String ID = "narrative-shock";

    private final StrategyProperties.NarrativeShock config;

    public NarrativeShockStrategy(RegimeProperties regimeProperties, StrategyProperties strategyProperties) {
        super(regimeProperties);
        this.config = strategyProperties.getNarrativeShock();
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<Regime> eligibleRegimes() {
        return EnumSet.of(Regime.TRENDING_DOWN, Regime.HIGH_VOL_EXPANSION, Regime.RECOVERY);
    }

    @Override
    protected List<TradeProposal> generate(MarketSnapshot snapshot, RegimeState regime) {
        String sector = config.getSectorAsset();
        if (snapshot.price(sector).isEmpty()) {
            return List.of();
        }
        AggregatedScore sectorScore = snapshot.score(sector);
        List<TradeProposal> proposals = new ArrayList<>();

        if (sectorScore.netDirection() < config.getSelloffDirection()
                && sectorScore.confidence() > config.getSelloffMinConfidence()) {
            for (String asset : config.getImpairedNames()) {
                OptionalDouble price = snapshot.price(asset);
                if (price.isPresent()) {
                    proposals.add(bracket(asset, TradeDirection.SHORT, price.getAsDouble(), config.getShortStopPct(),
                            config.getShortTargetPct(), sectorScore.confidence(), false,
                            "Sector selloff " + fmt(sectorScore.netDirection()) + ", " + asset + " impaired"));
                }
            }
        }

        if (regime.regime() == Regime.RECOVERY
                && sectorScore.netDirection() > config.getRecoveryDirection()
                && sectorScore.confidence() > config.getRecoveryMinConfidence()) {
            for (String asset : config.getPunishedNames()) {
                OptionalDouble price = snapshot.price(asset);
                if (price.isPresent()) {
                    double last = price.getAsDouble();
                    proposals.add(bracket(asset, TradeDirection.LONG, last * config.getRecoveryEntryDiscount(), last,
                            config.getRecoveryStopPct(), config.getRecoveryTargetPct(),
                            sectorScore.confidence() * config.getRecoveryConfidenceFactor(), false,
                            "Sector recovery " + fmt(sectorScore.netDirection()) + ", " + asset + " oversold"));
                }
            }
        }
        return proposals;
    }
}
