package com.hydra.backend.trading.strategy;

import com.hydra.backend.config.RegimeProperties;
import com.hydra.backend.config.StrategyProperties;
import com.hydra.backend.model.MarketSnapshot;
import com.hydra.backend.model.Regime;
import com.hydra.backend.model.TradeProposal;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hydra.backend.util.TestFixtures.regime;
import static com.hydra.backend.util.TestFixtures.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MarginFlowStrategyTest {

    private final MarginFlowStrategy strategy = new MarginFlowStrategy(new RegimeProperties(), new StrategyProperties());

    @Test
    void confidenceIsCapped() {
        MarketSnapshot snapshot = snapshot().score("GLD", 0.4, 0.95, 2).price("GLD", 200).build();

        TradeProposal proposal = strategy.propose(snapshot, regime(Regime.RECOVERY, 0.6)).get(0);

        assertThat(proposal.confidence()).isEqualTo(0.8);
        assertThat(proposal.stop()).isCloseTo(194.0, within(1e-9));
        assertThat(proposal.target()).isCloseTo(212.0, within(1e-9));
    }

    @Test
    void coversEveryConfiguredMetal() {
        MarketSnapshot snapshot = snapshot()
                .score("GLD", -0.4, 0.6, 2).price("GLD", 200)
                .score("SLV", 0.5, 0.7, 2).price("SLV", 25)
                .score("GDX", 0.1, 0.9, 2).price("GDX", 30)
                .build();

        List<TradeProposal> proposals = strategy.propose(snapshot, regime(Regime.HIGH_VOL_EXPANSION, 0.8));

        assertThat(proposals).extracting(TradeProposal::asset).containsExactly("GLD", "SLV");
    }

    @Test
    void trendingRegimeIsIneligible() {
        MarketSnapshot snapshot = snapshot().score("GLD", 0.4, 0.95, 2).price("GLD", 200).build();

        assertThat(strategy.propose(snapshot, regime(Regime.TRENDING_UP, 0.9))).isEmpty();
    }
}
