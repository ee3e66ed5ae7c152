package com.hydra.backend.trading.strategy;

import com.hydra.backend.config.RegimeProperties;
import com.hydra.backend.config.StrategyProperties;
import com.hydra.backend.model.MarketSnapshot;
import com.hydra.backend.model.Regime;
import com.hydra.backend.model.TradeDirection;
import com.hydra.backend.model.TradeProposal;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hydra.backend.util.TestFixtures.regime;
import static com.hydra.backend.util.TestFixtures.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LiquidationFlowStrategyTest {

    private final LiquidationFlowStrategy strategy =
            new LiquidationFlowStrategy(new RegimeProperties(), new StrategyProperties());

    @Test
    void corroboratedFlowProducesTrailingBracket() {
        MarketSnapshot snapshot = snapshot().score("BTC/USD", 0.6, 0.7, 2).price("BTC/USD", 60_000).build();

        List<TradeProposal> proposals = strategy.propose(snapshot, regime(Regime.CRASH, 0.9));

        assertThat(proposals).hasSize(1);
        TradeProposal proposal = proposals.get(0);
        assertThat(proposal.strategyId()).isEqualTo(LiquidationFlowStrategy.ID);
        assertThat(proposal.direction()).isEqualTo(TradeDirection.LONG);
        assertThat(proposal.stop()).isCloseTo(59_100.0, within(1e-6));
        assertThat(proposal.target()).isCloseTo(62_400.0, within(1e-6));
        assertThat(proposal.trailing()).isTrue();
        assertThat(proposal.confidence()).isEqualTo(0.7);
    }

    @Test
    void bearishFlowGoesShort() {
        MarketSnapshot snapshot = snapshot().score("ETH/USD", -0.5, 0.6, 3).price("ETH/USD", 3_000).build();

        TradeProposal proposal = strategy.propose(snapshot, regime(Regime.TRENDING_DOWN, 0.6)).get(0);

        assertThat(proposal.direction()).isEqualTo(TradeDirection.SHORT);
        assertThat(proposal.stop()).isGreaterThan(3_000.0);
        assertThat(proposal.isWellFormed()).isTrue();
    }

    @Test
    void singleSourceIsNotEnough() {
        MarketSnapshot snapshot = snapshot().score("BTC/USD", 0.9, 0.9, 1).price("BTC/USD", 60_000).build();

        assertThat(strategy.propose(snapshot, regime(Regime.CRASH, 0.9))).isEmpty();
    }

    @Test
    void weakDirectionIsIgnored() {
        MarketSnapshot snapshot = snapshot().score("BTC/USD", 0.2, 0.9, 3).price("BTC/USD", 60_000).build();

        assertThat(strategy.propose(snapshot, regime(Regime.CRASH, 0.9))).isEmpty();
    }

    @Test
    void ineligibleOrUnconfidentRegimeYieldsNothing() {
        MarketSnapshot snapshot = snapshot().score("BTC/USD", 0.6, 0.7, 2).price("BTC/USD", 60_000).build();

        assertThat(strategy.propose(snapshot, regime(Regime.MEAN_REVERTING, 0.9))).isEmpty();
        assertThat(strategy.propose(snapshot, regime(Regime.CRASH, 0.4))).isEmpty();
    }

    @Test
    void unpricedAssetIsSkipped() {
        MarketSnapshot snapshot = snapshot().score("BTC/USD", 0.6, 0.7, 2).build();

        assertThat(strategy.propose(snapshot, regime(Regime.CRASH, 0.9))).isEmpty();
    }
}
