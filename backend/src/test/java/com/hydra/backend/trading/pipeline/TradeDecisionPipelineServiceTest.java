package com.hydra.backend.trading.pipeline;

import com.hydra.backend.config.CycleProperties;
import com.hydra.backend.config.RiskProperties;
import com.hydra.backend.config.SignalProperties;
import com.hydra.backend.config.StrategyProperties;
import com.hydra.backend.dto.HydraEvent.EventType;
import com.hydra.backend.exception.RiskInvariantViolationException;
import com.hydra.backend.model.MarketSnapshot;
import com.hydra.backend.model.Regime;
import com.hydra.backend.model.RegimeState;
import com.hydra.backend.model.TradeProposal;
import com.hydra.backend.service.MetricsService;
import com.hydra.backend.service.NotificationService;
import com.hydra.backend.service.TradeJournalService;
import com.hydra.backend.service.execution.ExecutionResult;
import com.hydra.backend.service.execution.OrderExecutor;
import com.hydra.backend.service.execution.PaperOrderExecutor;
import com.hydra.backend.service.marketdata.InMemoryPriceFeed;
import com.hydra.backend.trading.strategy.TradingStrategy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

import static com.hydra.backend.util.TestFixtures.NOW;
import static com.hydra.backend.util.TestFixtures.longProposal;
import static com.hydra.backend.util.TestFixtures.regime;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TradeDecisionPipelineServiceTest {

    private final ExecutorService strategyPool = Executors.newFixedThreadPool(4);

    private StrategyProperties strategyProperties;
    private RiskProperties riskProperties;
    private InMemoryPriceFeed priceFeed;
    private RiskState riskState;
    private RegimeDetector regimeDetector;
    private NotificationService notifications;
    private StrategyWeightService weightService;
    private MetricsService metricsService;

    @BeforeEach
    void setUp() {
        strategyProperties = new StrategyProperties();
        riskProperties = new RiskProperties();
        priceFeed = new InMemoryPriceFeed();
        priceFeed.updatePrice("SPY", 100.0, NOW);
        priceFeed.updatePrice("GLD", 200.0, NOW);
        riskState = new RiskState(riskProperties);
        regimeDetector = mock(RegimeDetector.class);
        regimeIs(regime(Regime.HIGH_VOL_EXPANSION, 0.9));
        notifications = mock(NotificationService.class);
        weightService = new StrategyWeightService(strategyProperties);
        metricsService = new MetricsService(new SimpleMeterRegistry());
    }

    @AfterEach
    void tearDown() {
        strategyPool.shutdownNow();
    }

    @Test
    void approvedProposalOpensPosition() {
        TradeDecisionPipelineService pipeline = pipeline(List.of(
                strategy("margin-flow", snapshot -> List.of(longProposal("margin-flow", "SPY", 100, 0.01, 0.02, 0.9)))));

        CycleReport report = pipeline.runCycle(NOW);

        assertThat(report.proposalsGenerated()).isEqualTo(1);
        assertThat(report.approved()).isEqualTo(1);
        assertThat(report.positionsOpened()).isEqualTo(1);
        assertThat(riskState.exposure("SPY")).isPositive();
        assertThat(pipeline.completedCycles()).isEqualTo(1);
        verify(notifications).publish(argThat(event -> event.type() == EventType.POSITION_OPENED));
    }

    @Test
    void failingStrategyContributesNothing() {
        TradeDecisionPipelineService pipeline = pipeline(List.of(
                strategy("narrative-shock", snapshot -> {
                    throw new IllegalStateException("boom");
                }),
                strategy("margin-flow", snapshot -> List.of(longProposal("margin-flow", "GLD", 200, 0.02, 0.04, 0.8)))));

        CycleReport report = pipeline.runCycle(NOW);

        assertThat(report.activeStrategies()).isEqualTo(2);
        assertThat(report.proposalsGenerated()).isEqualTo(1);
        assertThat(report.positionsOpened()).isEqualTo(1);
    }

    @Test
    void slowStrategyIsTimedOut() {
        strategyProperties.setTimeout(Duration.ofMillis(200));
        TradeDecisionPipelineService pipeline = pipeline(List.of(
                strategy("event-volatility", snapshot -> {
                    try {
                        Thread.sleep(5_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return List.of(longProposal("event-volatility", "SPY", 100, 0.01, 0.02, 0.9));
                }),
                strategy("margin-flow", snapshot -> List.of(longProposal("margin-flow", "GLD", 200, 0.02, 0.04, 0.8)))));

        long started = System.nanoTime();
        CycleReport report = pipeline.runCycle(NOW);

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(4));
        assertThat(report.proposalsGenerated()).isEqualTo(1);
    }

    @Test
    void inactiveRegimeRunsNoStrategies() {
        regimeIs(regime(Regime.UNKNOWN, 0.3));
        TradeDecisionPipelineService pipeline = pipeline(List.of(
                strategy("margin-flow", snapshot -> List.of(longProposal("margin-flow", "SPY", 100, 0.01, 0.02, 0.9)))));

        CycleReport report = pipeline.runCycle(NOW);

        assertThat(report.activeStrategies()).isZero();
        assertThat(report.proposalsGenerated()).isZero();
    }

    @Test
    void onlyTopRankedProposalsReachRisk() {
        TradeDecisionPipelineService pipeline = pipeline(List.of(
                strategy("margin-flow", snapshot -> List.of(
                        longProposal("margin-flow", "A1", 100, 0.01, 0.02, 0.9),
                        longProposal("margin-flow", "A2", 100, 0.01, 0.02, 0.8),
                        longProposal("margin-flow", "A3", 100, 0.01, 0.02, 0.7),
                        longProposal("margin-flow", "A4", 100, 0.01, 0.02, 0.6)))));

        CycleReport report = pipeline.runCycle(NOW);

        assertThat(report.proposalsGenerated()).isEqualTo(4);
        assertThat(report.proposalsForwarded()).isEqualTo(3);
        assertThat(riskState.exposure("A4")).isZero();
    }

    @Test
    void brokerRejectionReleasesReservation() {
        OrderExecutor broker = mock(OrderExecutor.class);
        when(broker.submit(any())).thenReturn(ExecutionResult.rejected("insufficient margin"));
        TradeDecisionPipelineService pipeline = pipeline(List.of(
                strategy("margin-flow", snapshot -> List.of(longProposal("margin-flow", "SPY", 100, 0.01, 0.02, 0.9)))),
                new DefaultRiskEngine(riskProperties, new KellyPositionSizer(riskProperties)), broker);

        CycleReport report = pipeline.runCycle(NOW);

        assertThat(report.approved()).isEqualTo(1);
        assertThat(report.positionsOpened()).isZero();
        assertThat(riskState.exposure("SPY")).isZero();
        assertThat(riskState.tradesToday()).isZero();
        verify(notifications).publish(argThat(event -> event.type() == EventType.ORDER_REJECTED));
    }

    @Test
    void invariantViolationHaltsTheRestOfTheCycle() {
        RiskEngine riskEngine = mock(RiskEngine.class);
        when(riskEngine.evaluate(any(), any(), anyDouble(), any()))
                .thenThrow(new RiskInvariantViolationException("exposure mismatch"));
        TradeDecisionPipelineService pipeline = pipeline(List.of(
                strategy("margin-flow", snapshot -> List.of(
                        longProposal("margin-flow", "SPY", 100, 0.01, 0.02, 0.9),
                        longProposal("margin-flow", "GLD", 200, 0.01, 0.02, 0.8)))),
                riskEngine, new PaperOrderExecutor());

        CycleReport report = pipeline.runCycle(NOW);

        assertThat(report.accountingHalted()).isTrue();
        assertThat(report.approved()).isZero();
        verify(riskEngine, times(1)).evaluate(any(), any(), anyDouble(), any());
        verify(notifications).publish(argThat(event -> event.type() == EventType.ACCOUNTING_HALT));
    }

    @Test
    void rejectionsAreCountedByReason() {
        riskState.halt("manual review");
        TradeDecisionPipelineService pipeline = pipeline(List.of(
                strategy("margin-flow", snapshot -> List.of(longProposal("margin-flow", "SPY", 100, 0.01, 0.02, 0.9)))));

        CycleReport report = pipeline.runCycle(NOW);

        assertThat(report.rejections()).containsEntry(RejectReason.ACCOUNTING_HALT, 1);
        assertThat(report.accountingHalted()).isTrue();
        assertThat(metricsService.snapshot().rejectsByReason()).containsEntry("ACCOUNTING_HALT", 1L);
    }

    private void regimeIs(RegimeState state) {
        when(regimeDetector.detect(any())).thenReturn(state);
        when(regimeDetector.permits(any(), any())).thenAnswer(invocation ->
                RegimeDetector.isActive(invocation.getArgument(0), invocation.getArgument(1), 0.4));
    }

    private TradeDecisionPipelineService pipeline(List<TradingStrategy> strategies) {
        return pipeline(strategies, new DefaultRiskEngine(riskProperties, new KellyPositionSizer(riskProperties)),
                new PaperOrderExecutor());
    }

    private TradeDecisionPipelineService pipeline(List<TradingStrategy> strategies, RiskEngine riskEngine,
                                                  OrderExecutor orderExecutor) {
        PositionLifecycleManager lifecycle = new PositionLifecycleManager(priceFeed, orderExecutor, riskState,
                weightService, mock(TradeJournalService.class), notifications, metricsService, new CycleProperties());
        return new TradeDecisionPipelineService(
                new SignalAggregator(new SignalProperties()),
                regimeDetector,
                strategies,
                new ProposalRanker(strategyProperties, weightService),
                riskEngine,
                riskState,
                orderExecutor,
                lifecycle,
                weightService,
                priceFeed,
                new RegimeFeatureCalculator(),
                notifications,
                metricsService,
                strategyProperties,
                riskProperties,
                strategyPool);
    }

    private static TradingStrategy strategy(String id, Function<MarketSnapshot, List<TradeProposal>> rule) {
        return new TradingStrategy() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public Set<Regime> eligibleRegimes() {
                return Regime.live();
            }

            @Override
            public List<TradeProposal> propose(MarketSnapshot snapshot, RegimeState regime) {
                return rule.apply(snapshot);
            }
        };
    }
}
