package com.hydra.backend.trading.pipeline;

import com.hydra.backend.config.RiskProperties;
import com.hydra.backend.config.StrategyProperties;
import com.hydra.backend.dto.HydraEvent;
import com.hydra.backend.dto.HydraEvent.EventType;
import com.hydra.backend.exception.RiskInvariantViolationException;
import com.hydra.backend.model.AggregatedScore;
import com.hydra.backend.model.MarketSnapshot;
import com.hydra.backend.model.RegimeState;
import com.hydra.backend.model.TradeOutcome;
import com.hydra.backend.model.TradeProposal;
import com.hydra.backend.service.MetricsService;
import com.hydra.backend.service.NotificationService;
import com.hydra.backend.service.execution.ExecutionResult;
import com.hydra.backend.service.execution.OrderExecutor;
import com.hydra.backend.service.marketdata.PriceFeed;
import com.hydra.backend.trading.strategy.TradingStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One decision cycle: snapshot signals and prices, classify the regime, fan the strategies out and
 * join them, rank, gate each ranked proposal through the risk engine in order, execute approvals,
 * then walk the open positions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeDecisionPipelineService {

    private final SignalAggregator signalAggregator;
    private final RegimeDetector regimeDetector;
    private final List<TradingStrategy> strategies;
    private final ProposalRanker proposalRanker;
    private final RiskEngine riskEngine;
    private final RiskState riskState;
    private final OrderExecutor orderExecutor;
    private final PositionLifecycleManager lifecycleManager;
    private final StrategyWeightService weightService;
    private final PriceFeed priceFeed;
    private final RegimeFeatureCalculator featureCalculator;
    private final NotificationService notificationService;
    private final MetricsService metricsService;
    private final StrategyProperties strategyProperties;
    private final RiskProperties riskProperties;

    @Qualifier("strategyExecutor")
    private final Executor strategyExecutor;

    private final AtomicLong cycleCounter = new AtomicLong();

    public CycleReport runCycle(Instant now) {
        long startNanos = System.nanoTime();
        long cycleNumber = cycleCounter.incrementAndGet();
        riskState.rollTradingDay(now);

        signalAggregator.purgeExpired(now);
        Map<String, AggregatedScore> scores = signalAggregator.aggregateAll(now);
        Map<String, Double> prices = fetchPrices(universe(scores));
        RegimeState regime = regimeDetector.detect(now);
        MarketSnapshot snapshot = new MarketSnapshot(scores, prices, now);

        List<TradingStrategy> active = strategies.stream()
                .filter(strategy -> regimeDetector.permits(regime, strategy.eligibleRegimes()))
                .toList();
        List<TradeProposal> proposals = generateProposals(active, snapshot, regime);
        List<RankedProposal> ranked = proposalRanker.top(proposals);

        Map<RejectReason, Integer> rejections = new EnumMap<>(RejectReason.class);
        int approved = 0;
        int opened = 0;
        boolean halted = false;
        for (RankedProposal candidate : ranked) {
            TradeProposal proposal = candidate.proposal();
            RiskDecision decision;
            try {
                decision = riskEngine.evaluate(proposal, riskState, volatilityOf(proposal.asset()), now);
            } catch (RiskInvariantViolationException e) {
                onInvariantViolation(e);
                halted = true;
                break;
            }
            if (!decision.approved()) {
                rejections.merge(decision.rejectReason(), 1, Integer::sum);
                metricsService.recordReject(decision.rejectReason().name());
                notificationService.publish(HydraEvent.of(EventType.PROPOSAL_REJECTED,
                        proposal.strategyId() + " " + proposal.asset() + " rejected: " + decision.rejectReason(),
                        Map.of("strategy", proposal.strategyId(), "asset", proposal.asset(),
                                "reason", decision.rejectReason().name())));
                continue;
            }
            approved++;
            metricsService.recordApproval();
            notificationService.publish(HydraEvent.of(EventType.PROPOSAL_APPROVED,
                    proposal.strategyId() + " " + proposal.direction() + " " + proposal.asset() + " approved",
                    Map.of("strategy", proposal.strategyId(), "asset", proposal.asset(),
                            "notional", decision.sizedNotional(), "score", candidate.score())));
            try {
                if (execute(decision, now)) {
                    opened++;
                }
            } catch (RiskInvariantViolationException e) {
                onInvariantViolation(e);
                halted = true;
                break;
            }
        }

        List<TradeOutcome> closed = lifecycleManager.manage(now);

        if (cycleNumber % strategyProperties.getRecalibrationIntervalCycles() == 0) {
            weightService.recalibrate();
        }

        RiskState.RiskSnapshot risk = riskState.snapshot();
        metricsService.updateRisk(risk.openExposureTotal(), risk.dailyRealizedPnl());
        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        metricsService.recordCycle(duration);

        CycleReport report = new CycleReport(cycleNumber, now, duration, regime, active.size(), proposals.size(),
                ranked.size(), approved, opened, rejections, closed.size(), halted || risk.halted());
        log.info("Cycle {} regime {} ({}) strategies {} proposals {} forwarded {} approved {} opened {} "
                        + "rejected {} closed {} in {} ms",
                cycleNumber, regime.regime(), String.format("%.2f", regime.confidence()), active.size(),
                proposals.size(), ranked.size(), approved, opened, rejections, closed.size(), duration.toMillis());
        return report;
    }

    public long completedCycles() {
        return cycleCounter.get();
    }

    /**
     * Runs the active strategies concurrently and waits for all of them. A failing or slow strategy
     * contributes nothing this cycle.
     */
    List<TradeProposal> generateProposals(List<TradingStrategy> active, MarketSnapshot snapshot, RegimeState regime) {
        long timeoutMs = strategyProperties.getTimeout().toMillis();
        List<CompletableFuture<List<TradeProposal>>> futures = new ArrayList<>(active.size());
        for (TradingStrategy strategy : active) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> strategy.propose(snapshot, regime), strategyExecutor)
                    .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                    .exceptionally(ex -> {
                        log.warn("Strategy {} produced no proposals: {}", strategy.id(), ex.toString());
                        return List.of();
                    }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<TradeProposal> proposals = new ArrayList<>();
        for (CompletableFuture<List<TradeProposal>> future : futures) {
            proposals.addAll(future.join());
        }
        return proposals;
    }

    private boolean execute(RiskDecision decision, Instant now) {
        TradeProposal proposal = decision.proposal();
        ExecutionResult result;
        try {
            result = orderExecutor.submit(decision);
        } catch (RuntimeException e) {
            result = ExecutionResult.rejected(e.getMessage());
        }
        if (result.filled()) {
            lifecycleManager.open(decision, result, now);
            return true;
        }
        log.warn("Order for {} {} not filled ({}); releasing {}", proposal.strategyId(), proposal.asset(),
                result.message(), String.format("%.2f", decision.sizedNotional()));
        riskState.release(proposal.asset(), decision.sizedNotional(), true);
        notificationService.publish(HydraEvent.of(EventType.ORDER_REJECTED,
                "Broker rejected " + proposal.asset(),
                Map.of("strategy", proposal.strategyId(), "asset", proposal.asset(),
                        "reason", String.valueOf(result.message()))));
        return false;
    }

    private void onInvariantViolation(RiskInvariantViolationException e) {
        log.error("Risk ledger invariant violated; approvals halted until operator resume", e);
        notificationService.publish(HydraEvent.of(EventType.ACCOUNTING_HALT, e.getMessage(), Map.of()));
    }

    private double volatilityOf(String asset) {
        RiskProperties.Sizing sizing = riskProperties.getSizing();
        int lookback = sizing.getVolatilityLookback();
        return featureCalculator.realizedVolatility(priceFeed.getOhlcHistory(asset, lookback + 1), lookback)
                .orElse(sizing.getDefaultVolatility());
    }

    private Set<String> universe(Map<String, AggregatedScore> scores) {
        Set<String> assets = new TreeSet<>(scores.keySet());
        assets.addAll(strategyProperties.getLiquidationFlow().getAssets());
        assets.addAll(strategyProperties.getEventVolatility().getAssets());
        assets.addAll(strategyProperties.getMarginFlow().getAssets());
        StrategyProperties.NarrativeShock narrative = strategyProperties.getNarrativeShock();
        assets.add(narrative.getSectorAsset());
        assets.addAll(narrative.getImpairedNames());
        assets.addAll(narrative.getPunishedNames());
        assets.addAll(strategyProperties.getCrossAssetGraph().getGraph().keySet());
        return assets;
    }

    private Map<String, Double> fetchPrices(Set<String> assets) {
        Map<String, Double> prices = new TreeMap<>();
        for (String asset : assets) {
            OptionalDouble price = priceFeed.getPrice(asset);
            if (price.isPresent() && price.getAsDouble() > 0) {
                prices.put(asset, price.getAsDouble());
            }
        }
        return prices;
    }
}
