package com.hydra.backend.service;

import com.hydra.backend.config.RiskProperties;
import com.hydra.backend.config.StrategyProperties;
import com.hydra.backend.dto.DashboardSnapshot;
import com.hydra.backend.dto.RiskStatusResponse;
import com.hydra.backend.trading.pipeline.PositionLifecycleManager;
import com.hydra.backend.trading.pipeline.RegimeDetector;
import com.hydra.backend.trading.pipeline.RiskState;
import com.hydra.backend.trading.pipeline.SignalAggregator;
import com.hydra.backend.trading.pipeline.StrategyWeightService;
import com.hydra.backend.trading.pipeline.TradeDecisionPipelineService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Read-only view over the decision core. Every part is copied out under its owner's lock, so the
 * snapshot never blocks a cycle for longer than one read.
 */
@Service
@RequiredArgsConstructor
public class DashboardSnapshotService {

    private final SignalAggregator signalAggregator;
    private final RegimeDetector regimeDetector;
    private final PositionLifecycleManager lifecycleManager;
    private final RiskState riskState;
    private final RiskProperties riskProperties;
    private final StrategyWeightService strategyWeightService;
    private final StrategyProperties strategyProperties;
    private final MetricsService metricsService;
    private final TradeDecisionPipelineService pipelineService;
    private final RiskEventService riskEventService;
    private final TradeJournalService tradeJournalService;

    public DashboardSnapshot snapshot() {
        Instant now = Instant.now();
        return DashboardSnapshot.builder()
                .signals(signalAggregator.aggregateAll(now))
                .regime(regimeDetector.current())
                .openPositions(lifecycleManager.openPositions())
                .risk(riskStatus())
                .strategyWeights(strategyWeightService.weights(strategyProperties.getPriority()))
                .metrics(metricsService.snapshot())
                .completedCycles(pipelineService.completedCycles())
                .recentRiskEvents(riskEventService.recent())
                .recentTrades(tradeJournalService.recent())
                .generatedAt(now)
                .build();
    }

    public RiskStatusResponse riskStatus() {
        RiskState.RiskSnapshot risk = riskState.snapshot();
        return RiskStatusResponse.builder()
                .capital(risk.capital())
                .equityHighWaterMark(risk.equityHighWaterMark())
                .maxDrawdown(risk.maxDrawdown())
                .dailyRealizedPnl(risk.dailyRealizedPnl())
                .dailyLossLimit(risk.dayStartCapital() * riskProperties.getMaxDailyLossPct())
                .openExposureTotal(risk.openExposureTotal())
                .totalExposureCap(risk.capital() * riskProperties.getMaxTotalExposurePct())
                .perAssetCap(risk.capital() * riskProperties.getMaxSingleAssetPct())
                .exposureByAsset(risk.exposureByAsset())
                .consecutiveLosses(risk.consecutiveLosses())
                .maxConsecutiveLosses(riskProperties.getMaxConsecutiveLosses())
                .cooldownUntil(risk.cooldownUntil())
                .tradesToday(risk.tradesToday())
                .maxTradesPerDay(riskProperties.getMaxTradesPerDay())
                .killSwitchTripped(risk.killSwitchTripped())
                .halted(risk.halted())
                .haltReason(risk.haltReason())
                .build();
    }
}
