package com.hydra.backend.config;

import com.hydra.backend.trading.pipeline.PositionLifecycleManager;
import com.hydra.backend.trading.pipeline.RiskState;
import com.hydra.backend.trading.pipeline.TradeDecisionPipelineService;
import com.hydra.backend.trading.strategy.TradingStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Logs the session summary when the context closes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionReportListener implements ApplicationListener<ContextClosedEvent> {

    private final RiskState riskState;
    private final PositionLifecycleManager lifecycleManager;
    private final TradeDecisionPipelineService pipelineService;

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        RiskState.RiskSnapshot risk = riskState.snapshot();
        log.info("Session report: cycles={} capital {} -> {} pnl={} trades={} wins={} losses={} winRate={}% "
                        + "maxDrawdown={}% openPositions={}",
                pipelineService.completedCycles(),
                String.format("%.2f", risk.startingCapital()),
                String.format("%.2f", risk.capital()),
                String.format("%.2f", risk.totalRealizedPnl()),
                risk.closedTrades(),
                risk.wins(),
                risk.losses(),
                String.format("%.1f", risk.winRate() * 100),
                String.format("%.2f", risk.maxDrawdown() * 100),
                lifecycleManager.openCount());
    }

    @Slf4j
    @Component
    @RequiredArgsConstructor
    public static class StartupReportListener implements ApplicationListener<ApplicationReadyEvent> {

        private final List<TradingStrategy> strategies;
        private final RiskProperties riskProperties;
        private final CycleProperties cycleProperties;

        @Override
        public void onApplicationEvent(ApplicationReadyEvent event) {
            log.info("Hydra ready: capital {} strategies {} cycle every {} ms (scheduler {})",
                    String.format("%.2f", riskProperties.getStartingCapital()),
                    strategies.stream().map(TradingStrategy::id).toList(),
                    cycleProperties.getIntervalMs(),
                    cycleProperties.isSchedulerEnabled() ? "on" : "off");
        }
    }
}
