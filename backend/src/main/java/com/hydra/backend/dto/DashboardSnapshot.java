package com.hydra.backend.dto;

import com.hydra.backend.model.AggregatedScore;
import com.hydra.backend.model.Position;
import com.hydra.backend.model.RegimeState;
import com.hydra.backend.model.RiskEvent;
import com.hydra.backend.model.StrategyWeight;
import com.hydra.backend.model.TradeJournalEntry;
import com.hydra.backend.service.MetricsService;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
public class DashboardSnapshot {
    private Map<String, AggregatedScore> signals;
    private RegimeState regime;
    private List<Position> openPositions;
    private RiskStatusResponse risk;
    private List<StrategyWeight> strategyWeights;
    private MetricsService.Snapshot metrics;
    private long completedCycles;
    private List<RiskEvent> recentRiskEvents;
    private List<TradeJournalEntry> recentTrades;
    private Instant generatedAt;
}
