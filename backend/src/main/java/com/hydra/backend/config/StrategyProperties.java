package com.hydra.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "hydra.strategy")
@Data
@Validated
public class StrategyProperties {

    @Min(1)
    private int topK = 3;

    @NotEmpty
    private List<String> priority = new ArrayList<>(List.of(
            "liquidation-flow", "margin-flow", "cross-asset-graph", "event-volatility", "narrative-shock"));

    @Min(1)
    private int recalibrationIntervalCycles = 50;

    @Min(1)
    private int minTradesForWeight = 5;

    private double weightFloor = 0.3;
    private double weightCeiling = 2.0;

    @Min(1)
    private int outcomeWindow = 50;

    private Duration timeout = Duration.ofSeconds(10);

    @Valid
    private LiquidationFlow liquidationFlow = new LiquidationFlow();
    @Valid
    private EventVolatility eventVolatility = new EventVolatility();
    @Valid
    private MarginFlow marginFlow = new MarginFlow();
    @Valid
    private NarrativeShock narrativeShock = new NarrativeShock();
    @Valid
    private CrossAssetGraph crossAssetGraph = new CrossAssetGraph();

    /**
     * Position of the strategy in the priority list; unknown strategies sort last.
     */
    public int priorityOf(String strategyId) {
        int index = priority.indexOf(strategyId);
        return index < 0 ? Integer.MAX_VALUE : index;
    }

    @Data
    public static class LiquidationFlow {
        private List<String> assets = new ArrayList<>(List.of("BTC/USD", "ETH/USD"));
        private double minConfidence = 0.5;
        private int minSignals = 2;
        private double minDirection = 0.2;
        private double stopPct = 0.015;
        private double targetPct = 0.04;
        private boolean trailing = true;
    }

    @Data
    public static class EventVolatility {
        private List<String> assets = new ArrayList<>(List.of("SPY", "TLT", "GLD", "SLV"));
        private double minConfidence = 0.6;
        private double minDirection = 0.3;
        private double baseStopPct = 0.01;
        private double referenceVolatility = 20.0;
        private double rewardMultiple = 2.5;
        private boolean trailing = false;
    }

    @Data
    public static class MarginFlow {
        private List<String> assets = new ArrayList<>(List.of("GLD", "SLV", "GDX"));
        private double minConfidence = 0.5;
        private double minDirection = 0.25;
        private double stopPct = 0.03;
        private double targetPct = 0.06;
        private double maxConfidence = 0.8;
        private boolean trailing = false;
    }

    @Data
    public static class NarrativeShock {
        private String sectorAsset = "IGV";
        private List<String> impairedNames = new ArrayList<>(List.of("LZ"));
        private List<String> punishedNames = new ArrayList<>(List.of("CRM", "SHOP", "ADBE", "MSFT", "WDAY"));
        private double selloffDirection = -0.3;
        private double selloffMinConfidence = 0.5;
        private double shortStopPct = 0.05;
        private double shortTargetPct = 0.15;
        private double recoveryDirection = 0.1;
        private double recoveryMinConfidence = 0.4;
        private double recoveryEntryDiscount = 0.99;
        private double recoveryStopPct = 0.07;
        private double recoveryTargetPct = 0.12;
        private double recoveryConfidenceFactor = 0.8;
    }

    @Data
    public static class CrossAssetGraph {
        private Map<String, Map<String, Double>> graph = defaultGraph();
        private double ownWeight = 0.5;
        private double minConfidence = 0.5;
        private double minDirection = 0.3;
        private double stopPct = 0.03;
        private double targetPct = 0.05;
        private boolean trailing = false;

        private static Map<String, Map<String, Double>> defaultGraph() {
            Map<String, Map<String, Double>> graph = new LinkedHashMap<>();
            graph.put("TLT", new LinkedHashMap<>(Map.of("GLD", 0.4, "HYG", -0.6)));
            graph.put("SPY", new LinkedHashMap<>(Map.of("HYG", 0.6, "TLT", -0.4)));
            return graph;
        }
    }
}
