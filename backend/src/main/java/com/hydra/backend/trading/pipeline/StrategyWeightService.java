package com.hydra.backend.trading.pipeline;

import com.hydra.backend.config.StrategyProperties;
import com.hydra.backend.model.StrategyWeight;
import com.hydra.backend.model.TradeOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-strategy ranking weights recalibrated from the trailing win rate of realised outcomes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StrategyWeightService {

    private static final double DEFAULT_WEIGHT = 1.0;

    private final StrategyProperties properties;

    private final Map<String, Deque<Boolean>> outcomes = new ConcurrentHashMap<>();
    private final Map<String, StrategyWeight> weights = new ConcurrentHashMap<>();

    public void recordOutcome(TradeOutcome outcome) {
        Deque<Boolean> window = outcomes.computeIfAbsent(outcome.strategyId(), key -> new ArrayDeque<>());
        synchronized (window) {
            window.addLast(outcome.win());
            while (window.size() > properties.getOutcomeWindow()) {
                window.removeFirst();
            }
        }
    }

    public void recalibrate() {
        outcomes.forEach((strategyId, window) -> {
            int samples;
            int wins;
            synchronized (window) {
                samples = window.size();
                wins = (int) window.stream().filter(Boolean::booleanValue).count();
            }
            if (samples < properties.getMinTradesForWeight()) {
                return;
            }
            double winRate = (double) wins / samples;
            double weight = Math.max(properties.getWeightFloor(),
                    Math.min(properties.getWeightCeiling(), winRate * 2.0));
            StrategyWeight previous = weights.put(strategyId, new StrategyWeight(strategyId, weight, winRate, samples));
            double before = previous != null ? previous.weight() : DEFAULT_WEIGHT;
            log.info("Strategy {} weight {} -> {} (win rate {} over {} trades)",
                    strategyId, String.format("%.2f", before), String.format("%.2f", weight),
                    String.format("%.2f", winRate), samples);
        });
    }

    public double weightOf(String strategyId) {
        StrategyWeight weight = weights.get(strategyId);
        return weight != null ? weight.weight() : DEFAULT_WEIGHT;
    }

    public List<StrategyWeight> weights(List<String> strategyIds) {
        Map<String, StrategyWeight> view = new TreeMap<>();
        for (String id : strategyIds) {
            view.put(id, weights.getOrDefault(id, new StrategyWeight(id, DEFAULT_WEIGHT, 0.0, 0)));
        }
        view.putAll(weights);
        return List.copyOf(view.values());
    }
}
