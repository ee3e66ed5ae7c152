package com.hydra.backend.model;

import java.time.Instant;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Immutable view of aggregated scores and latest prices taken at cycle start.
 * Strategies read only from this.
 */
public record MarketSnapshot(
        Map<String, AggregatedScore> scores,
        Map<String, Double> prices,
        Instant takenAt
) {

    public MarketSnapshot {
        scores = Map.copyOf(scores);
        prices = Map.copyOf(prices);
    }

    public AggregatedScore score(String asset) {
        return scores.getOrDefault(asset, AggregatedScore.empty(asset));
    }

    public OptionalDouble price(String asset) {
        Double price = prices.get(asset);
        return price != null && price > 0 ? OptionalDouble.of(price) : OptionalDouble.empty();
    }
}
