package com.hydra.backend.service.marketdata;

import com.hydra.backend.model.Candle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Paper-mode price store fed through the market data endpoint.
 */
@Slf4j
@Component
public class InMemoryPriceFeed implements PriceFeed {

    static final int MAX_BARS = 500;

    private final Map<String, Double> latest = new ConcurrentHashMap<>();
    private final Map<String, Deque<Candle>> bars = new ConcurrentHashMap<>();

    @Override
    public OptionalDouble getPrice(String asset) {
        Double price = latest.get(asset);
        return price != null ? OptionalDouble.of(price) : OptionalDouble.empty();
    }

    @Override
    public List<Candle> getOhlcHistory(String asset, int window) {
        Deque<Candle> series = bars.get(asset);
        if (series == null) {
            return List.of();
        }
        synchronized (series) {
            List<Candle> all = new ArrayList<>(series);
            return List.copyOf(all.subList(Math.max(0, all.size() - window), all.size()));
        }
    }

    /**
     * Records a last-trade price as a flat bar.
     */
    public void updatePrice(String asset, double price, Instant at) {
        recordBar(asset, Candle.builder()
                .open(price)
                .high(price)
                .low(price)
                .close(price)
                .volume(0)
                .timestamp(at)
                .build());
    }

    public void recordBar(String asset, Candle candle) {
        if (candle.getClose() <= 0) {
            throw new IllegalArgumentException("Close price must be positive for " + asset);
        }
        Deque<Candle> series = bars.computeIfAbsent(asset, key -> new ArrayDeque<>());
        synchronized (series) {
            series.addLast(candle);
            while (series.size() > MAX_BARS) {
                series.removeFirst();
            }
        }
        latest.put(asset, candle.getClose());
        log.debug("Price update {} -> {}", asset, candle.getClose());
    }

    public void clear(String asset) {
        latest.remove(asset);
        bars.remove(asset);
    }
}
