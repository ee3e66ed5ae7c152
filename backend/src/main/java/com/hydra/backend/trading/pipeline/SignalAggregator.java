package com.hydra.backend.trading.pipeline;

import com.hydra.backend.config.SignalProperties;
import com.hydra.backend.model.AggregatedScore;
import com.hydra.backend.model.Signal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Signal store plus per-asset combination into a net direction and confidence.
 * <p>
 * Writers (source adapters, the ingestion endpoint) and the cycle's readers share one
 * read/write lock, so a read never sees a half-applied ingestion or purge.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalAggregator {

    private final SignalProperties properties;

    private final Map<Signal.SignalKey, Signal> signals = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Stores the signal unless the store already holds a newer one for the same source and asset.
     *
     * @return true when the signal was stored
     */
    public boolean ingest(Signal signal) {
        lock.writeLock().lock();
        try {
            Signal existing = signals.get(signal.key());
            if (existing != null && existing.timestamp().isAfter(signal.timestamp())) {
                log.debug("Ignoring out-of-order signal {} for {} (held {} > {})",
                        signal.sourceId(), signal.asset(), existing.timestamp(), signal.timestamp());
                return false;
            }
            signals.put(signal.key(), signal);
            log.debug("Ingested signal {} for {} dir={} strength={}",
                    signal.sourceId(), signal.asset(), signal.direction(), signal.strength());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int purgeExpired(Instant now) {
        lock.writeLock().lock();
        try {
            int purged = 0;
            Iterator<Signal> iterator = signals.values().iterator();
            while (iterator.hasNext()) {
                if (iterator.next().isExpired(now, properties.getExpiryHalfLives())) {
                    iterator.remove();
                    purged++;
                }
            }
            if (purged > 0) {
                log.debug("Purged {} expired signals", purged);
            }
            return purged;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public AggregatedScore aggregate(String asset, Instant now) {
        lock.readLock().lock();
        try {
            List<Signal> forAsset = new ArrayList<>();
            for (Signal signal : signals.values()) {
                if (signal.asset().equals(asset)) {
                    forAsset.add(signal);
                }
            }
            return combine(asset, forAsset, now);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Scores for every asset that currently holds at least one signal, computed from a single
     * consistent view of the store.
     */
    public Map<String, AggregatedScore> aggregateAll(Instant now) {
        lock.readLock().lock();
        try {
            Map<String, List<Signal>> byAsset = new TreeMap<>();
            for (Signal signal : signals.values()) {
                byAsset.computeIfAbsent(signal.asset(), key -> new ArrayList<>()).add(signal);
            }
            Map<String, AggregatedScore> scores = new TreeMap<>();
            byAsset.forEach((asset, list) -> {
                AggregatedScore score = combine(asset, list, now);
                if (score.hasSignals()) {
                    scores.put(asset, score);
                }
            });
            return scores;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Signal> liveSignals(Instant now) {
        lock.readLock().lock();
        try {
            return signals.values().stream()
                    .filter(signal -> !signal.isExpired(now, properties.getExpiryHalfLives()))
                    .sorted(Comparator.comparing(Signal::asset).thenComparing(Signal::sourceId))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return signals.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private AggregatedScore combine(String asset, List<Signal> candidates, Instant now) {
        double weightSum = 0.0;
        double directionalSum = 0.0;
        int count = 0;
        String dominantSource = null;
        double dominantContribution = -1.0;

        List<Signal> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparing(Signal::sourceId));
        for (Signal signal : ordered) {
            // expired but not yet purged signals are invisible
            if (signal.isExpired(now, properties.getExpiryHalfLives())) {
                continue;
            }
            double effective = signal.effectiveWeight(now);
            if (!Double.isFinite(effective)) {
                log.warn("Dropping signal {} for {} with non-finite weight", signal.sourceId(), asset);
                continue;
            }
            weightSum += effective;
            directionalSum += signal.direction() * effective;
            count++;
            double contribution = Math.abs(signal.direction() * effective);
            if (contribution > dominantContribution) {
                dominantContribution = contribution;
                dominantSource = signal.sourceId();
            }
        }

        if (count == 0) {
            return AggregatedScore.empty(asset);
        }
        double netDirection = weightSum > 0 ? clamp(directionalSum / weightSum, -1.0, 1.0) : 0.0;
        double confidence = clamp(weightSum / properties.getConfidenceSaturation(), 0.0, 1.0);
        return new AggregatedScore(asset, netDirection, confidence, count, dominantSource);
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(min, Math.min(max, value));
    }
}
