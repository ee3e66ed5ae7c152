package com.hydra.backend.trading.pipeline;

import com.hydra.backend.config.RegimeProperties;
import com.hydra.backend.model.Candle;
import com.hydra.backend.model.Regime;
import com.hydra.backend.model.RegimeFeatures;
import com.hydra.backend.model.RegimeState;
import com.hydra.backend.service.marketdata.PriceFeed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the process-wide current regime and re-classifies it once per cycle from the benchmark history.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegimeDetector {

    private final PriceFeed priceFeed;
    private final RegimeFeatureCalculator featureCalculator;
    private final RegimeClassifier classifier;
    private final RegimeProperties properties;

    private final AtomicReference<RegimeState> current = new AtomicReference<>(RegimeState.initial());

    public RegimeState detect(Instant now) {
        List<Candle> history = priceFeed.getOhlcHistory(properties.getBenchmarkAsset(), properties.getHistoryWindow());
        RegimeFeatures features;
        if (history.size() < properties.getMinHistory()) {
            features = RegimeFeatures.insufficient(history.size());
        } else {
            OptionalDouble volatility = priceFeed.getPrice(properties.getVolatilityIndex());
            OptionalDouble term = priceFeed.getPrice(properties.getTermVolatilityIndex());
            features = featureCalculator.compute(history, volatility, term);
        }
        return update(features, now);
    }

    /**
     * Classifies the given features against the current regime and stores the result.
     */
    public RegimeState update(RegimeFeatures features, Instant now) {
        RegimeState previous = current.get();
        RegimeState next = classifier.classify(features, previous.regime(), now);
        current.set(next);
        if (next.regime() != previous.regime()) {
            log.info("Regime {} -> {} (confidence {}, vol {}, slope {}, trend {}, mr {})",
                    previous.regime(), next.regime(), fmt(next.confidence()),
                    fmt(features.volatilityLevel()), fmt(features.volatilityTermSlope()),
                    fmt(features.trendStrength()), fmt(features.meanReversionScore()));
        }
        return next;
    }

    public RegimeState current() {
        return current.get();
    }

    /**
     * True when the regime is one of {@code eligible} and classified with enough confidence to act on.
     */
    public boolean permits(RegimeState state, Set<Regime> eligible) {
        return isActive(state, eligible, properties.getMinActivationConfidence());
    }

    public static boolean isActive(RegimeState state, Set<Regime> eligible, double minConfidence) {
        return state != null
                && state.regime() != Regime.UNKNOWN
                && eligible.contains(state.regime())
                && state.confidence() > minConfidence;
    }

    private static String fmt(double value) {
        return String.format("%.2f", value);
    }
}
