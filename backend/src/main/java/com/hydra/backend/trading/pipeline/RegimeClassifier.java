package com.hydra.backend.trading.pipeline;

import com.hydra.backend.config.RegimeProperties;
import com.hydra.backend.model.Regime;
import com.hydra.backend.model.RegimeFeatures;
import com.hydra.backend.model.RegimeState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Stateless regime classification. The only memory is the previous regime, passed in by the caller,
 * which gates the CRASH to RECOVERY transition.
 */
@Component
@RequiredArgsConstructor
public class RegimeClassifier {

    private final RegimeProperties properties;

    public RegimeState classify(RegimeFeatures features, Regime previous, Instant detectedAt) {
        if (features.historyBars() < properties.getMinHistory()) {
            return RegimeState.unknown(features, 0.0, detectedAt);
        }
        double volatility = features.volatilityLevel();
        double trend = features.trendStrength();
        double meanReversion = features.meanReversionScore();
        double volScore = volatilityScore(volatility);

        if (volatility > properties.getCrashVolatility() && trend < properties.getCrashTrend()) {
            return state(Regime.CRASH, Math.min(1.0, volScore + 0.2), features, detectedAt);
        }
        if (volatility > properties.getHighVolatility() && features.volatilityTermSlope() < 0) {
            return state(Regime.HIGH_VOL_EXPANSION, 0.6 + volScore * 0.3, features, detectedAt);
        }
        if (previous == Regime.CRASH
                && trend > properties.getRecoveryTrend()
                && volatility > properties.getRecoveryVolatility()) {
            return state(Regime.RECOVERY, 0.6, features, detectedAt);
        }
        if (Math.abs(trend) > properties.getTrendThreshold()
                && meanReversion < properties.getTrendingMaxMeanReversion()) {
            Regime regime = trend > 0 ? Regime.TRENDING_UP : Regime.TRENDING_DOWN;
            return state(regime, Math.abs(trend), features, detectedAt);
        }
        if (meanReversion > properties.getMeanReversionThreshold()
                && volatility < properties.getHighVolatility()) {
            return state(Regime.MEAN_REVERTING, meanReversion, features, detectedAt);
        }
        return RegimeState.unknown(features, properties.getUnknownConfidence(), detectedAt);
    }

    /**
     * Volatility index on a 0..1 fear scale.
     */
    public static double volatilityScore(double volatility) {
        if (volatility < 12) return 0.0;
        if (volatility < 16) return 0.2;
        if (volatility < 20) return 0.4;
        if (volatility < 25) return 0.6;
        if (volatility < 35) return 0.8;
        return 1.0;
    }

    private static RegimeState state(Regime regime, double confidence, RegimeFeatures features, Instant at) {
        return new RegimeState(regime, Math.max(0.0, Math.min(1.0, confidence)), features, at);
    }
}
