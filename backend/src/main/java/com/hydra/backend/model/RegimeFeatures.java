package com.hydra.backend.model;

/**
 * Feature vector the regime classifier works from.
 *
 * @param volatilityLevel     volatility index level (VIX scale)
 * @param volatilityTermSlope longer-dated minus spot volatility; negative means backwardation
 * @param trendStrength       -1 (strong downtrend) to +1 (strong uptrend)
 * @param meanReversionScore  0 (trending) to 1 (strongly mean-reverting)
 * @param historyBars         number of benchmark bars the features were computed from
 */
public record RegimeFeatures(
        double volatilityLevel,
        double volatilityTermSlope,
        double trendStrength,
        double meanReversionScore,
        int historyBars
) {

    public static RegimeFeatures insufficient(int historyBars) {
        return new RegimeFeatures(0.0, 0.0, 0.0, 0.5, historyBars);
    }
}
