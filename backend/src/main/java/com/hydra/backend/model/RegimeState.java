package com.hydra.backend.model;

import java.time.Instant;

public record RegimeState(
        Regime regime,
        double confidence,
        RegimeFeatures features,
        Instant detectedAt
) {

    public static RegimeState unknown(RegimeFeatures features, double confidence, Instant detectedAt) {
        return new RegimeState(Regime.UNKNOWN, confidence, features, detectedAt);
    }

    public static RegimeState initial() {
        return new RegimeState(Regime.UNKNOWN, 0.0, RegimeFeatures.insufficient(0), Instant.EPOCH);
    }
}
