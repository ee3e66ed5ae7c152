package com.hydra.backend.model;

public record AggregatedScore(
        String asset,
        double netDirection,
        double confidence,
        int contributingSignalCount,
        String dominantSource
) {

    public static AggregatedScore empty(String asset) {
        return new AggregatedScore(asset, 0.0, 0.0, 0, null);
    }

    public boolean hasSignals() {
        return contributingSignalCount > 0;
    }
}
