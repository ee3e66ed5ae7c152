package com.hydra.backend.model;

import java.time.Duration;
import java.time.Instant;

/**
 * A scored observation from one source about one asset.
 * Newer signals from the same source for the same asset supersede older ones.
 */
public record Signal(
        String sourceId,
        String asset,
        double direction,
        double strength,
        double reliabilityWeight,
        Instant timestamp,
        Duration halfLife
) {

    private static final double LN2 = Math.log(2.0);

    public Signal {
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("Signal source is required");
        }
        if (asset == null || asset.isBlank()) {
            throw new IllegalArgumentException("Signal asset is required");
        }
        if (Double.isNaN(direction) || direction < -1.0 || direction > 1.0) {
            throw new IllegalArgumentException("Signal direction must be within [-1, 1]: " + direction);
        }
        if (Double.isNaN(strength) || strength < 0.0 || strength > 1.0) {
            throw new IllegalArgumentException("Signal strength must be within [0, 1]: " + strength);
        }
        if (Double.isNaN(reliabilityWeight) || reliabilityWeight <= 0.0 || reliabilityWeight > 1.0) {
            throw new IllegalArgumentException("Signal reliability must be within (0, 1]: " + reliabilityWeight);
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Signal timestamp is required");
        }
        if (halfLife == null || halfLife.isZero() || halfLife.isNegative()) {
            throw new IllegalArgumentException("Signal half-life must be positive");
        }
    }

    public SignalKey key() {
        return new SignalKey(sourceId, asset);
    }

    /**
     * Age in seconds; signals stamped in the future count as fresh.
     */
    public double ageSeconds(Instant now) {
        return Math.max(0.0, seconds(Duration.between(timestamp, now)));
    }

    public double effectiveWeight(Instant now) {
        double decay = Math.exp(-LN2 * ageSeconds(now) / seconds(halfLife));
        return reliabilityWeight * strength * decay;
    }

    public boolean isExpired(Instant now, double expiryHalfLives) {
        return ageSeconds(now) > expiryHalfLives * seconds(halfLife);
    }

    // full nanosecond precision, so a positive duration never reads as zero
    private static double seconds(Duration duration) {
        return duration.getSeconds() + duration.getNano() / 1_000_000_000.0;
    }

    public record SignalKey(String sourceId, String asset) {}
}
