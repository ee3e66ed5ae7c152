package com.hydra.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "hydra.signals")
@Data
@Validated
public class SignalProperties {

    @Positive
    private double confidenceSaturation = 1.5;

    @Positive
    private double expiryHalfLives = 5.0;

    @Positive
    @DecimalMax("1.0")
    private double defaultReliability = 0.5;

    private Duration defaultHalfLife = Duration.ofMinutes(30);

    private Map<String, Double> reliability = new HashMap<>(Map.ofEntries(
            Map.entry("gex_levels", 0.85),
            Map.entry("funding_rate", 0.75),
            Map.entry("liquidation_map", 0.80),
            Map.entry("margin_hike", 0.90),
            Map.entry("vix_term", 0.70),
            Map.entry("credit_spread", 0.65),
            Map.entry("narrative_velocity", 0.60),
            Map.entry("physical_premium", 0.75),
            Map.entry("etf_flow", 0.70),
            Map.entry("labor_data", 0.80),
            Map.entry("order_flow", 0.75),
            Map.entry("candle_structure", 0.50)
    ));

    private Map<String, Duration> halfLife = new HashMap<>(Map.of(
            "funding_rate", Duration.ofMinutes(96),
            "liquidation_map", Duration.ofMinutes(12),
            "margin_hike", Duration.ofHours(6),
            "physical_premium", Duration.ofMinutes(288),
            "labor_data", Duration.ofMinutes(48),
            "narrative_velocity", Duration.ofMinutes(36)
    ));

    public double reliabilityOf(String sourceId) {
        return reliability.getOrDefault(sourceId, defaultReliability);
    }

    public Duration halfLifeOf(String sourceId) {
        return halfLife.getOrDefault(sourceId, defaultHalfLife);
    }
}
