package com.hydra.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

@Configuration
@ConfigurationProperties(prefix = "hydra.risk")
@Data
@Validated
public class RiskProperties {

    @Positive
    private double startingCapital = 100_000.0;

    @Positive
    @DecimalMax("1.0")
    private double maxPositionPct = 0.03;

    @Positive
    @DecimalMax("1.0")
    private double maxSingleAssetPct = 0.05;

    @Positive
    @DecimalMax("1.0")
    private double maxTotalExposurePct = 0.25;

    @Positive
    @DecimalMax("1.0")
    private double maxDailyLossPct = 0.05;

    @Min(1)
    private int maxConsecutiveLosses = 3;

    @Min(1)
    private int cooldownMinutes = 240;

    @Min(1)
    private int maxTradesPerDay = 30;

    @NotBlank
    private String tradingZone = "America/New_York";

    @Valid
    private Sizing sizing = new Sizing();

    public ZoneId tradingZoneId() {
        return ZoneId.of(tradingZone);
    }

    @Data
    public static class Sizing {
        @Positive
        private double riskPerTradePct = 0.03;

        @Positive
        @DecimalMax("1.0")
        private double kellyFraction = 0.5;

        @Positive
        private double winProbabilityBase = 0.50;

        private double winProbabilitySlope = 0.12;

        @Positive
        private double volatilitySensitivity = 2.0;

        @Positive
        @DecimalMax("1.0")
        private double volatilityFloor = 0.3;

        @Positive
        private double defaultVolatility = 0.02;

        @Min(2)
        private int volatilityLookback = 20;
    }
}
