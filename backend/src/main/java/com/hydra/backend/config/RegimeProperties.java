package com.hydra.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "hydra.regime")
@Data
@Validated
public class RegimeProperties {

    @NotBlank
    private String benchmarkAsset = "SPY";

    @NotBlank
    private String volatilityIndex = "VIX";

    @NotBlank
    private String termVolatilityIndex = "VIX3M";

    @Min(50)
    private int historyWindow = 100;

    @Min(2)
    private int minHistory = 20;

    private double crashVolatility = 30.0;
    private double crashTrend = -0.5;
    private double highVolatility = 22.0;
    private double recoveryVolatility = 18.0;
    private double recoveryTrend = 0.1;
    private double trendThreshold = 0.3;
    private double trendingMaxMeanReversion = 0.4;
    private double meanReversionThreshold = 0.55;
    private double minActivationConfidence = 0.4;
    private double unknownConfidence = 0.3;
}
