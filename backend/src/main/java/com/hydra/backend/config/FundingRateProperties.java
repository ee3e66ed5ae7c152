package com.hydra.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "hydra.sources.funding-rate")
@Data
public class FundingRateProperties {

    private boolean enabled = false;
    private String url = "https://fapi.binance.com/fapi/v1/premiumIndex";
    private String symbol = "BTCUSDT";
    private List<String> assets = new ArrayList<>(List.of("BTC/USD", "ETH/USD"));
    private Duration pollInterval = Duration.ofMinutes(5);
    private double extremeThreshold = 0.0005;
    private double saturationRate = 0.001;
}
