package com.hydra.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "hydra.cycle")
@Data
@Validated
public class CycleProperties {

    @Positive
    private long intervalMs = 60_000L;

    private boolean schedulerEnabled = true;

    @Positive
    private long priceTimeoutMs = 2_000L;

    @Positive
    @DecimalMax("1.0")
    private double breakevenThreshold = 0.5;
}
