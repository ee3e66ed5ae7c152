package com.hydra.backend.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignalRequest {

    @NotBlank
    private String sourceId;

    @NotBlank
    private String asset;

    @NotNull
    @DecimalMin("-1.0")
    @DecimalMax("1.0")
    private Double direction;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double strength;

    // falls back to the configured reliability for the source
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private Double reliability;

    @Positive
    private Long halfLifeSeconds;

    private Instant timestamp;
}
