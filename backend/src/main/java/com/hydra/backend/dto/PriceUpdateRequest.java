package com.hydra.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A last price, or a full bar when open/high/low are present.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceUpdateRequest {

    @NotBlank
    private String asset;

    @NotNull
    @Positive
    private Double close;

    @Positive
    private Double open;

    @Positive
    private Double high;

    @Positive
    private Double low;

    private Long volume;

    private Instant timestamp;

    public boolean isBar() {
        return open != null && high != null && low != null;
    }
}
