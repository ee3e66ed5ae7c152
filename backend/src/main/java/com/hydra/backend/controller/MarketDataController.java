package com.hydra.backend.controller;

import com.hydra.backend.dto.PriceUpdateRequest;
import com.hydra.backend.model.Candle;
import com.hydra.backend.service.marketdata.InMemoryPriceFeed;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/api/market-data")
@RequiredArgsConstructor
@Tag(name = "Market Data")
public class MarketDataController {

    private final InMemoryPriceFeed priceFeed;

    @PostMapping("/prices")
    @Operation(summary = "Push a price or bar into the paper price feed")
    public ResponseEntity<Void> pushPrice(@Valid @RequestBody PriceUpdateRequest request) {
        Instant at = request.getTimestamp() != null ? request.getTimestamp() : Instant.now();
        if (request.isBar()) {
            priceFeed.recordBar(request.getAsset(), Candle.builder()
                    .open(request.getOpen())
                    .high(request.getHigh())
                    .low(request.getLow())
                    .close(request.getClose())
                    .volume(request.getVolume() != null ? request.getVolume() : 0L)
                    .timestamp(at)
                    .build());
        } else {
            priceFeed.updatePrice(request.getAsset(), request.getClose(), at);
        }
        return ResponseEntity.noContent().build();
    }
}
