package com.hydra.backend.controller;

import com.hydra.backend.dto.SignalRequest;
import com.hydra.backend.model.AggregatedScore;
import com.hydra.backend.service.signal.SignalIngestionService;
import com.hydra.backend.trading.pipeline.SignalAggregator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

@RestController
@RequestMapping("/api/signals")
@RequiredArgsConstructor
@Tag(name = "Signals")
public class SignalsController {

    private final SignalIngestionService signalIngestionService;
    private final SignalAggregator signalAggregator;

    @PostMapping
    @Operation(summary = "Ingest one signal; an older signal than the one held for its source and asset is ignored")
    public ResponseEntity<Map<String, Object>> ingest(@Valid @RequestBody SignalRequest request) {
        boolean stored = signalIngestionService.ingest(request, Instant.now());
        HttpStatus status = stored ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(Map.of(
                "stored", stored,
                "sourceId", request.getSourceId(),
                "asset", request.getAsset()));
    }

    @GetMapping("/{asset}")
    @Operation(summary = "Aggregated score for an asset")
    public AggregatedScore score(@PathVariable String asset) {
        return signalAggregator.aggregate(asset, Instant.now());
    }
}
