package com.hydra.backend.controller;

import com.hydra.backend.model.Position;
import com.hydra.backend.model.TradeOutcome;
import com.hydra.backend.trading.pipeline.PositionLifecycleManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/positions")
@RequiredArgsConstructor
@Tag(name = "Positions")
public class PositionsController {

    private final PositionLifecycleManager lifecycleManager;

    @GetMapping
    public List<Position> openPositions() {
        return lifecycleManager.openPositions();
    }

    @PostMapping("/{id}/close")
    @Operation(summary = "Close an open position at the current price")
    public TradeOutcome close(@PathVariable String id) {
        return lifecycleManager.closeManually(id, Instant.now());
    }
}
