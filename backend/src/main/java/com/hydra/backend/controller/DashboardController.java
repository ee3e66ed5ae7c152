package com.hydra.backend.controller;

import com.hydra.backend.dto.DashboardSnapshot;
import com.hydra.backend.service.DashboardSnapshotService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/dashboard")
@RequiredArgsConstructor
@Tag(name = "Dashboard")
public class DashboardController {

    private final DashboardSnapshotService dashboardSnapshotService;

    @GetMapping("/snapshot")
    @Operation(summary = "Signals, regime, positions, risk, weights and metrics in one read")
    public DashboardSnapshot snapshot() {
        return dashboardSnapshotService.snapshot();
    }
}
