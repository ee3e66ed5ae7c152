package com.hydra.backend.controller;

import com.hydra.backend.dto.RiskStatusResponse;
import com.hydra.backend.service.DashboardSnapshotService;
import com.hydra.backend.service.RiskEventService;
import com.hydra.backend.trading.pipeline.RiskState;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/risk")
@RequiredArgsConstructor
@Tag(name = "Risk")
public class RiskController {

    private final RiskState riskState;
    private final DashboardSnapshotService dashboardSnapshotService;
    private final RiskEventService riskEventService;

    @GetMapping("/status")
    @Operation(summary = "Capital, exposure and limit state of the risk ledger")
    public RiskStatusResponse status() {
        return dashboardSnapshotService.riskStatus();
    }

    @PostMapping("/resume")
    @Operation(summary = "Clear an accounting halt after operator review")
    public RiskStatusResponse resume() {
        boolean wasHalted = riskState.isHalted();
        riskState.resume();
        if (wasHalted) {
            riskEventService.record("ACCOUNTING_RESUMED", "Accounting halt cleared by operator", null);
        }
        return dashboardSnapshotService.riskStatus();
    }
}
