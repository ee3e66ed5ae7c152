package com.hydra.backend.trading.pipeline;

import com.hydra.backend.model.RegimeState;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

public record CycleReport(
        long cycleNumber,
        Instant startedAt,
        Duration duration,
        RegimeState regime,
        int activeStrategies,
        int proposalsGenerated,
        int proposalsForwarded,
        int approved,
        int positionsOpened,
        Map<RejectReason, Integer> rejections,
        int positionsClosed,
        boolean accountingHalted
) {}
