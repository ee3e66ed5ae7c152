package com.hydra.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final AtomicLong cycles = new AtomicLong();
    private final AtomicLong skippedCycles = new AtomicLong();
    private final AtomicLong approvals = new AtomicLong();
    private final ConcurrentHashMap<String, AtomicLong> rejectsByReason = new ConcurrentHashMap<>();
    private final AtomicReference<Double> openExposure = new AtomicReference<>(0.0);
    private final AtomicReference<Double> dailyPnl = new AtomicReference<>(0.0);

    private Counter approvalsCounter;
    private Counter skippedCyclesCounter;
    private Timer cycleTimer;

    @PostConstruct
    void init() {
        approvalsCounter = Counter.builder("hydra_proposals_approved_total").register(meterRegistry);
        skippedCyclesCounter = Counter.builder("hydra_cycles_skipped_total").register(meterRegistry);
        cycleTimer = Timer.builder("hydra_cycle_duration").register(meterRegistry);
        Gauge.builder("hydra_open_exposure", openExposure, AtomicReference::get).register(meterRegistry);
        Gauge.builder("hydra_daily_pnl", dailyPnl, AtomicReference::get).register(meterRegistry);
    }

    public void recordApproval() {
        approvals.incrementAndGet();
        if (approvalsCounter != null) {
            approvalsCounter.increment();
        }
    }

    public void recordReject(String reason) {
        rejectsByReason.computeIfAbsent(reason, key -> new AtomicLong()).incrementAndGet();
        Counter.builder("hydra_proposals_rejected_total")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordPositionClosed(boolean win) {
        Counter.builder("hydra_positions_closed_total")
                .tag("outcome", win ? "win" : "loss")
                .register(meterRegistry)
                .increment();
    }

    public void recordSkippedCycle() {
        skippedCycles.incrementAndGet();
        if (skippedCyclesCounter != null) {
            skippedCyclesCounter.increment();
        }
    }

    public void recordCycle(Duration duration) {
        cycles.incrementAndGet();
        if (cycleTimer != null) {
            cycleTimer.record(duration);
        }
    }

    public void updateRisk(double exposure, double pnl) {
        openExposure.set(exposure);
        dailyPnl.set(pnl);
    }

    public Snapshot snapshot() {
        Map<String, Long> rejects = new TreeMap<>();
        rejectsByReason.forEach((reason, count) -> rejects.put(reason, count.get()));
        return new Snapshot(cycles.get(), skippedCycles.get(), approvals.get(), rejects);
    }

    public record Snapshot(
            long cycles,
            long skippedCycles,
            long approvals,
            Map<String, Long> rejectsByReason
    ) {}
}
