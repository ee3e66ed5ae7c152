package com.hydra.backend.trading.pipeline;

import com.hydra.backend.service.MetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fixed-rate driver for the decision cycle. A tick that arrives while the previous cycle is still running
 * is skipped, never queued.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "hydra.cycle.scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class CycleScheduler {

    private final TradeDecisionPipelineService pipelineService;
    private final MetricsService metricsService;

    @Qualifier("cycleExecutor")
    private final Executor cycleExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Scheduled(fixedRateString = "${hydra.cycle.interval-ms:60000}")
    public void tick() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Previous cycle still running; skipping this tick");
            metricsService.recordSkippedCycle();
            return;
        }
        try {
            cycleExecutor.execute(this::runGuarded);
        } catch (RejectedExecutionException e) {
            running.set(false);
            log.warn("Cycle executor rejected the tick; skipping");
            metricsService.recordSkippedCycle();
        }
    }

    boolean isRunning() {
        return running.get();
    }

    private void runGuarded() {
        try {
            pipelineService.runCycle(Instant.now());
        } catch (Exception e) {
            log.error("Decision cycle failed", e);
        } finally {
            running.set(false);
        }
    }
}
