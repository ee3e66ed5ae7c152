package com.hydra.backend.trading.pipeline;

import com.hydra.backend.service.MetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CycleSchedulerTest {

    private TradeDecisionPipelineService pipelineService;
    private MetricsService metricsService;
    private final List<Runnable> queued = new ArrayList<>();

    @BeforeEach
    void setUp() {
        pipelineService = mock(TradeDecisionPipelineService.class);
        metricsService = new MetricsService(new SimpleMeterRegistry());
    }

    @Test
    void tickWhileCycleRunsIsSkipped() {
        CycleScheduler scheduler = new CycleScheduler(pipelineService, metricsService, queued::add);

        scheduler.tick();
        scheduler.tick();

        assertThat(queued).hasSize(1);
        assertThat(scheduler.isRunning()).isTrue();
        assertThat(metricsService.snapshot().skippedCycles()).isEqualTo(1);

        queued.get(0).run();

        assertThat(scheduler.isRunning()).isFalse();
        verify(pipelineService, times(1)).runCycle(any());
    }

    @Test
    void nextTickRunsAfterCycleCompletes() {
        Executor direct = Runnable::run;
        CycleScheduler scheduler = new CycleScheduler(pipelineService, metricsService, direct);

        scheduler.tick();
        scheduler.tick();

        verify(pipelineService, times(2)).runCycle(any());
        assertThat(metricsService.snapshot().skippedCycles()).isZero();
    }

    @Test
    void failingCycleReleasesTheGuard() {
        when(pipelineService.runCycle(any())).thenThrow(new IllegalStateException("feed down"));
        CycleScheduler scheduler = new CycleScheduler(pipelineService, metricsService, Runnable::run);

        scheduler.tick();

        assertThat(scheduler.isRunning()).isFalse();
    }

    @Test
    void saturatedExecutorSkipsTick() {
        CycleScheduler scheduler = new CycleScheduler(pipelineService, metricsService, command -> {
            throw new RejectedExecutionException("full");
        });

        scheduler.tick();

        assertThat(scheduler.isRunning()).isFalse();
        assertThat(metricsService.snapshot().skippedCycles()).isEqualTo(1);
        verify(pipelineService, never()).runCycle(any());
    }
}
