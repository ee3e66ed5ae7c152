package com.hydra.backend.service.signal;

import com.hydra.backend.model.Signal;
import com.hydra.backend.trading.pipeline.SignalAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls every registered source on its own cadence and writes the results into the aggregator,
 * independently of the decision cycle.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "hydra.sources.polling-enabled", havingValue = "true", matchIfMissing = true)
public class SignalSourcePoller {

    private final List<SignalSource> sources;
    private final SignalAggregator signalAggregator;
    private final Executor signalExecutor;

    private final Map<String, Instant> lastPolled = new ConcurrentHashMap<>();
    private final Map<String, AtomicBoolean> inFlight = new ConcurrentHashMap<>();

    public SignalSourcePoller(ObjectProvider<SignalSource> sources,
                              SignalAggregator signalAggregator,
                              @Qualifier("signalExecutor") Executor signalExecutor) {
        this.sources = sources.orderedStream().toList();
        this.signalAggregator = signalAggregator;
        this.signalExecutor = signalExecutor;
        log.info("Signal sources registered: {}", this.sources.stream().map(SignalSource::sourceId).toList());
    }

    @Scheduled(fixedDelayString = "${hydra.sources.tick-ms:5000}")
    public void tick() {
        pollDue(Instant.now());
    }

    /**
     * Starts a poll for every source whose interval has elapsed and that is not already being polled.
     */
    void pollDue(Instant now) {
        for (SignalSource source : sources) {
            Instant last = lastPolled.get(source.sourceId());
            if (last != null && now.isBefore(last.plus(source.pollInterval()))) {
                continue;
            }
            AtomicBoolean busy = inFlight.computeIfAbsent(source.sourceId(), key -> new AtomicBoolean(false));
            if (!busy.compareAndSet(false, true)) {
                continue;
            }
            lastPolled.put(source.sourceId(), now);
            try {
                signalExecutor.execute(() -> pollOnce(source, busy));
            } catch (RejectedExecutionException e) {
                busy.set(false);
                log.warn("Signal executor saturated; {} poll skipped", source.sourceId());
            }
        }
    }

    private void pollOnce(SignalSource source, AtomicBoolean busy) {
        try {
            List<Signal> signals = source.poll(Instant.now());
            int stored = 0;
            for (Signal signal : signals) {
                if (signalAggregator.ingest(signal)) {
                    stored++;
                }
            }
            log.debug("Source {} produced {} signals ({} stored)", source.sourceId(), signals.size(), stored);
        } catch (Exception e) {
            log.warn("Source {} poll failed: {}", source.sourceId(), e.getMessage());
        } finally {
            busy.set(false);
        }
    }
}
