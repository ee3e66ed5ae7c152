package com.hydra.backend.service.signal;

import com.hydra.backend.config.SignalProperties;
import com.hydra.backend.dto.SignalRequest;
import com.hydra.backend.model.Signal;
import com.hydra.backend.trading.pipeline.SignalAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Turns externally pushed signals into store entries, filling in the source's configured reliability
 * and half-life when the caller leaves them out.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalIngestionService {

    private final SignalAggregator signalAggregator;
    private final SignalProperties signalProperties;

    public Signal toSignal(SignalRequest request, Instant receivedAt) {
        String sourceId = request.getSourceId();
        double reliability = request.getReliability() != null
                ? request.getReliability()
                : signalProperties.reliabilityOf(sourceId);
        Duration halfLife = request.getHalfLifeSeconds() != null
                ? Duration.ofSeconds(request.getHalfLifeSeconds())
                : signalProperties.halfLifeOf(sourceId);
        Instant timestamp = request.getTimestamp() != null ? request.getTimestamp() : receivedAt;
        return new Signal(sourceId, request.getAsset(), request.getDirection(), request.getStrength(),
                reliability, timestamp, halfLife);
    }

    /**
     * @return true when the signal replaced (or created) the live entry for its source and asset
     */
    public boolean ingest(SignalRequest request, Instant receivedAt) {
        Signal signal = toSignal(request, receivedAt);
        boolean stored = signalAggregator.ingest(signal);
        if (!stored) {
            log.debug("Ignored stale signal {} for {} stamped {}", signal.sourceId(), signal.asset(), signal.timestamp());
        }
        return stored;
    }
}
