package com.hydra.backend.service.signal;

import com.hydra.backend.model.Signal;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * An upstream adapter polled in the background. Adapters own their retries and report an unreachable
 * upstream as an empty poll.
 */
public interface SignalSource {

    String sourceId();

    Duration pollInterval();

    List<Signal> poll(Instant now);
}
