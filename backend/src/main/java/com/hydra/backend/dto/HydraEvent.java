package com.hydra.backend.dto;

import java.time.Instant;
import java.util.Map;

/**
 * Structured event pushed to external alerting.
 */
public record HydraEvent(
        EventType type,
        String message,
        Map<String, Object> details,
        Instant timestamp
) {

    public static HydraEvent of(EventType type, String message, Map<String, Object> details) {
        return new HydraEvent(type, message, Map.copyOf(details), Instant.now());
    }

    public enum EventType {
        PROPOSAL_APPROVED(false),
        PROPOSAL_REJECTED(false),
        POSITION_OPENED(false),
        POSITION_CLOSED(false),
        POSITION_UNPRICED(true),
        COOLDOWN_STARTED(true),
        KILL_SWITCH_TRIPPED(true),
        ACCOUNTING_HALT(true),
        ORDER_REJECTED(true);

        private final boolean riskEvent;

        EventType(boolean riskEvent) {
            this.riskEvent = riskEvent;
        }

        public boolean isRiskEvent() {
            return riskEvent;
        }
    }
}
