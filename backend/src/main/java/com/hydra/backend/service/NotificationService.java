package com.hydra.backend.service;

import com.hydra.backend.dto.HydraEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget event channel. Delivery runs on its own executor and failures are logged, never
 * propagated back into the decision cycle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    public static final String EVENTS_TOPIC = "/topic/events";

    private final SimpMessagingTemplate messagingTemplate;
    private final RiskEventService riskEventService;

    @Qualifier("notificationExecutor")
    private final Executor notificationExecutor;

    public void publish(HydraEvent event) {
        try {
            notificationExecutor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.warn("Dropped {} event, notification queue full: {}", event.type(), event.message());
        }
    }

    private void deliver(HydraEvent event) {
        try {
            messagingTemplate.convertAndSend(EVENTS_TOPIC, event);
        } catch (Exception e) {
            log.warn("Failed to push {} event: {}", event.type(), e.getMessage());
        }
        if (event.type().isRiskEvent()) {
            try {
                riskEventService.record(event.type().name(), event.message(), String.valueOf(event.details()));
            } catch (Exception e) {
                log.warn("Failed to persist {} risk event: {}", event.type(), e.getMessage());
            }
        }
    }
}
