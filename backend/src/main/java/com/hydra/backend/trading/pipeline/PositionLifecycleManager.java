package com.hydra.backend.trading.pipeline;

import com.hydra.backend.config.CycleProperties;
import com.hydra.backend.dto.HydraEvent;
import com.hydra.backend.dto.HydraEvent.EventType;
import com.hydra.backend.exception.RiskInvariantViolationException;
import com.hydra.backend.exception.TradingException;
import com.hydra.backend.model.Position;
import com.hydra.backend.model.TradeDirection;
import com.hydra.backend.model.TradeOutcome;
import com.hydra.backend.model.TradeOutcome.ExitReason;
import com.hydra.backend.model.TradeProposal;
import com.hydra.backend.service.MetricsService;
import com.hydra.backend.service.NotificationService;
import com.hydra.backend.service.TradeJournalService;
import com.hydra.backend.service.execution.ExecutionResult;
import com.hydra.backend.service.execution.OrderExecutor;
import com.hydra.backend.service.marketdata.PriceFeed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * Owns the open positions: opens them on fills, walks them every cycle for stop, target and trailing
 * updates, and settles closes back into the risk ledger and the strategy weights.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionLifecycleManager {

    private final PriceFeed priceFeed;
    private final OrderExecutor orderExecutor;
    private final RiskState riskState;
    private final StrategyWeightService weightService;
    private final TradeJournalService tradeJournalService;
    private final NotificationService notificationService;
    private final MetricsService metricsService;
    private final CycleProperties cycleProperties;

    private final Map<String, Position> positions = new LinkedHashMap<>();
    private final Object positionsLock = new Object();

    public Position open(RiskDecision decision, ExecutionResult fill, Instant now) {
        TradeProposal proposal = decision.proposal();
        double entry = fill.fillPrice() > 0 ? fill.fillPrice() : proposal.entry();
        Position position = Position.builder()
                .id(UUID.randomUUID().toString())
                .asset(proposal.asset())
                .direction(proposal.direction())
                .entryPrice(entry)
                .initialStop(proposal.stop())
                .stop(proposal.stop())
                .target(proposal.target())
                .notional(decision.sizedNotional())
                .openedAt(now)
                .owningStrategyId(proposal.strategyId())
                .trailingEnabled(proposal.trailing())
                .bestPrice(entry)
                .build();
        synchronized (positionsLock) {
            positions.put(position.getId(), position);
        }
        log.info("Opened {} {} {} notional {} entry {} stop {} target {}", position.getId(), position.getDirection(),
                position.getAsset(), String.format("%.2f", position.getNotional()), entry, position.getStop(),
                position.getTarget());
        notificationService.publish(HydraEvent.of(EventType.POSITION_OPENED,
                proposal.strategyId() + " opened " + proposal.direction() + " " + proposal.asset(),
                Map.of("positionId", position.getId(), "notional", position.getNotional(), "entry", entry)));
        return position.toBuilder().build();
    }

    /**
     * One pass over every open position. Returns the outcomes of positions closed in this pass.
     */
    public List<TradeOutcome> manage(Instant now) {
        List<TradeOutcome> closed = new ArrayList<>();
        for (Position position : openPositions()) {
            OptionalDouble price = priceFeed.getPrice(position.getAsset());
            if (price.isEmpty() || price.getAsDouble() <= 0) {
                flagUnpriced(position.getId());
                continue;
            }
            evaluate(position.getId(), price.getAsDouble(), now).ifPresent(closed::add);
        }
        return closed;
    }

    public TradeOutcome closeManually(String positionId, Instant now) {
        Position position;
        synchronized (positionsLock) {
            position = positions.get(positionId);
        }
        if (position == null) {
            throw new NoSuchElementException("No open position " + positionId);
        }
        OptionalDouble price = priceFeed.getPrice(position.getAsset());
        if (price.isEmpty()) {
            throw new TradingException("No price available to close " + positionId);
        }
        Position closing;
        synchronized (positionsLock) {
            Position current = positions.get(positionId);
            if (current == null) {
                throw new NoSuchElementException("Position " + positionId + " already closed");
            }
            if (current.isClosing()) {
                throw new TradingException("Position " + positionId + " is already being closed");
            }
            closing = markClosing(current);
        }
        return close(closing, price.getAsDouble(), ExitReason.MANUAL, now)
                .orElseThrow(() -> new TradingException("Broker refused to close " + positionId));
    }

    public List<Position> openPositions() {
        synchronized (positionsLock) {
            return positions.values().stream()
                    .map(position -> position.toBuilder().build())
                    .sorted(Comparator.comparing(Position::getOpenedAt))
                    .toList();
        }
    }

    public int openCount() {
        synchronized (positionsLock) {
            return positions.size();
        }
    }

    private Optional<TradeOutcome> evaluate(String positionId, double price, Instant now) {
        Position closing;
        ExitReason reason;
        synchronized (positionsLock) {
            Position position = positions.get(positionId);
            if (position == null || position.isClosing()) {
                return Optional.empty();
            }
            position.setLastPrice(price);
            position.setPriceUnavailable(false);
            if (position.isStopHit(price)) {
                reason = ExitReason.STOP;
            } else if (position.isTargetHit(price)) {
                reason = ExitReason.TARGET;
            } else {
                if (position.isTrailingEnabled()) {
                    ratchetStop(position, price);
                }
                return Optional.empty();
            }
            closing = markClosing(position);
        }
        return close(closing, price, reason, now);
    }

    // caller holds positionsLock; returns a copy to work on outside the lock
    private Position markClosing(Position position) {
        position.setClosing(true);
        return position.toBuilder().build();
    }

    /**
     * Moves the stop only in the position's favour. Once price has covered the breakeven threshold of the
     * entry to target distance the stop goes to at least entry, then trails the best price by the initial risk.
     */
    void ratchetStop(Position position, double price) {
        boolean isLong = position.getDirection() == TradeDirection.LONG;
        double best = isLong ? Math.max(position.getBestPrice(), price) : Math.min(position.getBestPrice(), price);
        position.setBestPrice(best);

        double entry = position.getEntryPrice();
        double distance = Math.abs(position.getTarget() - entry);
        double progress = distance > 0 ? (best - entry) * position.getDirection().sign() / distance : 0.0;
        if (!position.isTrailingActive() && progress >= cycleProperties.getBreakevenThreshold()) {
            position.setTrailingActive(true);
        }
        if (!position.isTrailingActive()) {
            return;
        }
        double risk = position.initialRiskPerUnit();
        double candidate = isLong ? Math.max(entry, best - risk) : Math.min(entry, best + risk);
        boolean tighter = isLong ? candidate > position.getStop() : candidate < position.getStop();
        if (tighter) {
            log.info("Trailing stop {} {} {} -> {}", position.getId(), position.getAsset(), position.getStop(), candidate);
            position.setStop(candidate);
        }
    }

    private void flagUnpriced(String positionId) {
        Position position;
        synchronized (positionsLock) {
            position = positions.get(positionId);
            if (position == null || position.isPriceUnavailable()) {
                return;
            }
            position.setPriceUnavailable(true);
        }
        log.warn("Position {} on {} cannot be priced; left open", positionId, position.getAsset());
        notificationService.publish(HydraEvent.of(EventType.POSITION_UNPRICED,
                "No price for " + position.getAsset() + ", position left open",
                Map.of("positionId", positionId, "asset", position.getAsset())));
    }

    /**
     * Sends the close to the broker without holding the positions lock, then settles. The position must
     * already be marked closing.
     */
    private Optional<TradeOutcome> close(Position position, double price, ExitReason reason, Instant now) {
        ExecutionResult result;
        try {
            result = orderExecutor.closePosition(position, price);
        } catch (RuntimeException e) {
            result = ExecutionResult.rejected(e.getMessage());
        }
        if (!result.filled()) {
            synchronized (positionsLock) {
                Position current = positions.get(position.getId());
                if (current != null) {
                    current.setClosing(false);
                }
            }
            log.warn("Close of {} on {} failed ({}); position stays open", position.getId(), position.getAsset(),
                    result.message());
            notificationService.publish(HydraEvent.of(EventType.ORDER_REJECTED,
                    "Close rejected for " + position.getAsset(),
                    Map.of("positionId", position.getId(), "reason", String.valueOf(result.message()))));
            return Optional.empty();
        }

        double exit = result.fillPrice();
        double pnl = position.pnlAt(exit);
        synchronized (positionsLock) {
            positions.remove(position.getId());
        }
        TradeOutcome outcome = new TradeOutcome(position.getId(), position.getOwningStrategyId(), position.getAsset(),
                position.getDirection(), position.getEntryPrice(), exit, position.getNotional(), pnl,
                position.rMultipleAt(exit), reason, position.getOpenedAt(), now);

        RiskState.CloseEffect effect = new RiskState.CloseEffect(false, false);
        try {
            effect = riskState.recordClose(position.getAsset(), position.getNotional(), pnl, now);
        } catch (RiskInvariantViolationException e) {
            log.error("Ledger check failed while closing {}", position.getId(), e);
            notificationService.publish(HydraEvent.of(EventType.ACCOUNTING_HALT, e.getMessage(),
                    Map.of("positionId", position.getId())));
        }

        log.info("Closed {} {} {} by {} @ {} pnl {} ({}R)", position.getId(), position.getDirection(),
                position.getAsset(), reason, exit, String.format("%.2f", pnl),
                String.format("%.2f", outcome.rMultiple()));
        weightService.recordOutcome(outcome);
        tradeJournalService.record(outcome);
        metricsService.recordPositionClosed(outcome.win());
        notificationService.publish(HydraEvent.of(EventType.POSITION_CLOSED,
                position.getAsset() + " closed by " + reason,
                Map.of("positionId", position.getId(), "pnl", pnl, "rMultiple", outcome.rMultiple(),
                        "strategy", position.getOwningStrategyId())));
        if (effect.cooldownStarted()) {
            notificationService.publish(HydraEvent.of(EventType.COOLDOWN_STARTED,
                    "Consecutive loss limit reached", Map.of("lastPosition", position.getId())));
        }
        if (effect.killSwitchTripped()) {
            notificationService.publish(HydraEvent.of(EventType.KILL_SWITCH_TRIPPED,
                    "Daily loss limit reached; approvals blocked for the day", Map.of("lastPosition", position.getId())));
        }
        return Optional.of(outcome);
    }
}
