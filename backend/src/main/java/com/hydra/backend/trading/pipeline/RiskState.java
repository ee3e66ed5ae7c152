package com.hydra.backend.trading.pipeline;

import com.hydra.backend.config.RiskProperties;
import com.hydra.backend.exception.RiskInvariantViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Capital and exposure ledger. Every read and mutation happens under one reentrant lock; callers that
 * need several steps to be atomic (evaluate then reserve) wrap them in {@link #locked(Supplier)}.
 * <p>
 * Reservations re-check the exposure caps after mutating. A failed check latches an accounting halt
 * before the exception leaves the ledger.
 */
@Slf4j
@Component
public class RiskState {

    private static final double EPSILON = 1e-6;

    private final RiskProperties properties;
    private final ReentrantLock lock = new ReentrantLock();

    private final double startingCapital;
    private double capital;
    private double equityHighWaterMark;
    private double maxDrawdown;
    private double dayStartCapital;
    private double dailyRealizedPnl;
    private double totalRealizedPnl;
    private final Map<String, Double> exposureByAsset = new HashMap<>();
    private double openExposureTotal;
    private int consecutiveLosses;
    private Instant cooldownUntil;
    private int tradesToday;
    private LocalDate tradingDay;
    private boolean killSwitchTripped;
    private boolean halted;
    private String haltReason;
    private int closedTrades;
    private int wins;
    private int losses;

    public RiskState(RiskProperties properties) {
        this.properties = properties;
        this.startingCapital = properties.getStartingCapital();
        this.capital = startingCapital;
        this.equityHighWaterMark = startingCapital;
        this.dayStartCapital = startingCapital;
    }

    public <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resets the daily counters and the kill-switch latch when {@code now} falls on a new trading day.
     *
     * @return true when a reset happened
     */
    public boolean rollTradingDay(Instant now) {
        return locked(() -> {
            LocalDate today = now.atZone(properties.tradingZoneId()).toLocalDate();
            if (today.equals(tradingDay)) {
                return false;
            }
            boolean firstDay = tradingDay == null;
            if (!firstDay) {
                log.info("Trading day {} -> {}: daily PnL {} over {} trades reset",
                        tradingDay, today, String.format("%.2f", dailyRealizedPnl), tradesToday);
            }
            tradingDay = today;
            dailyRealizedPnl = 0.0;
            tradesToday = 0;
            killSwitchTripped = false;
            dayStartCapital = capital;
            return !firstDay;
        });
    }

    /**
     * Latches the kill switch once the day's realised loss reaches the limit.
     *
     * @return true when the kill switch is (now or already) tripped
     */
    public boolean checkKillSwitch() {
        return locked(() -> {
            if (!killSwitchTripped
                    && dailyRealizedPnl <= -properties.getMaxDailyLossPct() * dayStartCapital) {
                killSwitchTripped = true;
                log.warn("Kill switch tripped: daily PnL {} <= -{}% of {}",
                        String.format("%.2f", dailyRealizedPnl), properties.getMaxDailyLossPct() * 100,
                        String.format("%.2f", dayStartCapital));
            }
            return killSwitchTripped;
        });
    }

    /**
     * @return true while a cooldown is running; an elapsed cooldown clears the loss streak
     */
    public boolean inCooldown(Instant now) {
        return locked(() -> {
            if (cooldownUntil == null) {
                return false;
            }
            if (now.isBefore(cooldownUntil)) {
                return true;
            }
            log.info("Cooldown ended at {}", cooldownUntil);
            cooldownUntil = null;
            consecutiveLosses = 0;
            return false;
        });
    }

    public void reserve(String asset, double notional) {
        locked(() -> {
            exposureByAsset.merge(asset, notional, Double::sum);
            openExposureTotal += notional;
            tradesToday++;
            verifyReservation(asset);
            return null;
        });
    }

    /**
     * Returns exposure that never turned into a position; a broker rejection also refunds the trade count.
     */
    public void release(String asset, double notional, boolean refundTrade) {
        locked(() -> {
            releaseExposure(asset, notional);
            if (refundTrade && tradesToday > 0) {
                tradesToday--;
            }
            verifyNonNegative(asset);
            return null;
        });
    }

    public CloseEffect recordClose(String asset, double notional, double realizedPnl, Instant now) {
        return locked(() -> {
            releaseExposure(asset, notional);
            capital += realizedPnl;
            dailyRealizedPnl += realizedPnl;
            totalRealizedPnl += realizedPnl;
            closedTrades++;
            if (capital > equityHighWaterMark) {
                equityHighWaterMark = capital;
            }
            if (equityHighWaterMark > 0) {
                maxDrawdown = Math.max(maxDrawdown, (equityHighWaterMark - capital) / equityHighWaterMark);
            }

            boolean cooldownStarted = false;
            if (realizedPnl < 0) {
                losses++;
                consecutiveLosses++;
                if (consecutiveLosses >= properties.getMaxConsecutiveLosses()) {
                    // every loss at or past the limit re-arms the cooldown, even after an earlier one lapsed
                    cooldownStarted = cooldownUntil == null || !now.isBefore(cooldownUntil);
                    cooldownUntil = now.plus(Duration.ofMinutes(properties.getCooldownMinutes()));
                    log.warn("{} consecutive losses, cooldown until {}", consecutiveLosses, cooldownUntil);
                }
            } else {
                // a flat close breaks the streak
                wins++;
                consecutiveLosses = 0;
            }
            boolean wasTripped = killSwitchTripped;
            boolean tripped = checkKillSwitch();
            verifyNonNegative(asset);
            return new CloseEffect(cooldownStarted, tripped && !wasTripped);
        });
    }

    public void halt(String reason) {
        locked(() -> {
            if (!halted) {
                halted = true;
                haltReason = reason;
                log.error("Accounting halt: {}", reason);
            }
            return null;
        });
    }

    public void resume() {
        locked(() -> {
            if (halted) {
                log.warn("Accounting halt cleared by operator (was: {})", haltReason);
            }
            halted = false;
            haltReason = null;
            return null;
        });
    }

    public boolean isHalted() {
        return locked(() -> halted);
    }

    public double capital() {
        return locked(() -> capital);
    }

    public int tradesToday() {
        return locked(() -> tradesToday);
    }

    public double exposure(String asset) {
        return locked(() -> exposureByAsset.getOrDefault(asset, 0.0));
    }

    public double openExposureTotal() {
        return locked(() -> openExposureTotal);
    }

    public int consecutiveLosses() {
        return locked(() -> consecutiveLosses);
    }

    public double perAssetCap() {
        return locked(() -> properties.getMaxSingleAssetPct() * capital);
    }

    public double totalExposureCap() {
        return locked(() -> properties.getMaxTotalExposurePct() * capital);
    }

    public double perPositionCap() {
        return locked(() -> properties.getMaxPositionPct() * capital);
    }

    public RiskSnapshot snapshot() {
        return locked(() -> new RiskSnapshot(
                startingCapital,
                capital,
                equityHighWaterMark,
                maxDrawdown,
                dayStartCapital,
                dailyRealizedPnl,
                totalRealizedPnl,
                new TreeMap<>(exposureByAsset),
                openExposureTotal,
                consecutiveLosses,
                cooldownUntil,
                tradesToday,
                tradingDay,
                killSwitchTripped,
                halted,
                haltReason,
                closedTrades,
                wins,
                losses
        ));
    }

    private void releaseExposure(String asset, double notional) {
        double remaining = exposureByAsset.getOrDefault(asset, 0.0) - notional;
        if (Math.abs(remaining) < EPSILON) {
            exposureByAsset.remove(asset);
        } else {
            exposureByAsset.put(asset, remaining);
        }
        openExposureTotal -= notional;
        if (Math.abs(openExposureTotal) < EPSILON) {
            openExposureTotal = 0.0;
        }
    }

    private void verifyReservation(String asset) {
        verifyNonNegative(asset);
        double assetExposure = exposureByAsset.getOrDefault(asset, 0.0);
        double assetCap = properties.getMaxSingleAssetPct() * capital;
        if (assetExposure > assetCap + EPSILON) {
            fail(String.format("exposure on %s %.2f exceeds cap %.2f", asset, assetExposure, assetCap));
        }
        double totalCap = properties.getMaxTotalExposurePct() * capital;
        if (openExposureTotal > totalCap + EPSILON) {
            fail(String.format("total exposure %.2f exceeds cap %.2f", openExposureTotal, totalCap));
        }
    }

    private void verifyNonNegative(String asset) {
        if (exposureByAsset.getOrDefault(asset, 0.0) < -EPSILON) {
            fail(String.format("exposure on %s went negative", asset));
        }
        if (openExposureTotal < -EPSILON) {
            fail("total exposure went negative");
        }
        if (capital < 0) {
            fail(String.format("capital went negative: %.2f", capital));
        }
    }

    private void fail(String reason) {
        halt(reason);
        throw new RiskInvariantViolationException(reason);
    }

    public record CloseEffect(boolean cooldownStarted, boolean killSwitchTripped) {}

    public record RiskSnapshot(
            double startingCapital,
            double capital,
            double equityHighWaterMark,
            double maxDrawdown,
            double dayStartCapital,
            double dailyRealizedPnl,
            double totalRealizedPnl,
            Map<String, Double> exposureByAsset,
            double openExposureTotal,
            int consecutiveLosses,
            Instant cooldownUntil,
            int tradesToday,
            LocalDate tradingDay,
            boolean killSwitchTripped,
            boolean halted,
            String haltReason,
            int closedTrades,
            int wins,
            int losses
    ) {

        public double winRate() {
            return closedTrades > 0 ? (double) wins / closedTrades : 0.0;
        }
    }
}
