package com.hydra.backend.trading.pipeline;

import com.hydra.backend.config.RiskProperties;
import com.hydra.backend.model.TradeProposal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class DefaultRiskEngine implements RiskEngine {

    // anything smaller than a cent is treated as no room
    private static final double MIN_NOTIONAL = 0.01;

    private final RiskProperties riskProperties;
    private final KellyPositionSizer positionSizer;

    @Override
    public RiskDecision evaluate(TradeProposal proposal, RiskState riskState, double volatility, Instant now) {
        RiskDecision decision = riskState.locked(() -> evaluateLocked(proposal, riskState, volatility, now));
        if (decision.approved()) {
            log.info("Approved {} {} {} notional {}{}", proposal.strategyId(), proposal.direction(), proposal.asset(),
                    String.format("%.2f", decision.sizedNotional()),
                    decision.clamped() ? " " + decision.notes() : "");
        } else {
            log.warn("Rejected {} {} {}: {} {}", proposal.strategyId(), proposal.direction(), proposal.asset(),
                    decision.rejectReason(), decision.notes());
        }
        return decision;
    }

    private RiskDecision evaluateLocked(TradeProposal proposal, RiskState state, double volatility, Instant now) {
        state.rollTradingDay(now);

        if (state.isHalted()) {
            return RiskDecision.rejected(proposal, RejectReason.ACCOUNTING_HALT, "ledger halted pending operator review");
        }
        if (state.checkKillSwitch()) {
            return RiskDecision.rejected(proposal, RejectReason.KILL_SWITCH, "daily loss limit reached");
        }
        if (state.inCooldown(now)) {
            return RiskDecision.rejected(proposal, RejectReason.COOLDOWN, "cooling down after consecutive losses");
        }
        if (state.tradesToday() >= riskProperties.getMaxTradesPerDay()) {
            return RiskDecision.rejected(proposal, RejectReason.DAILY_TRADE_CAP,
                    "trades today " + state.tradesToday() + " >= " + riskProperties.getMaxTradesPerDay());
        }
        if (!proposal.isWellFormed()) {
            return RiskDecision.rejected(proposal, RejectReason.INVALID_PROPOSAL,
                    "entry/stop/target inconsistent with direction");
        }

        double capital = state.capital();
        double notional = positionSizer.size(proposal, capital, volatility).notional();
        if (notional < MIN_NOTIONAL) {
            return RiskDecision.rejected(proposal, RejectReason.NO_EDGE, "non-positive Kelly size");
        }

        List<String> notes = new ArrayList<>();
        double positionCap = state.perPositionCap();
        if (notional > positionCap) {
            notes.add(String.format("clamped to per-position cap %.2f", positionCap));
            notional = positionCap;
        }

        double assetRoom = state.perAssetCap() - state.exposure(proposal.asset());
        if (assetRoom < MIN_NOTIONAL) {
            return RiskDecision.rejected(proposal, RejectReason.EXPOSURE_LIMIT,
                    "asset " + proposal.asset() + " at exposure cap");
        }
        if (notional > assetRoom) {
            notes.add(String.format("clamped to asset room %.2f", assetRoom));
            notional = assetRoom;
        }

        double totalRoom = state.totalExposureCap() - state.openExposureTotal();
        if (totalRoom < MIN_NOTIONAL) {
            return RiskDecision.rejected(proposal, RejectReason.EXPOSURE_LIMIT, "total exposure at cap");
        }
        if (notional > totalRoom) {
            notes.add(String.format("clamped to total room %.2f", totalRoom));
            notional = totalRoom;
        }

        state.reserve(proposal.asset(), notional);
        return RiskDecision.approved(proposal, notional, notes);
    }
}
