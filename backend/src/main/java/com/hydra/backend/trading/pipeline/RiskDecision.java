package com.hydra.backend.trading.pipeline;

import com.hydra.backend.model.TradeProposal;

import java.util.List;

/**
 * Outcome of one risk evaluation. An approval has already reserved {@code sizedNotional} in the ledger.
 */
public record RiskDecision(
        TradeProposal proposal,
        boolean approved,
        double sizedNotional,
        RejectReason rejectReason,
        List<String> notes
) {

    public static RiskDecision approved(TradeProposal proposal, double sizedNotional, List<String> notes) {
        return new RiskDecision(proposal, true, sizedNotional, null, List.copyOf(notes));
    }

    public static RiskDecision rejected(TradeProposal proposal, RejectReason reason, String note) {
        return new RiskDecision(proposal, false, 0.0, reason, List.of(note));
    }

    public boolean clamped() {
        return approved && !notes.isEmpty();
    }
}
