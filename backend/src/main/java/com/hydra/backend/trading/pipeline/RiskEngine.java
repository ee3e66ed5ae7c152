package com.hydra.backend.trading.pipeline;

import com.hydra.backend.model.TradeProposal;

import java.time.Instant;

public interface RiskEngine {

    /**
     * Sizes and gates one proposal against the ledger, reserving exposure on approval.
     *
     * @param volatility recent per-bar realised volatility of the proposal's asset
     * @throws com.hydra.backend.exception.RiskInvariantViolationException when the ledger fails its own checks
     */
    RiskDecision evaluate(TradeProposal proposal, RiskState riskState, double volatility, Instant now);
}
