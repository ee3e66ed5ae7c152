package com.hydra.backend.exception;

/**
 * The risk ledger failed a post-mutation check. Approvals stay halted until an operator resumes.
 */
public class RiskInvariantViolationException extends TradingException {
    public RiskInvariantViolationException(String message) {
        super(message);
    }
}
