package com.hydra.backend.trading.pipeline;

public enum RejectReason {
    ACCOUNTING_HALT,
    KILL_SWITCH,
    COOLDOWN,
    DAILY_TRADE_CAP,
    INVALID_PROPOSAL,
    NO_EDGE,
    EXPOSURE_LIMIT
}
