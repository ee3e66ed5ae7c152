package com.hydra.backend.model;

public enum TradeDirection {
    LONG(1),
    SHORT(-1);

    private final int sign;

    TradeDirection(int sign) {
        this.sign = sign;
    }

    public int sign() {
        return sign;
    }

    public static TradeDirection of(double netDirection) {
        return netDirection >= 0 ? LONG : SHORT;
    }
}
