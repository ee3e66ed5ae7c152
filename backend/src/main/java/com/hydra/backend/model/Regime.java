package com.hydra.backend.model;

import java.util.EnumSet;
import java.util.Set;

public enum Regime {
    TRENDING_UP,
    TRENDING_DOWN,
    MEAN_REVERTING,
    HIGH_VOL_EXPANSION,
    CRASH,
    RECOVERY,
    UNKNOWN;

    public static Set<Regime> live() {
        return EnumSet.complementOf(EnumSet.of(UNKNOWN));
    }
}
