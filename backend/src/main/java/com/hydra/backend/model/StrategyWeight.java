package com.hydra.backend.model;

public record StrategyWeight(
        String strategyId,
        double weight,
        double trailingWinRate,
        int sampleSize
) {}
