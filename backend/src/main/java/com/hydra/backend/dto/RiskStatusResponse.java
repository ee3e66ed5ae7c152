package com.hydra.backend.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
public class RiskStatusResponse {

    private double capital;
    private double equityHighWaterMark;
    private double maxDrawdown;
    private double dailyRealizedPnl;
    private double dailyLossLimit;
    private double openExposureTotal;
    private double totalExposureCap;
    private double perAssetCap;
    private Map<String, Double> exposureByAsset;
    private int consecutiveLosses;
    private int maxConsecutiveLosses;
    private Instant cooldownUntil;
    private int tradesToday;
    private int maxTradesPerDay;
    private boolean killSwitchTripped;
    private boolean halted;
    private String haltReason;
}
