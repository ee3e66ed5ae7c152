package com.hydra.backend.trading.pipeline;

import com.hydra.backend.config.RiskProperties;
import com.hydra.backend.model.TradeProposal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Fractional-Kelly notional sizing, damped by the asset's recent realised volatility.
 * <p>
 * Win probability is a linear clamp of confidence, {@code p = base + slope * confidence}; with the
 * defaults it spans 0.50 to 0.62. The Kelly fraction {@code (b*p - q) / b} uses the proposal's
 * reward-to-risk as {@code b}. The dollar-risk budget is {@code capital * riskPerTrade * fractionalKelly *
 * volScalar}, converted to notional through the stop distance.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KellyPositionSizer {

    private final RiskProperties riskProperties;

    public SizingResult size(TradeProposal proposal, double capital, double volatility) {
        RiskProperties.Sizing sizing = riskProperties.getSizing();
        double winProbability = winProbability(proposal.confidence());
        double kelly = kellyFraction(winProbability, proposal.rewardToRisk());
        double fractional = Math.max(0.0, kelly) * sizing.getKellyFraction();
        double volScalar = volatilityScalar(volatility);
        double stopDistance = proposal.stopDistanceFraction();

        double notional = 0.0;
        if (fractional > 0 && stopDistance > 0 && capital > 0) {
            double dollarRisk = capital * sizing.getRiskPerTradePct() * fractional * volScalar;
            notional = dollarRisk / stopDistance;
            if (proposal.requestedNotional() > 0) {
                notional = Math.min(notional, proposal.requestedNotional());
            }
        }
        log.debug("Sizing {} {}: p={} kelly={} volScalar={} notional={}",
                proposal.strategyId(), proposal.asset(), winProbability, kelly, volScalar, notional);
        return new SizingResult(notional, winProbability, kelly, fractional, volScalar);
    }

    public double winProbability(double confidence) {
        RiskProperties.Sizing sizing = riskProperties.getSizing();
        double c = Math.max(0.0, Math.min(1.0, confidence));
        double max = sizing.getWinProbabilityBase() + sizing.getWinProbabilitySlope();
        return Math.max(sizing.getWinProbabilityBase(), Math.min(max, sizing.getWinProbabilityBase()
                + sizing.getWinProbabilitySlope() * c));
    }

    public static double kellyFraction(double winProbability, double rewardToRisk) {
        if (rewardToRisk <= 0) {
            return 0.0;
        }
        double lossProbability = 1.0 - winProbability;
        return (rewardToRisk * winProbability - lossProbability) / rewardToRisk;
    }

    public double volatilityScalar(double volatility) {
        RiskProperties.Sizing sizing = riskProperties.getSizing();
        double raw = 1.0 - volatility * sizing.getVolatilitySensitivity();
        return Math.max(sizing.getVolatilityFloor(), Math.min(1.0, raw));
    }

    public record SizingResult(
            double notional,
            double winProbability,
            double fullKelly,
            double fractionalKelly,
            double volatilityScalar
    ) {}
}
