package com.hydra.backend.trading.pipeline;

import com.hydra.backend.model.Candle;
import com.hydra.backend.model.RegimeFeatures;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Turns benchmark closes and volatility index quotes into the regime feature vector.
 */
@Component
public class RegimeFeatureCalculator {

    static final int SHORT_TREND_BARS = 5;
    static final int MEDIUM_TREND_BARS = 20;
    static final int LONG_TREND_BARS = 50;
    static final int MEAN_REVERSION_BARS = 30;
    static final int MIN_RETURNS = 10;
    private static final double TRADING_DAYS = 252.0;

    public RegimeFeatures compute(List<Candle> history, OptionalDouble volatilityIndex, OptionalDouble termIndex) {
        List<Double> closes = closes(history);
        double volatility = volatilityIndex.isPresent()
                ? volatilityIndex.getAsDouble()
                : annualizedVolatility(closes) * 100.0;
        double termSlope = volatilityIndex.isPresent() && termIndex.isPresent()
                ? termIndex.getAsDouble() - volatilityIndex.getAsDouble()
                : 0.0;
        return new RegimeFeatures(volatility, termSlope, trendStrength(closes), meanReversionScore(closes),
                closes.size());
    }

    /**
     * Weighted 5/20/50-bar momentum scaled so a 5% blended move saturates at +/-1.
     * A lookback longer than the history measures from the oldest close instead.
     */
    public double trendStrength(List<Double> closes) {
        int n = closes.size();
        if (n < SHORT_TREND_BARS) {
            return 0.0;
        }
        double last = closes.get(n - 1);
        double shortMomentum = momentum(last, closes.get(n - SHORT_TREND_BARS));
        double mediumMomentum = momentum(last, closes.get(n - Math.min(MEDIUM_TREND_BARS, n)));
        double longMomentum = momentum(last, closes.get(n - Math.min(LONG_TREND_BARS, n)));
        double raw = (shortMomentum * 0.5 + mediumMomentum * 0.3 + longMomentum * 0.2) * 100.0;
        return clamp(raw / 5.0, -1.0, 1.0);
    }

    /**
     * 0.5 minus the lag-1 autocorrelation of recent returns; 1 is strongly mean-reverting.
     */
    public double meanReversionScore(List<Double> closes) {
        int n = closes.size();
        if (n < MEAN_REVERSION_BARS) {
            return 0.5;
        }
        List<Double> returns = new ArrayList<>();
        for (int i = Math.max(1, n - MEAN_REVERSION_BARS); i < n; i++) {
            double previous = closes.get(i - 1);
            if (previous != 0) {
                returns.add((closes.get(i) - previous) / previous);
            }
        }
        if (returns.size() < MIN_RETURNS) {
            return 0.5;
        }
        double mean = returns.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = 0.0;
        for (double r : returns) {
            variance += (r - mean) * (r - mean);
        }
        if (variance == 0) {
            return 0.5;
        }
        double covariance = 0.0;
        for (int i = 1; i < returns.size(); i++) {
            covariance += (returns.get(i) - mean) * (returns.get(i - 1) - mean);
        }
        return clamp(0.5 - covariance / variance, 0.0, 1.0);
    }

    /**
     * Standard deviation of close-to-close returns over the trailing {@code lookback} bars.
     */
    public OptionalDouble realizedVolatility(List<Candle> history, int lookback) {
        List<Double> closes = closes(history);
        int start = Math.max(1, closes.size() - lookback);
        List<Double> returns = new ArrayList<>();
        for (int i = start; i < closes.size(); i++) {
            double previous = closes.get(i - 1);
            if (previous > 0) {
                returns.add((closes.get(i) - previous) / previous);
            }
        }
        if (returns.size() < 2) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(standardDeviation(returns));
    }

    private double annualizedVolatility(List<Double> closes) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < closes.size(); i++) {
            double previous = closes.get(i - 1);
            if (previous > 0) {
                returns.add((closes.get(i) - previous) / previous);
            }
        }
        if (returns.size() < 2) {
            return 0.0;
        }
        return standardDeviation(returns) * Math.sqrt(TRADING_DAYS);
    }

    private static List<Double> closes(List<Candle> history) {
        List<Double> closes = new ArrayList<>(history.size());
        for (Candle candle : history) {
            closes.add(candle.getClose());
        }
        return closes;
    }

    private static double standardDeviation(List<Double> values) {
        double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double sum = 0.0;
        for (double v : values) {
            sum += (v - mean) * (v - mean);
        }
        return Math.sqrt(sum / (values.size() - 1));
    }

    private static double momentum(double last, double reference) {
        return reference != 0 ? (last - reference) / reference : 0.0;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
