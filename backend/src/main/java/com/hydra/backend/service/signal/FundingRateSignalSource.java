package com.hydra.backend.service.signal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.hydra.backend.config.FundingRateProperties;
import com.hydra.backend.config.SignalProperties;
import com.hydra.backend.model.Signal;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Perpetual funding rate as a contrarian crowding signal: an extreme positive rate (longs paying) is
 * bearish, an extreme negative rate is bullish.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "hydra.sources.funding-rate.enabled", havingValue = "true")
public class FundingRateSignalSource implements SignalSource {

    public static final String SOURCE_ID = "funding_rate";

    private final RestTemplate restTemplate;
    private final Retry retry;
    private final FundingRateProperties properties;
    private final SignalProperties signalProperties;

    public FundingRateSignalSource(@Qualifier("sourceRestTemplate") RestTemplate restTemplate,
                                   @Qualifier("signalSourceRetry") Retry retry,
                                   FundingRateProperties properties,
                                   SignalProperties signalProperties) {
        this.restTemplate = restTemplate;
        this.retry = retry;
        this.properties = properties;
        this.signalProperties = signalProperties;
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    @Override
    public Duration pollInterval() {
        return properties.getPollInterval();
    }

    @Override
    public List<Signal> poll(Instant now) {
        OptionalDouble rate = fetchRate();
        if (rate.isEmpty()) {
            return List.of();
        }
        return toSignals(rate.getAsDouble(), now);
    }

    List<Signal> toSignals(double rate, Instant now) {
        if (Math.abs(rate) < properties.getExtremeThreshold()) {
            return List.of();
        }
        double direction = rate > 0 ? -1.0 : 1.0;
        double strength = Math.min(1.0, Math.abs(rate) / properties.getSaturationRate());
        List<Signal> signals = new ArrayList<>();
        for (String asset : properties.getAssets()) {
            signals.add(new Signal(SOURCE_ID, asset, direction, strength,
                    signalProperties.reliabilityOf(SOURCE_ID), now, signalProperties.halfLifeOf(SOURCE_ID)));
        }
        log.info("Funding rate {} on {} -> {} signal strength {}", rate, properties.getSymbol(),
                direction > 0 ? "bullish" : "bearish", String.format("%.2f", strength));
        return signals;
    }

    private OptionalDouble fetchRate() {
        String uri = UriComponentsBuilder.fromHttpUrl(properties.getUrl())
                .queryParam("symbol", properties.getSymbol())
                .toUriString();
        try {
            PremiumIndex response = retry.executeSupplier(() -> restTemplate.getForObject(uri, PremiumIndex.class));
            if (response == null || response.lastFundingRate() == null) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(Double.parseDouble(response.lastFundingRate()));
        } catch (RestClientException | NumberFormatException e) {
            log.warn("Funding rate unavailable for {}: {}", properties.getSymbol(), e.getMessage());
            return OptionalDouble.empty();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PremiumIndex(String symbol, String lastFundingRate) {}
}
