package com.hydra.backend.config;

import com.hydra.backend.service.marketdata.InMemoryPriceFeed;
import com.hydra.backend.service.marketdata.PriceFeed;
import com.hydra.backend.service.marketdata.TimeLimitedPriceFeed;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;
import java.util.concurrent.Executor;

@Configuration
public class MarketDataResilienceConfig {

    @Bean
    public TimeLimiter priceFeedTimeLimiter(CycleProperties cycleProperties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(cycleProperties.getPriceTimeoutMs()))
                .cancelRunningFuture(true)
                .build();
        return TimeLimiter.of("price-feed", config);
    }

    @Bean
    public CircuitBreaker priceFeedCircuitBreaker(
            @Value("${hydra.resilience.price-feed.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${hydra.resilience.price-feed.wait-open-seconds:30}") long waitOpenSeconds,
            @Value("${hydra.resilience.price-feed.sliding-window-size:20}") int slidingWindowSize
    ) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitOpenSeconds))
                .slidingWindowSize(slidingWindowSize)
                .build();
        return CircuitBreaker.of("price-feed", config);
    }

    @Bean
    public Retry signalSourceRetry(
            @Value("${hydra.resilience.sources.max-attempts:3}") int maxAttempts,
            @Value("${hydra.resilience.sources.base-delay-ms:500}") long baseDelayMs,
            @Value("${hydra.resilience.sources.jitter-factor:0.2}") double jitterFactor
    ) {
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(baseDelayMs),
                2.0,
                jitterFactor
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervalFunction)
                .retryExceptions(ResourceAccessException.class, HttpServerErrorException.class)
                .build();
        return Retry.of("signal-sources", config);
    }

    @Bean
    @Primary
    public PriceFeed guardedPriceFeed(InMemoryPriceFeed inMemoryPriceFeed,
                                      TimeLimiter priceFeedTimeLimiter,
                                      CircuitBreaker priceFeedCircuitBreaker,
                                      @Qualifier("priceExecutor") Executor priceExecutor) {
        return new TimeLimitedPriceFeed(inMemoryPriceFeed, priceFeedTimeLimiter, priceFeedCircuitBreaker, priceExecutor);
    }
}
