package com.hydra.backend.service.marketdata;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.OptionalDouble;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TimeLimitedPriceFeedTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final PriceFeed delegate = mock(PriceFeed.class);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void passesThroughHealthyDelegate() {
        when(delegate.getPrice("SPY")).thenReturn(OptionalDouble.of(400.0));

        assertThat(guarded(CircuitBreaker.ofDefaults("feed")).getPrice("SPY")).hasValue(400.0);
    }

    @Test
    void slowDelegateReadsAsUnavailable() {
        when(delegate.getPrice("SPY")).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return OptionalDouble.of(400.0);
        });

        long started = System.nanoTime();
        OptionalDouble price = guarded(CircuitBreaker.ofDefaults("feed")).getPrice("SPY");

        assertThat(price).isEmpty();
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(1));
    }

    @Test
    void failingDelegateReadsAsUnavailable() {
        when(delegate.getOhlcHistory("SPY", 50)).thenThrow(new IllegalStateException("feed down"));

        assertThat(guarded(CircuitBreaker.ofDefaults("feed")).getOhlcHistory("SPY", 50)).isEmpty();
    }

    @Test
    void openCircuitStopsCallingDelegate() {
        CircuitBreaker circuitBreaker = CircuitBreaker.of("feed", CircuitBreakerConfig.custom()
                .slidingWindowSize(2)
                .minimumNumberOfCalls(2)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofMinutes(1))
                .build());
        when(delegate.getPrice(anyString())).thenThrow(new IllegalStateException("feed down"));
        TimeLimitedPriceFeed feed = guarded(circuitBreaker);

        for (int i = 0; i < 5; i++) {
            assertThat(feed.getPrice("BTC/USD")).isEmpty();
        }

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        verify(delegate, times(2)).getPrice("BTC/USD");
    }

    private TimeLimitedPriceFeed guarded(CircuitBreaker circuitBreaker) {
        TimeLimiter timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(200))
                .build());
        return new TimeLimitedPriceFeed(delegate, timeLimiter, circuitBreaker, executor);
    }
}
