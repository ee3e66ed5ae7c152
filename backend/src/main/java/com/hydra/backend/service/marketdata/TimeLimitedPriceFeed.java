package com.hydra.backend.service.marketdata;

import com.hydra.backend.model.Candle;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Guards a price feed with a time limit and a circuit breaker. Timeouts, failures and an open
 * circuit all read as "unavailable".
 */
@Slf4j
public class TimeLimitedPriceFeed implements PriceFeed {

    private final PriceFeed delegate;
    private final TimeLimiter timeLimiter;
    private final CircuitBreaker circuitBreaker;
    private final Executor executor;

    public TimeLimitedPriceFeed(PriceFeed delegate, TimeLimiter timeLimiter, CircuitBreaker circuitBreaker,
                                Executor executor) {
        this.delegate = delegate;
        this.timeLimiter = timeLimiter;
        this.circuitBreaker = circuitBreaker;
        this.executor = executor;
    }

    @Override
    public OptionalDouble getPrice(String asset) {
        return call("price " + asset, () -> delegate.getPrice(asset), OptionalDouble.empty());
    }

    @Override
    public List<Candle> getOhlcHistory(String asset, int window) {
        return call("history " + asset, () -> delegate.getOhlcHistory(asset, window), List.of());
    }

    private <T> T call(String what, Supplier<T> supplier, T unavailable) {
        Callable<T> guarded = () -> timeLimiter.executeFutureSupplier(
                () -> CompletableFuture.supplyAsync(supplier, executor));
        try {
            T result = circuitBreaker.executeCallable(guarded);
            return result != null ? result : unavailable;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while fetching {}", what);
            return unavailable;
        } catch (Exception e) {
            log.warn("Market data {} unavailable: {}", what, e.toString());
            return unavailable;
        }
    }
}
