package com.hydra.backend.service.marketdata;

import com.hydra.backend.model.Candle;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Market data boundary used by the regime detector, the risk engine and the position lifecycle.
 * Implementations report missing data as empty, never by throwing into the caller.
 */
public interface PriceFeed {

    OptionalDouble getPrice(String asset);

    /**
     * Most recent {@code window} bars, oldest first. Empty when the asset has no history.
     */
    List<Candle> getOhlcHistory(String asset, int window);
}
