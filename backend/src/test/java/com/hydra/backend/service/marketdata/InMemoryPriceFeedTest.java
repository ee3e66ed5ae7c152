package com.hydra.backend.service.marketdata;

import com.hydra.backend.model.Candle;
import com.hydra.backend.util.TestCandleFactory;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryPriceFeedTest {

    private static final Instant T0 = Instant.parse("2024-03-04T15:00:00Z");

    private final InMemoryPriceFeed feed = new InMemoryPriceFeed();

    @Test
    void unknownAssetIsEmpty() {
        assertThat(feed.getPrice("SPY")).isEmpty();
        assertThat(feed.getOhlcHistory("SPY", 10)).isEmpty();
    }

    @Test
    void lastUpdateWins() {
        feed.updatePrice("SPY", 400.0, T0);
        feed.updatePrice("SPY", 401.5, T0.plusSeconds(60));

        assertThat(feed.getPrice("SPY")).hasValue(401.5);
        assertThat(feed.getOhlcHistory("SPY", 10)).hasSize(2);
    }

    @Test
    void historyReturnsMostRecentWindowOldestFirst() {
        for (Candle candle : TestCandleFactory.fromCloses(List.of(100.0, 101.0, 102.0, 103.0, 104.0))) {
            feed.recordBar("QQQ", candle);
        }

        List<Candle> window = feed.getOhlcHistory("QQQ", 3);

        assertThat(window).extracting(Candle::getClose).containsExactly(102.0, 103.0, 104.0);
    }

    @Test
    void historyIsBounded() {
        for (int i = 0; i < InMemoryPriceFeed.MAX_BARS + 25; i++) {
            feed.updatePrice("TLT", 90.0 + i * 0.01, T0.plusSeconds(i));
        }

        assertThat(feed.getOhlcHistory("TLT", Integer.MAX_VALUE)).hasSize(InMemoryPriceFeed.MAX_BARS);
    }

    @Test
    void rejectsNonPositiveClose() {
        assertThatThrownBy(() -> feed.updatePrice("GLD", 0.0, T0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(feed.getPrice("GLD")).isEmpty();
    }

    @Test
    void clearForgetsAsset() {
        feed.updatePrice("SLV", 25.0, T0);

        feed.clear("SLV");

        assertThat(feed.getPrice("SLV")).isEmpty();
    }
}
