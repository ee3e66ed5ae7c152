package com.hydra.backend.trading.pipeline;

import com.hydra.backend.config.SignalProperties;
import com.hydra.backend.model.AggregatedScore;
import com.hydra.backend.model.Signal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.hydra.backend.util.TestFixtures.NOW;
import static com.hydra.backend.util.TestFixtures.signal;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SignalAggregatorTest {

    private SignalAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new SignalAggregator(new SignalProperties());
    }

    @Test
    void assetWithoutSignalsHasZeroConfidence() {
        AggregatedScore score = aggregator.aggregate("SPY", NOW);

        assertThat(score.confidence()).isZero();
        assertThat(score.netDirection()).isZero();
        assertThat(score.contributingSignalCount()).isZero();
        assertThat(score.dominantSource()).isNull();
    }

    @Test
    void subMillisecondHalfLifeStillScoresWithinBounds() {
        aggregator.ingest(new Signal("order_flow", "SPY", 0.7, 0.6, 0.9, NOW, Duration.ofNanos(500_000)));

        AggregatedScore fresh = aggregator.aggregate("SPY", NOW);
        AggregatedScore aged = aggregator.aggregate("SPY", NOW.plusSeconds(1));

        assertThat(fresh.confidence()).isCloseTo(0.54 / 1.5, within(1e-9));
        assertThat(fresh.netDirection()).isCloseTo(0.7, within(1e-9));
        assertThat(aged.contributingSignalCount()).isZero();
        assertThat(aged.confidence()).isZero();
    }

    @Test
    void singleFreshSignalKeepsItsDirection() {
        aggregator.ingest(signal("gex_levels", "SPY", 0.8, 1.0, 1.0, NOW));

        AggregatedScore score = aggregator.aggregate("SPY", NOW);

        assertThat(score.netDirection()).isCloseTo(0.8, within(1e-9));
        assertThat(score.confidence()).isCloseTo(1.0 / 1.5, within(1e-9));
        assertThat(score.contributingSignalCount()).isEqualTo(1);
        assertThat(score.dominantSource()).isEqualTo("gex_levels");
    }

    @Test
    void opposingSignalsAreWeightedByReliability() {
        aggregator.ingest(signal("a_source", "SPY", 1.0, 1.0, 1.0, NOW));
        aggregator.ingest(signal("b_source", "SPY", -1.0, 1.0, 0.5, NOW));

        AggregatedScore score = aggregator.aggregate("SPY", NOW);

        assertThat(score.netDirection()).isCloseTo(0.5 / 1.5, within(1e-9));
        assertThat(score.confidence()).isCloseTo(1.0, within(1e-9));
        assertThat(score.contributingSignalCount()).isEqualTo(2);
        assertThat(score.dominantSource()).isEqualTo("a_source");
    }

    @Test
    void confidenceHalvesAfterOneHalfLife() {
        aggregator.ingest(signal("vix_term", "SPY", 1.0, 1.0, 1.0, NOW.minus(Duration.ofMinutes(30))));

        AggregatedScore score = aggregator.aggregate("SPY", NOW);

        assertThat(score.confidence()).isCloseTo(0.5 / 1.5, within(1e-9));
        assertThat(score.netDirection()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void confidenceNeverExceedsOne() {
        for (int i = 0; i < 5; i++) {
            aggregator.ingest(signal("source_" + i, "BTC/USD", 1.0, 1.0, 1.0, NOW));
        }

        assertThat(aggregator.aggregate("BTC/USD", NOW).confidence()).isEqualTo(1.0);
    }

    @Test
    void newerSignalFromSameSourceSupersedesOlder() {
        aggregator.ingest(signal("funding_rate", "BTC/USD", 1.0, 1.0, 1.0, NOW.minusSeconds(60)));
        boolean stored = aggregator.ingest(signal("funding_rate", "BTC/USD", -1.0, 1.0, 1.0, NOW));

        AggregatedScore score = aggregator.aggregate("BTC/USD", NOW);

        assertThat(stored).isTrue();
        assertThat(aggregator.size()).isEqualTo(1);
        assertThat(score.netDirection()).isEqualTo(-1.0);
    }

    @Test
    void olderSignalArrivingLateIsIgnored() {
        aggregator.ingest(signal("funding_rate", "BTC/USD", 1.0, 1.0, 1.0, NOW));
        boolean stored = aggregator.ingest(signal("funding_rate", "BTC/USD", -1.0, 1.0, 1.0, NOW.minusSeconds(60)));

        assertThat(stored).isFalse();
        assertThat(aggregator.aggregate("BTC/USD", NOW).netDirection()).isEqualTo(1.0);
    }

    @Test
    void expiredSignalsAreInvisibleAndPurged() {
        // 6 half-lives old, expiry is 5
        aggregator.ingest(signal("etf_flow", "GLD", 1.0, 1.0, 1.0, NOW.minus(Duration.ofMinutes(180))));
        aggregator.ingest(signal("gex_levels", "SPY", 1.0, 1.0, 1.0, NOW));

        assertThat(aggregator.aggregate("GLD", NOW).hasSignals()).isFalse();
        assertThat(aggregator.liveSignals(NOW)).hasSize(1);
        assertThat(aggregator.purgeExpired(NOW)).isEqualTo(1);
        assertThat(aggregator.size()).isEqualTo(1);
    }

    @Test
    void futureDatedSignalCountsAsFresh() {
        aggregator.ingest(signal("gex_levels", "SPY", 0.5, 1.0, 1.0, NOW.plusSeconds(120)));

        assertThat(aggregator.aggregate("SPY", NOW).confidence()).isCloseTo(1.0 / 1.5, within(1e-9));
    }

    @Test
    void aggregateAllReturnsOnlyAssetsWithLiveSignals() {
        aggregator.ingest(signal("gex_levels", "SPY", 0.5, 1.0, 1.0, NOW));
        aggregator.ingest(signal("margin_hike", "GLD", -0.5, 1.0, 1.0, NOW));
        aggregator.ingest(signal("etf_flow", "TLT", 0.5, 1.0, 1.0, NOW.minus(Duration.ofHours(4))));

        Map<String, AggregatedScore> scores = aggregator.aggregateAll(NOW);

        assertThat(scores).containsOnlyKeys("GLD", "SPY");
    }

    @Test
    void aggregationIsIndependentOfIngestionOrder() {
        SignalAggregator reversed = new SignalAggregator(new SignalProperties());
        aggregator.ingest(signal("a_source", "SPY", 0.3, 0.7, 0.9, NOW));
        aggregator.ingest(signal("b_source", "SPY", -0.6, 0.4, 0.8, NOW));
        reversed.ingest(signal("b_source", "SPY", -0.6, 0.4, 0.8, NOW));
        reversed.ingest(signal("a_source", "SPY", 0.3, 0.7, 0.9, NOW));

        assertThat(reversed.aggregate("SPY", NOW)).isEqualTo(aggregator.aggregate("SPY", NOW));
    }

    @Test
    void concurrentWritersNeverLoseSignals() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<java.util.concurrent.Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            int thread = t;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < 50; i++) {
                    aggregator.ingest(signal("source_" + thread, "ASSET_" + i, 0.1, 0.5, 0.5, NOW));
                    aggregator.aggregateAll(NOW);
                }
                return null;
            }));
        }
        start.countDown();
        for (java.util.concurrent.Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(aggregator.size()).isEqualTo(200);
        assertThat(aggregator.aggregate("ASSET_7", NOW).contributingSignalCount()).isEqualTo(4);
    }
}
