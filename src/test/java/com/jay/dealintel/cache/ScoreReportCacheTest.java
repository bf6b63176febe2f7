package com.jay.dealintel.cache;

import com.jay.dealintel.config.DealIntelConfig;
import com.jay.dealintel.model.DealAttributes;
import com.jay.dealintel.model.DealScore;
import com.jay.dealintel.model.ScoringWeights;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

class ScoreReportCacheTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private DealIntelConfig config;
    private ScoreReportCache cache;
    private final SettableClock clock = new SettableClock();
    private final AtomicInteger computations = new AtomicInteger();

    /** Clock whose current instant the test moves by hand. */
    private static final class SettableClock extends Clock {
        private Instant now = NOW;

        @Override public ZoneId getZone()            { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
        @Override public Instant instant()           { return now; }
    }

    @BeforeEach
    void setUp() {
        config = new DealIntelConfig();
        cache = new ScoreReportCache(config, clock);
    }

    private void at(Instant instant) {
        clock.now = instant;
    }

    private Supplier<DealScore> scorer(String dealId) {
        return () -> {
            computations.incrementAndGet();
            return DealScore.builder().dealId(dealId).overallScore(70).build();
        };
    }

    private static DealAttributes deal() {
        return DealAttributes.builder().dealId("d1").ebitdaMargin(12.0).industry("retail").build();
    }

    @Test
    void secondRequestIsServedFromCache() {
        DealScore first = cache.getOrCompute(deal(), config.weights(), scorer("d1"));
        DealScore second = cache.getOrCompute(deal(), config.weights(), scorer("d1"));

        assertThat(second).isSameAs(first);
        assertThat(computations).hasValue(1);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void differentWeightsAreScoredSeparately() {
        cache.getOrCompute(deal(), config.weights(), scorer("d1"));
        cache.getOrCompute(deal(), config.weightProfile("balanced"), scorer("d1"));

        assertThat(computations).hasValue(2);
        assertThat(ScoreReportCache.fingerprint(deal(), config.weights()))
            .isEqualTo(ScoreReportCache.fingerprint(deal(), new ScoringWeights(0.30, 0.25, 0.20, 0.15, 0.10, 0.0)))
            .isNotEqualTo(ScoreReportCache.fingerprint(deal(), config.weightProfile("balanced")));
    }

    @Test
    @DisplayName("Entries expire after the configured TTL and are evicted")
    void expiry() {
        cache.getOrCompute(deal(), config.weights(), scorer("d1"));

        at(NOW.plus(Duration.ofMinutes(29)));
        assertThat(cache.evictExpired()).isZero();
        cache.getOrCompute(deal(), config.weights(), scorer("d1"));
        assertThat(computations).hasValue(1);

        at(NOW.plus(Duration.ofMinutes(30)));
        assertThat(cache.evictExpired()).isEqualTo(1);
        assertThat(cache.size()).isZero();

        cache.getOrCompute(deal(), config.weights(), scorer("d1"));
        assertThat(computations).hasValue(2);
    }

    @Test
    void clearDropsEverything() {
        cache.getOrCompute(deal(), config.weights(), scorer("d1"));
        cache.clear();

        assertThat(cache.size()).isZero();
    }
}
