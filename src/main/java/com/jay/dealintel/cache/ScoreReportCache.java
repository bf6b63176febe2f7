package com.jay.dealintel.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.jay.dealintel.config.DealIntelConfig;
import com.jay.dealintel.model.DealAttributes;
import com.jay.dealintel.model.DealScore;
import com.jay.dealintel.model.ScoringWeights;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Time-boxed cache of deal scores keyed by a fingerprint of the attributes and weights.
 * Scores are immutable, so a hit can be handed out as-is.
 */
@Slf4j
@Component
public class ScoreReportCache {

    private static final ObjectMapper FINGERPRINT_MAPPER = JsonMapper.builder()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
        .build();

    private final DealIntelConfig config;
    private final Clock clock;

    private final Map<String, CachedScore> entries = new ConcurrentHashMap<>();

    @Autowired
    public ScoreReportCache(DealIntelConfig config) {
        this(config, Clock.systemUTC());
    }

    public ScoreReportCache(DealIntelConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    private record CachedScore(DealScore score, Instant expiresAt) {}

    public DealScore getOrCompute(DealAttributes deal, ScoringWeights weights, Supplier<DealScore> scorer) {
        String key = fingerprint(deal, weights);
        Instant now = clock.instant();
        CachedScore cached = entries.get(key);
        if (cached != null && now.isBefore(cached.expiresAt())) {
            log.debug("Score cache hit for deal {}", deal.getDealId());
            return cached.score();
        }
        DealScore score = scorer.get();
        entries.put(key, new CachedScore(score, now.plus(ttl())));
        return score;
    }

    /** Removes expired entries. Returns how many were dropped. */
    public int evictExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(e -> !now.isBefore(e.expiresAt()));
        return before - entries.size();
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    private Duration ttl() {
        return Duration.ofMinutes(config.cache().getReportTtlMinutes());
    }

    static String fingerprint(DealAttributes deal, ScoringWeights weights) {
        try {
            String raw = FINGERPRINT_MAPPER.writeValueAsString(Map.of("deal", deal, "weights", weights));
            return DigestUtils.md5DigestAsHex(raw.getBytes(StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not fingerprint deal " + deal.getDealId(), e);
        }
    }
}
