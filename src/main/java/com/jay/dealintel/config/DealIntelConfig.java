package com.jay.dealintel.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.jay.dealintel.exception.InvalidConfigurationException;
import com.jay.dealintel.model.ScoringWeights;
import com.jay.dealintel.model.enums.PipelineStage;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads and exposes all tunables from config.yaml.
 * Values are read once at startup. A missing file leaves the built-in defaults in place,
 * which match the shipped config.yaml. A malformed file or weight profile fails startup.
 */
@Slf4j
@Component
public class DealIntelConfig {

    public static final String DEFAULT_PROFILE = "deal-insights";

    @Value("${deal-intel.config-file:config.yaml}")
    private String configFile = "config.yaml";

    // ── Sections ──────────────────────────────────────────────────────────────
    private Scoring scoring = new Scoring();
    private Synergy synergy = new Synergy();
    private Pipeline pipeline = new Pipeline();
    private Cache cache = new Cache();

    @PostConstruct
    public void load() {
        ObjectMapper mapper = JsonMapper.builder(new YAMLFactory())
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS, true)
            .build();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(configFile)) {
            if (is == null) {
                log.warn("Config file '{}' not found on classpath, using defaults", configFile);
            } else {
                ConfigRoot root = mapper.readValue(is, ConfigRoot.class);
                if (root.getScoring() != null)  this.scoring = root.getScoring();
                if (root.getSynergy() != null)  this.synergy = root.getSynergy();
                if (root.getPipeline() != null) this.pipeline = root.getPipeline();
                if (root.getCache() != null)    this.cache = root.getCache();
            }
        } catch (IOException e) {
            throw new InvalidConfigurationException("Failed to parse " + configFile + ": " + e.getMessage(), e);
        }
        validate();
        log.info("DealIntelConfig loaded from '{}'. Weight profiles: {}, default: {}",
            configFile, scoring.getWeightProfiles().keySet(), scoring.getDefaultProfile());
    }

    private void validate() {
        if (scoring.getWeightProfiles().isEmpty()) {
            throw new InvalidConfigurationException("No scoring weight profiles configured");
        }
        scoring.getWeightProfiles().forEach((name, weights) -> {
            try {
                weights.validate();
            } catch (InvalidConfigurationException e) {
                throw new InvalidConfigurationException("Weight profile '" + name + "': " + e.getMessage(), e);
            }
        });
        weightProfile(scoring.getDefaultProfile());
        if (pipeline.getBottleneckMultiplier() <= 0) {
            throw new InvalidConfigurationException("pipeline.bottleneck_multiplier must be positive");
        }
        if (pipeline.getOptimisticCloseStages() < 0
                || pipeline.getOptimisticCloseStages() > PipelineStage.activeStages().size()) {
            throw new InvalidConfigurationException("pipeline.optimistic_close_stages out of range: "
                + pipeline.getOptimisticCloseStages());
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Scoring scoring()   { return scoring; }
    public Synergy synergy()   { return synergy; }
    public Pipeline pipeline() { return pipeline; }
    public Cache cache()       { return cache; }

    /** The default weight profile. */
    public ScoringWeights weights() {
        return weightProfile(scoring.getDefaultProfile());
    }

    public ScoringWeights weightProfile(String name) {
        ScoringWeights weights = scoring.getWeightProfiles().get(name);
        if (weights == null) {
            throw new InvalidConfigurationException("Unknown weight profile: " + name);
        }
        return weights;
    }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Scoring scoring;
        private Synergy synergy;
        private Pipeline pipeline;
        private Cache cache;
    }

    @Data public static class Scoring {
        private String defaultProfile = DEFAULT_PROFILE;
        private Map<String, ScoringWeights> weightProfiles = defaultProfiles();
        private double proceedThreshold = 80;
        private double cautionThreshold = 65;
        private double investigateThreshold = 50;
        private double declineThreshold = 40;
        private double declineMinConfidence = 0.7;
        private double strengthThreshold = 70;
        private double concernThreshold = 40;
        private double verificationBonus = 0.1;
        private int maxNextActions = 5;

        private static Map<String, ScoringWeights> defaultProfiles() {
            Map<String, ScoringWeights> profiles = new LinkedHashMap<>();
            profiles.put(DEFAULT_PROFILE, new ScoringWeights(0.30, 0.25, 0.20, 0.15, 0.10, 0.0));
            profiles.put("balanced", new ScoringWeights(0.25, 0.20, 0.20, 0.15, 0.10, 0.10));
            return profiles;
        }
    }

    @Data public static class Synergy {
        private double crossSellRate = 0.10;
        private double defaultCustomerOverlap = 0.1;
        private double defaultMarketShare = 0.05;
        private double marketExpansionRate = 0.05;
        private double economiesOfScaleRate = 0.05;
        private double overheadShareOfCost = 0.15;
        private double overheadReductionRate = 0.40;
        private double techSpendShareOfCost = 0.08;
        private double techConsolidationRate = 0.20;
        private double taxOptimizationRate = 0.02;
        private double workingCapitalShareOfRevenue = 0.15;
        private double workingCapitalRate = 0.15;
        private double processOptimizationRate = 0.035;
        private double discountRate = 0.10;
        private double integrationCostRatio = 0.15;
        private double paybackCapMonths = 120;
        private double portfolioDiscountBase = 1.1;
        private double onTrackVarianceFloorPct = -10;
    }

    @Data public static class Pipeline {
        private Map<PipelineStage, Double> baselineDays = table(14, 7, 21, 45, 30, 14);
        private Map<PipelineStage, Double> transitionProbability = table(0.70, 0.65, 0.60, 0.55, 0.75, 0.85);
        private Map<PipelineStage, Double> closeProbability = table(0.15, 0.25, 0.35, 0.50, 0.70, 0.85);
        private double bottleneckMultiplier = 1.5;
        private int optimisticCloseStages = 2;
        private double congestionShare = 0.40;
        private double efficiencyCeiling = 150;
        private double efficiencyMin = 50;
        private double efficiencyMax = 100;
        private int trendMinDeals = 3;
        private double trendBand = 0.10;
        private double forecastSpread = 0.30;

        private static Map<PipelineStage, Double> table(double... values) {
            Map<PipelineStage, Double> map = new EnumMap<>(PipelineStage.class);
            List<PipelineStage> stages = PipelineStage.activeStages();
            for (int i = 0; i < stages.size(); i++) {
                map.put(stages.get(i), values[i]);
            }
            return map;
        }
    }

    @Data public static class Cache {
        private int reportTtlMinutes = 30;
    }
}
