package com.jay.dealintel.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.jay.dealintel.exception.InvalidConfigurationException;
import com.jay.dealintel.model.enums.PipelineStage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A deal currently sitting in the pipeline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineDeal {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS, true)
        .build();

    @JsonAlias("id")
    private String dealId;
    private String name;
    private PipelineStage stage;
    private double valuation;
    private TransitionSignal transitionSignal;   // optional

    /** Unknown stage names fail fast instead of being skipped. */
    public static PipelineDeal fromMap(Map<String, ?> raw) {
        try {
            return MAPPER.convertValue(raw, PipelineDeal.class);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Invalid pipeline deal: " + e.getMessage(), e);
        }
    }

    public boolean isActive() {
        return stage != null && !stage.isTerminal();
    }
}
