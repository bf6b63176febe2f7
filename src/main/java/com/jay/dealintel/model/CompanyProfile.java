package com.jay.dealintel.model;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.jay.dealintel.exception.InvalidConfigurationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.Set;

/**
 * Financial and market profile of one party to a deal, used for synergy estimation.
 * Amounts are annual, in deal currency. Shares and overlap are fractions (0.2 = 20%).
 * Optional fields left null fall back to a share of revenue or operating cost.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompanyProfile {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .build();

    private String name;
    private String industry;

    private double annualRevenue;
    private double operatingCosts;
    private double pretaxIncome;
    private Double overheadCosts;
    private Double technologySpend;
    private Double workingCapital;

    private Double marketShare;
    private Double customerOverlap;
    private Set<String> productCategories;
    private Set<String> geographicMarkets;

    public static CompanyProfile fromMap(Map<String, ?> raw) {
        if (raw == null) return new CompanyProfile();
        try {
            return MAPPER.convertValue(raw, CompanyProfile.class);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Invalid company profile: " + e.getMessage(), e);
        }
    }

    public Set<String> productCategoriesOrEmpty() {
        return productCategories != null ? productCategories : Set.of();
    }

    public Set<String> geographicMarketsOrEmpty() {
        return geographicMarkets != null ? geographicMarkets : Set.of();
    }
}
