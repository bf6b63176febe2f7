package com.jay.dealintel.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.jay.dealintel.exception.InvalidConfigurationException;
import com.jay.dealintel.model.enums.Level;
import com.jay.dealintel.model.enums.MarketPosition;
import com.jay.dealintel.model.enums.MarketSize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Typed view of a deal's attribute bag. Every field is optional; the scoring
 * formulas apply their own neutral defaults when a value is absent.
 * Percentages (growth, margin, concentration) are whole-number percents, e.g. 18 for 18%.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DealAttributes {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS, true)
        .build();

    private String dealId;
    private String industry;
    private Double dealValue;

    // ── Financial ─────────────────────────────────────────────────────────────
    @JsonAlias("growth_rate")
    private Double revenueGrowthRate;
    private Double ebitdaMargin;
    private Double debtToEquity;

    // ── Strategic ─────────────────────────────────────────────────────────────
    private Integer strategicFit;           // 1 – 5
    private MarketPosition marketPosition;
    private Level synergyPotential;

    // ── Market ────────────────────────────────────────────────────────────────
    private MarketSize marketSize;
    @JsonAlias("market_growth_rate")
    private Double marketGrowth;
    private Level competitiveIntensity;

    // ── Risk ──────────────────────────────────────────────────────────────────
    private Double revenueConcentration;
    private Level managementRisk;
    private Level regulatoryRisk;
    private Level marketVolatility;

    // ── Execution ─────────────────────────────────────────────────────────────
    @JsonAlias("complexity")
    private Level dealComplexity;
    private Level integrationRisk;
    private Level timelinePressure;

    // ── Team ──────────────────────────────────────────────────────────────────
    private Level managementExperience;
    private Double trackRecordScore;        // 0 – 1
    private Double culturalFitScore;        // 0 – 1

    // ── Data quality ──────────────────────────────────────────────────────────
    @JsonAlias("third_party_validation")
    private Boolean thirdPartyValidated;
    private Boolean dueDiligenceComplete;

    /**
     * Builds attributes from a snake_case key-value bag. Unknown keys are ignored;
     * a categorical value outside its enum fails fast.
     */
    public static DealAttributes fromMap(Map<String, ?> raw) {
        if (raw == null) return new DealAttributes();
        try {
            return MAPPER.convertValue(raw, DealAttributes.class);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Invalid deal attribute: " + e.getMessage(), e);
        }
    }

    public boolean hasFinancials() {
        return revenueGrowthRate != null || ebitdaMargin != null || debtToEquity != null;
    }

    public boolean dueDiligenceDone() {
        return Boolean.TRUE.equals(dueDiligenceComplete);
    }

    public boolean validatedByThirdParty() {
        return Boolean.TRUE.equals(thirdPartyValidated);
    }
}
