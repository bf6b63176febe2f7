package com.jay.dealintel.model.enums;

import java.util.List;

/**
 * Synergy catalogue. Each category carries the template applied when an opportunity
 * of that kind is identified: type, display name, realization timeline, confidence and risks.
 */
public enum SynergyCategory {
    CROSS_SELLING(SynergyType.REVENUE, "Cross-selling to Combined Customer Base", 12, 0.7,
        List.of("Customer churn", "Product cannibalization")),
    PRICING_OPTIMIZATION(SynergyType.REVENUE, "Pricing Power Enhancement", 6, 0.6,
        List.of("Customer pushback", "Competitive response")),
    MARKET_EXPANSION(SynergyType.REVENUE, "Geographic Market Expansion", 18, 0.5,
        List.of("Regulatory barriers", "Local competition", "Cultural differences")),
    ECONOMIES_OF_SCALE(SynergyType.COST, "Economies of Scale Realization", 12, 0.8,
        List.of("Integration complexity", "Quality degradation")),
    OVERHEAD_REDUCTION(SynergyType.COST, "Corporate Overhead Reduction", 9, 0.9,
        List.of("Employee morale", "Regulatory compliance")),
    TECHNOLOGY_CONSOLIDATION(SynergyType.COST, "Technology Platform Consolidation", 15, 0.7,
        List.of("Data migration issues", "System downtime", "User adoption")),
    TAX_OPTIMIZATION(SynergyType.TAX, "Tax Structure Optimization", 6, 0.8,
        List.of("Regulatory changes", "Audit scrutiny")),
    WORKING_CAPITAL(SynergyType.FINANCIAL, "Working Capital Optimization", 12, 0.7,
        List.of("Supplier relationships", "Customer payment terms")),
    PROCESS_OPTIMIZATION(SynergyType.OPERATIONAL, "Business Process Optimization", 15, 0.6,
        List.of("Change resistance", "Process disruption"));

    private final SynergyType type;
    private final String displayName;
    private final int timelineMonths;
    private final double confidence;
    private final List<String> risks;

    SynergyCategory(SynergyType type, String displayName, int timelineMonths, double confidence, List<String> risks) {
        this.type = type;
        this.displayName = displayName;
        this.timelineMonths = timelineMonths;
        this.confidence = confidence;
        this.risks = risks;
    }

    public SynergyType type()        { return type; }
    public String displayName()      { return displayName; }
    public int timelineMonths()      { return timelineMonths; }
    public double confidence()       { return confidence; }
    public List<String> risks()      { return risks; }
}
