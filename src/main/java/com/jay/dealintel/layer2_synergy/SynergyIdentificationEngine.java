package com.jay.dealintel.layer2_synergy;

import com.jay.dealintel.config.DealIntelConfig;
import com.jay.dealintel.model.CompanyProfile;
import com.jay.dealintel.model.DealAttributes;
import com.jay.dealintel.model.SynergyOpportunity;
import com.jay.dealintel.model.enums.SynergyCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static com.jay.dealintel.util.NumericUtils.valueOr;

/**
 * Layer 2 — Synergy identification.
 * Runs one closed-form estimator per synergy category over the target and acquirer
 * profiles, keeps the opportunities with a positive estimated value, and orders them
 * by a composite priority score (value, confidence, timeline, risk count).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SynergyIdentificationEngine {

    private final DealIntelConfig config;

    public List<SynergyOpportunity> identify(CompanyProfile target, CompanyProfile acquirer) {
        CompanyProfile t = target != null ? target : new CompanyProfile();
        CompanyProfile a = acquirer != null ? acquirer : new CompanyProfile();

        List<SynergyOpportunity> opportunities = new ArrayList<>();
        for (SynergyCategory category : SynergyCategory.values()) {
            double value = estimate(category, t, a);
            if (value > 0) {
                opportunities.add(create(category, value));
            } else {
                log.debug("Synergy {} skipped: estimated value {}", category, value);
            }
        }

        List<SynergyOpportunity> prioritized = prioritize(opportunities);
        log.info("Identified {} synergies between '{}' and '{}', total value {}",
            prioritized.size(), t.getName(), a.getName(),
            String.format("%.0f", prioritized.stream().mapToDouble(SynergyOpportunity::getEstimatedValue).sum()));
        return prioritized;
    }

    /** Same as {@link #identify(CompanyProfile, CompanyProfile)}; the deal only labels the log line. */
    public List<SynergyOpportunity> identify(DealAttributes deal, CompanyProfile target, CompanyProfile acquirer) {
        if (deal != null && deal.getDealId() != null) {
            log.info("Identifying synergies for deal {}", deal.getDealId());
        }
        return identify(target, acquirer);
    }

    // ── Prioritization ────────────────────────────────────────────────────────

    /**
     * Stores each opportunity's priority score and returns them highest first.
     * Ties keep their input order.
     */
    public List<SynergyOpportunity> prioritize(List<SynergyOpportunity> opportunities) {
        for (SynergyOpportunity s : opportunities) {
            s.setPriorityScore(priorityScore(s));
        }
        List<SynergyOpportunity> sorted = new ArrayList<>(opportunities);
        sorted.sort(Comparator.comparingDouble(SynergyOpportunity::getPriorityScore).reversed());
        return sorted;
    }

    public static double priorityScore(SynergyOpportunity s) {
        double valueScore = s.getEstimatedValue() / 1_000_000;
        double confidenceScore = s.getConfidenceLevel() * 10;
        double timelineScore = Math.max(1, 25 - s.getRealizationTimelineMonths());
        double riskScore = Math.max(1, 10 - s.riskCount() * 2);
        return valueScore * 0.4 + confidenceScore * 0.3 + timelineScore * 0.2 + riskScore * 0.1;
    }

    // ── Estimators ────────────────────────────────────────────────────────────

    double estimate(SynergyCategory category, CompanyProfile t, CompanyProfile a) {
        DealIntelConfig.Synergy cfg = config.synergy();
        double combinedRevenue = t.getAnnualRevenue() + a.getAnnualRevenue();
        double combinedCosts = t.getOperatingCosts() + a.getOperatingCosts();

        return switch (category) {
            case CROSS_SELLING -> {
                if (!sharesProductCategory(t, a)) yield 0;
                double overlap = valueOr(t.getCustomerOverlap(), cfg.getDefaultCustomerOverlap());
                yield combinedRevenue * cfg.getCrossSellRate() * (1 - overlap);
            }
            case PRICING_OPTIMIZATION -> {
                double share = valueOr(t.getMarketShare(), cfg.getDefaultMarketShare())
                    + valueOr(a.getMarketShare(), cfg.getDefaultMarketShare());
                double uplift;
                if (share > 0.2) uplift = 0.02;
                else if (share > 0.1) uplift = 0.01;
                else uplift = 0.005;
                yield combinedRevenue * uplift;
            }
            case MARKET_EXPANSION -> {
                Set<String> newMarkets = new HashSet<>(t.geographicMarketsOrEmpty());
                newMarkets.addAll(a.geographicMarketsOrEmpty());
                Set<String> common = new HashSet<>(t.geographicMarketsOrEmpty());
                common.retainAll(a.geographicMarketsOrEmpty());
                newMarkets.removeAll(common);
                if (newMarkets.isEmpty()) yield 0;
                double baseRevenue = Math.min(t.getAnnualRevenue(), a.getAnnualRevenue());
                yield baseRevenue * newMarkets.size() * cfg.getMarketExpansionRate();
            }
            case ECONOMIES_OF_SCALE -> combinedCosts * cfg.getEconomiesOfScaleRate();
            case OVERHEAD_REDUCTION -> {
                double tOverhead = valueOr(t.getOverheadCosts(), t.getOperatingCosts() * cfg.getOverheadShareOfCost());
                double aOverhead = valueOr(a.getOverheadCosts(), a.getOperatingCosts() * cfg.getOverheadShareOfCost());
                yield Math.min(tOverhead, aOverhead) * cfg.getOverheadReductionRate();
            }
            case TECHNOLOGY_CONSOLIDATION -> {
                double tTech = valueOr(t.getTechnologySpend(), t.getOperatingCosts() * cfg.getTechSpendShareOfCost());
                double aTech = valueOr(a.getTechnologySpend(), a.getOperatingCosts() * cfg.getTechSpendShareOfCost());
                yield (tTech + aTech) * cfg.getTechConsolidationRate();
            }
            case TAX_OPTIMIZATION -> (t.getPretaxIncome() + a.getPretaxIncome()) * cfg.getTaxOptimizationRate();
            case WORKING_CAPITAL -> {
                double tWc = valueOr(t.getWorkingCapital(), t.getAnnualRevenue() * cfg.getWorkingCapitalShareOfRevenue());
                double aWc = valueOr(a.getWorkingCapital(), a.getAnnualRevenue() * cfg.getWorkingCapitalShareOfRevenue());
                yield (tWc + aWc) * cfg.getWorkingCapitalRate();
            }
            case PROCESS_OPTIMIZATION -> combinedCosts * cfg.getProcessOptimizationRate();
        };
    }

    private static boolean sharesProductCategory(CompanyProfile t, CompanyProfile a) {
        Set<String> common = new HashSet<>(t.productCategoriesOrEmpty());
        common.retainAll(a.productCategoriesOrEmpty());
        return !common.isEmpty();
    }

    private static SynergyOpportunity create(SynergyCategory category, double value) {
        LocalDate today = LocalDate.now();
        return SynergyOpportunity.builder()
            .synergyId(category.type().name().toLowerCase() + "_" + category.name().toLowerCase()
                + "_" + UUID.randomUUID().toString().substring(0, 8))
            .name(category.displayName())
            .synergyType(category.type())
            .category(category)
            .estimatedValue(value)
            .realizationTimelineMonths(category.timelineMonths())
            .confidenceLevel(category.confidence())
            .risks(new ArrayList<>(category.risks()))
            .identifiedDate(today)
            .targetRealizationDate(today.plusMonths(category.timelineMonths()))
            .build();
    }
}
