package com.jay.dealintel.layer4_pipeline;

import com.jay.dealintel.config.DealIntelConfig;
import com.jay.dealintel.model.BottleneckAnalysis;
import com.jay.dealintel.model.PipelineDeal;
import com.jay.dealintel.model.PipelineVelocity;
import com.jay.dealintel.model.enums.Level;
import com.jay.dealintel.model.enums.PipelineStage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 4 — Bottleneck analysis.
 * For each bottleneck stage that currently holds deals: how many, how far past the
 * baseline dwell time, how much value is waiting, and how urgent it is.
 */
@Component
@RequiredArgsConstructor
public class BottleneckAnalyzer {

    private final DealIntelConfig config;

    public List<BottleneckAnalysis> analyze(List<PipelineDeal> deals, PipelineVelocity velocity) {
        List<BottleneckAnalysis> result = new ArrayList<>();
        for (PipelineStage stage : velocity.getBottleneckStages()) {
            List<PipelineDeal> inStage = deals.stream().filter(d -> d.getStage() == stage).toList();
            if (inStage.isEmpty()) continue;

            double baseline = config.pipeline().getBaselineDays().getOrDefault(stage, 30.0);
            double delay = Math.max(0, velocity.daysIn(stage, baseline) - baseline);
            double value = inStage.stream().mapToDouble(PipelineDeal::getValuation).sum();
            result.add(new BottleneckAnalysis(stage, inStage.size(), delay, value,
                urgency(delay, inStage.size()), defaultActions(stage)));
        }
        return result;
    }

    static Level urgency(double delayDays, int dealCount) {
        if (delayDays > 14 && dealCount > 5) return Level.HIGH;
        if (delayDays > 7 || dealCount > 3) return Level.MEDIUM;
        return Level.LOW;
    }

    static List<String> defaultActions(PipelineStage stage) {
        return switch (stage) {
            case SOURCING -> List.of("Increase sourcing team capacity", "Automate deal screening process",
                "Expand sourcing channels");
            case INITIAL_REVIEW -> List.of("Streamline initial review checklist", "Add more senior reviewers",
                "Implement automated screening tools");
            case VALUATION -> List.of("Bring in additional valuation experts", "Standardize valuation methodology",
                "Use valuation automation tools");
            case DUE_DILIGENCE -> List.of("Expand due diligence team", "Parallelize due diligence workstreams",
                "Use third-party DD providers");
            case NEGOTIATION -> List.of("Involve experienced negotiators earlier", "Pre-agree on key terms",
                "Use structured negotiation framework");
            case CLOSING -> List.of("Streamline legal documentation", "Parallel process regulatory approvals",
                "Early stakeholder alignment");
            case CLOSED_WON, CLOSED_LOST -> List.of("Review stage process", "Add resources", "Remove blockers");
        };
    }
}
