package com.jay.dealintel.layer4_pipeline;

import com.jay.dealintel.config.DealIntelConfig;
import com.jay.dealintel.model.PipelineDeal;
import com.jay.dealintel.model.PipelineVelocity;
import com.jay.dealintel.model.StageTransitionPrediction;
import com.jay.dealintel.model.TransitionSignal;
import com.jay.dealintel.model.enums.PipelineStage;
import com.jay.dealintel.model.enums.PredictionConfidence;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 4 — Stage transitions.
 * Predicts each active deal's next stage with a probability and an expected wait.
 *
 * Deals in the last {@code optimistic_close_stages} active stages are predicted to close
 * won directly. That is a configurable optimism policy, not a pipeline rule.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StageTransitionPredictor {

    static final List<String> BASELINE_FACTORS = List.of("Standard transition probability");

    private final DealIntelConfig config;

    /** Predictions for every active deal; closed deals are skipped. */
    public List<StageTransitionPrediction> predictAll(List<PipelineDeal> deals, PipelineVelocity velocity) {
        List<StageTransitionPrediction> predictions = new ArrayList<>();
        for (PipelineDeal deal : deals) {
            if (!deal.isActive()) {
                log.debug("Skipping deal {} in stage {}", deal.getDealId(), deal.getStage());
                continue;
            }
            predictions.add(predict(deal, velocity));
        }
        return predictions;
    }

    /**
     * @throws IllegalArgumentException for a deal with no stage or a closed stage
     */
    public StageTransitionPrediction predict(PipelineDeal deal, PipelineVelocity velocity) {
        PipelineStage current = deal.getStage();
        if (current == null || current.isTerminal()) {
            throw new IllegalArgumentException("Cannot predict a transition for deal "
                + deal.getDealId() + " in stage " + current);
        }
        PipelineStage next = nextStage(current);

        TransitionSignal signal = deal.getTransitionSignal();
        if (signal != null) {
            return new StageTransitionPrediction(deal.getDealId(), current, next, signal.probability(),
                signal.estimatedDays(), PredictionConfidence.fromScore(signal.confidence()), signal.keyFactors());
        }

        DealIntelConfig.Pipeline cfg = config.pipeline();
        double probability = cfg.getTransitionProbability().getOrDefault(current, 0.6);
        double baselineDays = cfg.getBaselineDays().getOrDefault(current, 30.0);
        int days = (int) (velocity != null ? velocity.daysIn(current, baselineDays) : baselineDays);
        return new StageTransitionPrediction(deal.getDealId(), current, next, probability, days,
            PredictionConfidence.LOW, BASELINE_FACTORS);
    }

    public PipelineStage nextStage(PipelineStage current) {
        List<PipelineStage> active = PipelineStage.activeStages();
        int index = active.indexOf(current);
        if (index < 0) {
            throw new IllegalArgumentException("No successor for closed stage " + current);
        }
        if (index >= active.size() - config.pipeline().getOptimisticCloseStages()) {
            return PipelineStage.CLOSED_WON;
        }
        return active.get(index + 1);
    }
}
