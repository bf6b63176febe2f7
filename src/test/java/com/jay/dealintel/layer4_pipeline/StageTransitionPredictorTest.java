package com.jay.dealintel.layer4_pipeline;

import com.jay.dealintel.config.DealIntelConfig;
import com.jay.dealintel.model.PipelineDeal;
import com.jay.dealintel.model.PipelineVelocity;
import com.jay.dealintel.model.StageTransitionPrediction;
import com.jay.dealintel.model.TransitionSignal;
import com.jay.dealintel.model.enums.PipelineStage;
import com.jay.dealintel.model.enums.PredictionConfidence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static com.jay.dealintel.model.enums.PipelineStage.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageTransitionPredictorTest {

    private DealIntelConfig config;
    private StageTransitionPredictor predictor;
    private PipelineVelocity velocity;

    @BeforeEach
    void setUp() {
        config = new DealIntelConfig();
        predictor = new StageTransitionPredictor(config);
        velocity = new PipelineVelocityAnalyzer(config).analyze(List.of(), List.of());
    }

    private static PipelineDeal deal(PipelineStage stage) {
        return PipelineDeal.builder().dealId("deal-" + stage).stage(stage).valuation(1_000_000).build();
    }

    @Test
    @DisplayName("Second-to-last active stage predicts CLOSED_WON whatever the baseline tables say")
    void nearTerminalStagePredictsClosedWon() {
        for (PipelineStage stage : PipelineStage.activeStages()) {
            config.pipeline().getTransitionProbability().put(stage, 0.01);
            config.pipeline().getBaselineDays().put(stage, 365.0);
        }

        StageTransitionPrediction prediction = predictor.predict(deal(NEGOTIATION), velocity);

        assertThat(prediction.nextStage()).isEqualTo(CLOSED_WON);
        assertThat(predictor.nextStage(CLOSING)).isEqualTo(CLOSED_WON);
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "SOURCING,       INITIAL_REVIEW",
        "INITIAL_REVIEW, VALUATION",
        "VALUATION,      DUE_DILIGENCE",
        "DUE_DILIGENCE,  NEGOTIATION"
    })
    void earlierStagesAdvanceOneStep(PipelineStage current, PipelineStage expected) {
        assertThat(predictor.nextStage(current)).isEqualTo(expected);
    }

    @Test
    void optimismWindowIsConfigurable() {
        config.pipeline().setOptimisticCloseStages(1);

        assertThat(predictor.nextStage(NEGOTIATION)).isEqualTo(CLOSING);
        assertThat(predictor.nextStage(CLOSING)).isEqualTo(CLOSED_WON);
    }

    @Test
    void baselinePrediction() {
        StageTransitionPrediction prediction = predictor.predict(deal(DUE_DILIGENCE), velocity);

        assertThat(prediction.currentStage()).isEqualTo(DUE_DILIGENCE);
        assertThat(prediction.probability()).isEqualTo(0.55);
        assertThat(prediction.estimatedDays()).isEqualTo(45);
        assertThat(prediction.confidence()).isEqualTo(PredictionConfidence.LOW);
        assertThat(prediction.keyFactors()).containsExactly("Standard transition probability");
    }

    @ParameterizedTest(name = "confidence {0} -> {1}")
    @CsvSource({
        "0.85, HIGH",
        "0.80, MEDIUM",
        "0.70, MEDIUM",
        "0.60, LOW",
        "0.10, LOW"
    })
    void signalOverridesBaseline(double confidence, PredictionConfidence expected) {
        PipelineDeal deal = deal(VALUATION);
        deal.setTransitionSignal(new TransitionSignal(1.4, 9, confidence, List.of("Board approval secured")));

        StageTransitionPrediction prediction = predictor.predict(deal, velocity);

        assertThat(prediction.probability()).isEqualTo(1.0);
        assertThat(prediction.estimatedDays()).isEqualTo(9);
        assertThat(prediction.confidence()).isEqualTo(expected);
        assertThat(prediction.keyFactors()).containsExactly("Board approval secured");
        assertThat(prediction.nextStage()).isEqualTo(DUE_DILIGENCE);
    }

    @Test
    @DisplayName("A NaN signal probability is treated as zero, not passed through")
    void nanSignalProbabilityIsZero() {
        PipelineDeal deal = deal(SOURCING);
        deal.setTransitionSignal(new TransitionSignal(Double.NaN, 5, Double.NaN, null));

        StageTransitionPrediction prediction = predictor.predict(deal, velocity);

        assertThat(prediction.probability()).isZero();
        assertThat(prediction.confidence()).isEqualTo(PredictionConfidence.LOW);
        assertThat(prediction.keyFactors()).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(value = PipelineStage.class, names = {"CLOSED_WON", "CLOSED_LOST"})
    void closedDealsCannotBePredicted(PipelineStage closed) {
        assertThatThrownBy(() -> predictor.predict(deal(closed), velocity))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> predictor.nextStage(closed))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void predictAllSkipsClosedDeals() {
        List<StageTransitionPrediction> predictions = predictor.predictAll(
            List.of(deal(SOURCING), deal(CLOSED_WON), deal(CLOSING), deal(CLOSED_LOST)), velocity);

        assertThat(predictions).extracting(StageTransitionPrediction::currentStage)
            .containsExactly(SOURCING, CLOSING);
    }
}
