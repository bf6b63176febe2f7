package com.jay.dealintel.layer4_pipeline;

import com.jay.dealintel.config.DealIntelConfig;
import com.jay.dealintel.model.BottleneckAnalysis;
import com.jay.dealintel.model.PipelineDeal;
import com.jay.dealintel.model.PipelinePredictions;
import com.jay.dealintel.model.PipelineVelocity;
import com.jay.dealintel.model.enums.Level;
import com.jay.dealintel.model.enums.PipelineStage;
import com.jay.dealintel.model.enums.VelocityTrend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineIntelligenceServiceTest {

    private PipelineIntelligenceService service;

    @BeforeEach
    void setUp() {
        DealIntelConfig config = new DealIntelConfig();
        service = new PipelineIntelligenceService(new PipelineVelocityAnalyzer(config),
            new StageTransitionPredictor(config), new RevenueForecastEngine(config), new BottleneckAnalyzer(config));
    }

    @Test
    void analyzesSnapshot() {
        List<PipelineDeal> deals = List.of(
            PipelineDeal.builder().dealId("a").stage(PipelineStage.DUE_DILIGENCE).valuation(5_000_000).build(),
            PipelineDeal.builder().dealId("b").stage(PipelineStage.NEGOTIATION).valuation(3_000_000).build(),
            PipelineDeal.builder().dealId("c").stage(PipelineStage.CLOSED_WON).valuation(9_000_000).build());

        PipelinePredictions predictions = service.analyze(deals, null);

        assertThat(predictions.stageTransitions()).hasSize(2);
        assertThat(predictions.stageTransitions().get(1).nextStage()).isEqualTo(PipelineStage.CLOSED_WON);
        assertThat(predictions.bottlenecks()).extracting(BottleneckAnalysis::stage)
            .containsExactly(PipelineStage.DUE_DILIGENCE);
        assertThat(predictions.revenueForecast().annual().pipelineValue()).isEqualTo(8_000_000.0);
        assertThat(predictions.optimizationOpportunities()).isEmpty();
        assertThat(predictions.generatedAt()).isNotNull();
    }

    @Test
    void nullSnapshotIsEmptyPipeline() {
        PipelinePredictions predictions = service.analyze(null, null);

        assertThat(predictions.stageTransitions()).isEmpty();
        assertThat(predictions.bottlenecks()).isEmpty();
    }

    @Test
    void opportunitiesAreCappedAtFive() {
        PipelineVelocity struggling = PipelineVelocity.builder()
            .averageDaysPerStage(Map.of())
            .stagesFromHistory(Set.of())
            .totalPipelineDuration(200)
            .velocityTrend(VelocityTrend.DECREASING)
            .bottleneckStages(List.of())
            .congestedStages(List.of())
            .efficiencyScore(60)
            .build();
        List<BottleneckAnalysis> bottlenecks = List.of(
            new BottleneckAnalysis(PipelineStage.SOURCING, 1, 0, 0, Level.LOW, List.of()),
            new BottleneckAnalysis(PipelineStage.VALUATION, 1, 0, 0, Level.LOW, List.of()),
            new BottleneckAnalysis(PipelineStage.CLOSING, 1, 0, 0, Level.LOW, List.of()));

        List<String> opportunities = service.optimizationOpportunities(struggling, bottlenecks);

        assertThat(opportunities).hasSize(5)
            .startsWith("Implement pipeline automation tools")
            .doesNotContain("Parallel process development");
    }
}
