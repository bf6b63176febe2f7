package com.jay.dealintel.config;

import com.jay.dealintel.exception.InvalidConfigurationException;
import com.jay.dealintel.model.ScoringWeights;
import com.jay.dealintel.model.enums.PipelineStage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DealIntelConfigTest {

    private static DealIntelConfig load(String file) {
        DealIntelConfig config = new DealIntelConfig();
        ReflectionTestUtils.setField(config, "configFile", file);
        config.load();
        return config;
    }

    @Test
    @DisplayName("Shipped config.yaml matches the built-in defaults")
    void shippedConfigLoads() {
        DealIntelConfig config = load("config.yaml");

        assertThat(config.scoring().getWeightProfiles()).containsKeys("deal-insights", "balanced");
        assertThat(config.weights().getFinancial()).isEqualTo(0.30);
        assertThat(config.weightProfile("balanced").getTeam()).isEqualTo(0.10);
        assertThat(config.pipeline().getBaselineDays().get(PipelineStage.DUE_DILIGENCE)).isEqualTo(45.0);
        assertThat(config.pipeline().getCloseProbability().get(PipelineStage.CLOSING)).isEqualTo(0.85);
        assertThat(config.synergy().getDiscountRate()).isEqualTo(0.10);
        assertThat(config.cache().getReportTtlMinutes()).isEqualTo(30);
    }

    @Test
    @DisplayName("Missing config file keeps defaults")
    void missingFileKeepsDefaults() {
        DealIntelConfig config = load("does-not-exist.yaml");

        assertThat(config.scoring().getDefaultProfile()).isEqualTo(DealIntelConfig.DEFAULT_PROFILE);
        assertThat(config.weights().sum()).isCloseTo(1.0, within(1e-9));
        assertThat(config.pipeline().getOptimisticCloseStages()).isEqualTo(2);
    }

    @Test
    @DisplayName("Profile whose weights do not sum to 1 fails startup")
    void badWeightsFailStartup() {
        assertThatThrownBy(() -> load("bad-weights.yaml"))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("lopsided");
    }

    @Test
    void partialFileOverridesOnlyWhatItNames() {
        DealIntelConfig config = load("custom-profile.yaml");

        assertThat(config.scoring().getDefaultProfile()).isEqualTo("growth");
        assertThat(config.weights().getMarket()).isEqualTo(0.30);
        assertThat(config.pipeline().getOptimisticCloseStages()).isEqualTo(1);
        assertThat(config.pipeline().getBottleneckMultiplier()).isEqualTo(1.5);
        assertThat(config.synergy().getIntegrationCostRatio()).isEqualTo(0.15);
    }

    @Test
    void unknownProfileThrows() {
        DealIntelConfig config = new DealIntelConfig();

        assertThatThrownBy(() -> config.weightProfile("aggressive"))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("aggressive");
    }

    @Test
    void weightValidation() {
        assertThatThrownBy(() -> new ScoringWeights(0.5, 0.5, 0.5, 0, 0, 0).validate())
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("sum to 1.0");
        assertThatThrownBy(() -> new ScoringWeights(1.2, -0.2, 0, 0, 0, 0).validate())
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("Negative");
        new ScoringWeights(0.25, 0.20, 0.20, 0.15, 0.10, 0.10).validate();
    }
}
