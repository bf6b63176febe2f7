package com.jay.dealintel.layer1_scoring;

import com.jay.dealintel.model.DealAttributes;
import com.jay.dealintel.model.enums.Level;
import com.jay.dealintel.model.enums.MarketPosition;
import com.jay.dealintel.model.enums.MarketSize;
import com.jay.dealintel.model.enums.ScoreComponent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ScoreComponentCalculatorTest {

    private final ScoreComponentCalculator calculator = new ScoreComponentCalculator();

    @Test
    @DisplayName("Empty attribute bag scores every component from its neutral defaults")
    void neutralDefaults() {
        Map<ScoreComponent, Double> scores = calculator.scoreAll(new DealAttributes());

        assertThat(scores).containsEntry(ScoreComponent.FINANCIAL, 50.0)
            .containsEntry(ScoreComponent.STRATEGIC, 50.0)
            .containsEntry(ScoreComponent.MARKET, 50.0)
            .containsEntry(ScoreComponent.RISK, 30.0)
            .containsEntry(ScoreComponent.EXECUTION, 60.0)
            .containsEntry(ScoreComponent.TEAM, 65.0);
    }

    @Test
    @DisplayName("Strong growth, margin and low leverage add up to 95")
    void financialStrongDeal() {
        DealAttributes deal = DealAttributes.builder()
            .revenueGrowthRate(25.0).ebitdaMargin(18.0).debtToEquity(0.2).build();

        assertThat(calculator.financial(deal)).isEqualTo(95.0);
    }

    @ParameterizedTest(name = "growth={0} margin={1} d/e={2} -> {3}")
    @CsvSource({
        "15,   10,  1.0, 68",
        "20,   5,   1.0, 60",
        "-5,   -2,  3.0, 0",
        "0,    0,   0.5, 50",
        "11,   16,  2.5, 60"
    })
    void financialLadder(double growth, double margin, double debtToEquity, double expected) {
        DealAttributes deal = DealAttributes.builder()
            .revenueGrowthRate(growth).ebitdaMargin(margin).debtToEquity(debtToEquity).build();

        assertThat(calculator.financial(deal)).isEqualTo(expected);
    }

    @Test
    void strategicFitAndPosition() {
        DealAttributes leader = DealAttributes.builder()
            .strategicFit(5).marketPosition(MarketPosition.LEADER).synergyPotential(Level.HIGH).build();
        DealAttributes weak = DealAttributes.builder()
            .strategicFit(1).marketPosition(MarketPosition.FOLLOWER).synergyPotential(Level.LOW).build();

        assertThat(calculator.strategic(leader)).isEqualTo(100.0);
        assertThat(calculator.strategic(weak)).isEqualTo(10.0);
    }

    @Test
    void marketLadder() {
        DealAttributes attractive = DealAttributes.builder()
            .marketSize(MarketSize.LARGE).marketGrowth(20.0).competitiveIntensity(Level.LOW).build();
        DealAttributes shrinking = DealAttributes.builder()
            .marketSize(MarketSize.SMALL).marketGrowth(-3.0).competitiveIntensity(Level.HIGH).build();

        assertThat(calculator.market(attractive)).isEqualTo(100.0);
        assertThat(calculator.market(shrinking)).isEqualTo(20.0);
    }

    @Test
    @DisplayName("Risk rises with concentration, leverage and high-risk flags")
    void riskAccumulates() {
        DealAttributes risky = DealAttributes.builder()
            .revenueConcentration(60.0).debtToEquity(2.5)
            .managementRisk(Level.HIGH).regulatoryRisk(Level.HIGH).marketVolatility(Level.HIGH).build();
        DealAttributes safe = DealAttributes.builder()
            .managementRisk(Level.LOW).regulatoryRisk(Level.LOW).build();

        assertThat(calculator.risk(risky)).isEqualTo(100.0);
        assertThat(calculator.risk(safe)).isEqualTo(15.0);
    }

    @Test
    void executionAndTeam() {
        DealAttributes easy = DealAttributes.builder()
            .dealComplexity(Level.LOW).integrationRisk(Level.LOW).timelinePressure(Level.LOW).build();
        DealAttributes hard = DealAttributes.builder()
            .dealComplexity(Level.HIGH).integrationRisk(Level.HIGH).timelinePressure(Level.HIGH).build();
        DealAttributes seasoned = DealAttributes.builder()
            .managementExperience(Level.HIGH).trackRecordScore(1.0).culturalFitScore(1.0).build();

        assertThat(calculator.execution(easy)).isEqualTo(95.0);
        assertThat(calculator.execution(hard)).isEqualTo(15.0);
        assertThat(calculator.team(seasoned)).isEqualTo(100.0);
    }

    @ParameterizedTest
    @EnumSource(ScoreComponent.class)
    @DisplayName("Adversarial inputs never escape the 0 - 100 range")
    void clampedUnderExtremes(ScoreComponent component) {
        DealAttributes extremeHigh = DealAttributes.builder()
            .revenueGrowthRate(1e9).ebitdaMargin(1e9).debtToEquity(-1e9)
            .strategicFit(2_000_000_000).marketPosition(MarketPosition.LEADER).synergyPotential(Level.HIGH)
            .marketSize(MarketSize.LARGE).marketGrowth(1e9).competitiveIntensity(Level.LOW)
            .revenueConcentration(1e9).managementRisk(Level.HIGH).regulatoryRisk(Level.HIGH)
            .marketVolatility(Level.HIGH).trackRecordScore(1e9).culturalFitScore(1e9).build();
        DealAttributes extremeLow = DealAttributes.builder()
            .revenueGrowthRate(-1e9).ebitdaMargin(-1e9).debtToEquity(1e9)
            .strategicFit(-2_000_000_000).trackRecordScore(-1e9).culturalFitScore(Double.NaN).build();

        assertThat(calculator.score(component, extremeHigh)).isBetween(0.0, 100.0);
        assertThat(calculator.score(component, extremeLow)).isBetween(0.0, 100.0);
    }

    @Test
    @DisplayName("Out-of-range strategic fit is pinned to the 1 – 5 scale")
    void strategicFitOutOfRange() {
        DealAttributes huge = DealAttributes.fromMap(Map.of("strategic_fit", 2_000_000_000));
        DealAttributes top = DealAttributes.builder().strategicFit(5).build();
        DealAttributes negative = DealAttributes.builder().strategicFit(-2_000_000_000).build();
        DealAttributes bottom = DealAttributes.builder().strategicFit(1).build();

        assertThat(calculator.strategic(huge)).isEqualTo(calculator.strategic(top)).isEqualTo(80.0);
        assertThat(calculator.strategic(negative)).isEqualTo(calculator.strategic(bottom)).isEqualTo(20.0);
    }

    @Test
    void extremeStrategicInputsScoreAtTheTop() {
        DealAttributes extreme = DealAttributes.builder()
            .strategicFit(2_000_000_000).marketPosition(MarketPosition.LEADER).synergyPotential(Level.HIGH).build();

        assertThat(calculator.strategic(extreme)).isEqualTo(100.0);
    }
}
