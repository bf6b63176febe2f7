package com.jay.dealintel.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class DealIntelligenceControllerTest {

    private static final String STRONG_FINANCIALS = """
        {"deal_id": "deal-7", "growth_rate": 25, "ebitda_margin": 18, "debt_to_equity": 0.2}
        """;

    private static final String COMPANIES = """
        {
          "target":   {"name": "Target", "industry": "technology", "annual_revenue": 100000000,
                       "operating_costs": 70000000, "pretax_income": 10000000,
                       "product_categories": ["software"], "geographic_markets": ["US", "EU"]},
          "acquirer": {"name": "Acquirer", "annual_revenue": 400000000, "operating_costs": 300000000,
                       "pretax_income": 50000000, "product_categories": ["software"],
                       "geographic_markets": ["US"]}
        }
        """;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void statusReportsProfiles() throws Exception {
        mockMvc.perform(get("/api/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("RUNNING"))
            .andExpect(jsonPath("$.default_profile").value("deal-insights"))
            .andExpect(jsonPath("$.weight_profiles", hasItem("balanced")))
            .andExpect(jsonPath("$.tracked_synergies").isNumber());
    }

    @Test
    void scoresDealInSnakeCase() throws Exception {
        mockMvc.perform(post("/api/deals/score").contentType(MediaType.APPLICATION_JSON).content(STRONG_FINANCIALS))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.deal_id").value("deal-7"))
            .andExpect(jsonPath("$.financial_score").value(95.0))
            .andExpect(jsonPath("$.risk_level").value("MEDIUM"))
            .andExpect(jsonPath("$.recommendation").value("PROCEED_WITH_CAUTION"))
            .andExpect(jsonPath("$.key_strengths", hasItem("Strong financial performance")));
    }

    @Test
    void unknownProfileIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/deals/score").param("profile", "aggressive")
                .contentType(MediaType.APPLICATION_JSON).content(STRONG_FINANCIALS))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    void unknownCategoricalValueIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/deals/score").contentType(MediaType.APPLICATION_JSON)
                .content("{\"market_size\": \"GIGANTIC\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void ranksDeals() throws Exception {
        mockMvc.perform(post("/api/deals/rank").contentType(MediaType.APPLICATION_JSON)
                .content("[{\"deal_id\": \"plain\"}, " + STRONG_FINANCIALS + "]"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].deal_id").value("deal-7"))
            .andExpect(jsonPath("$[1].deal_id").value("plain"));
    }

    @Test
    void identifiesSynergies() throws Exception {
        mockMvc.perform(post("/api/synergies/identify").contentType(MediaType.APPLICATION_JSON).content(COMPANIES))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].category").value("CROSS_SELLING"))
            .andExpect(jsonPath("$[0].status").value("IDENTIFIED"));
    }

    @Test
    void quantifiesSynergy() throws Exception {
        String body = """
            {"opportunity": {"synergy_id": "s1", "estimated_value": 1000000, "realization_timeline_months": 12,
                             "confidence_level": 0.8, "risks": ["r1", "r2"]},
             "market_data": {"market_growth_rate": 0.03, "discount_rate": 0.10}}
            """;

        mockMvc.perform(post("/api/synergies/quantify").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.most_likely_value").value(720000.0));
    }

    @Test
    void integrationLifecycle() throws Exception {
        mockMvc.perform(post("/api/integrations/int-web").contentType(MediaType.APPLICATION_JSON).content(COMPANIES))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.integration_id").value("int-web"))
            .andExpect(jsonPath("$.synergies_identified", greaterThan(0)));

        mockMvc.perform(get("/api/integrations/int-web/dashboard"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.metrics.total_synergies_realized").value(0.0))
            .andExpect(jsonPath("$.status_breakdown.IDENTIFIED", greaterThan(0)));

        mockMvc.perform(post("/api/integrations/int-web/synergies/not-there/status").param("status", "PLANNED"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void unknownIntegrationIsNotFound() throws Exception {
        mockMvc.perform(get("/api/integrations/nope/dashboard"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value("Integration portfolio not found: nope"));
    }

    @Test
    void analyzesPipeline() throws Exception {
        String body = """
            {"deals": [{"id": "a", "stage": "negotiation", "valuation": 3000000},
                       {"id": "b", "stage": "DUE_DILIGENCE", "valuation": 5000000}],
             "history": [{"deal_id": "h1", "stage_history": [
                            {"stage": "SOURCING", "timestamp": "2024-01-01T09:00:00"},
                            {"stage": "INITIAL_REVIEW", "timestamp": "2024-01-11T09:00:00"}]}]}
            """;

        mockMvc.perform(post("/api/pipeline/analyze").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.stage_transitions", hasSize(2)))
            .andExpect(jsonPath("$.stage_transitions[0].next_stage").value("CLOSED_WON"))
            .andExpect(jsonPath("$.velocity.average_days_per_stage.SOURCING").value(10.0))
            .andExpect(jsonPath("$.revenue_forecast.monthly", hasSize(12)));
    }

    @Test
    void unknownStageIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/pipeline/forecast").contentType(MediaType.APPLICATION_JSON)
                .content("[{\"id\": \"x\", \"stage\": \"DREAMING\", \"valuation\": 1}]"))
            .andExpect(status().isBadRequest());
    }
}
