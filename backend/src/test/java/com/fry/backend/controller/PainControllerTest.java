package com.fry.backend.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class PainControllerTest {

    private static final String SHRIMP_LOSS = """
            {"traderId":"%s","asset":"BTC","dollarLoss":500,"accountEquity":2000,"positionSize":1800,
             "leverage":10,"volatility":0.5,"timeInPosition":2,"timestamp":"2024-03-01T12:00:00Z"}
            """;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void scoresAndRecordsALoss() throws Exception {
        mockMvc.perform(post("/api/pain/losses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SHRIMP_LOSS.formatted("ctl-shrimp")))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$.score.traderTier").value("SHRIMP"))
                .andExpect(jsonPath("$.score.painLevel").value("EXCRUCIATING"))
                .andExpect(jsonPath("$.patterns.behaviorPattern").value("DEGENERATE_GAMBLER"));

        mockMvc.perform(get("/api/pain/traders/ctl-shrimp"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lossCount").value(1))
                .andExpect(jsonPath("$.tier").value("SHRIMP"));
    }

    @Test
    void invalidLossIsBadRequestWithField() throws Exception {
        mockMvc.perform(post("/api/pain/losses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SHRIMP_LOSS.formatted("ctl-bad").replace("\"leverage\":10", "\"leverage\":0.5")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.details[0].field").value("leverage"));

        mockMvc.perform(get("/api/pain/traders/ctl-bad"))
                .andExpect(status().isNotFound());
    }

    @Test
    void unknownTraderIsNotFound() throws Exception {
        mockMvc.perform(get("/api/pain/traders/ctl-missing").header("X-Correlation-Id", "corr-42"))
                .andExpect(status().isNotFound())
                .andExpect(header().string("X-Correlation-Id", "corr-42"))
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"))
                .andExpect(jsonPath("$.correlationId").value("corr-42"))
                .andExpect(jsonPath("$.message").value("No loss history for trader ctl-missing"));
    }

    @Test
    void batchReportsRejectedEntries() throws Exception {
        String body = "{\"events\":[" + SHRIMP_LOSS.formatted("ctl-batch")
                + "," + SHRIMP_LOSS.formatted("ctl-batch").replace("\"volatility\":0.5", "\"volatility\":4") + "]}";

        mockMvc.perform(post("/api/pain/losses/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.submitted").value(2))
                .andExpect(jsonPath("$.accepted", hasSize(1)))
                .andExpect(jsonPath("$.rejected[0].index").value(1))
                .andExpect(jsonPath("$.rejected[0].field").value("volatility"));
    }

    @Test
    void untimestampedBatchLossesCountTowardEachOthersFrequency() throws Exception {
        String loss = SHRIMP_LOSS.formatted("ctl-batch-repeat").replace(",\"timestamp\":\"2024-03-01T12:00:00Z\"", "");
        String body = "{\"events\":[" + loss + "," + loss + "," + loss + "]}";

        mockMvc.perform(post("/api/pain/losses/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted", hasSize(3)))
                .andExpect(jsonPath("$.accepted[0].analysis.score.breakdown.frequencyMultiplier", closeTo(1.0, 1e-9)))
                .andExpect(jsonPath("$.accepted[1].analysis.score.breakdown.frequencyMultiplier", closeTo(1.2, 1e-9)))
                .andExpect(jsonPath("$.accepted[2].analysis.score.breakdown.frequencyMultiplier", closeTo(1.4, 1e-9)));
    }

    @Test
    void queryArgumentsAreValidated() throws Exception {
        mockMvc.perform(get("/api/pain/leaderboard").param("limit", "-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("limit must not be negative"));
        mockMvc.perform(get("/api/pain/impact").param("asset", "BTC").param("windowHours", "0"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/pain/impact").param("asset", "BTC"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/pain/tiers").param("equity", "-5"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void classifiesEquity() throws Exception {
        mockMvc.perform(get("/api/pain/tiers").param("equity", "1000000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tier").value("WHALE"))
                .andExpect(jsonPath("$.displayName").value("Whale"));
    }

    @Test
    void networkAndReportAreAvailable() throws Exception {
        mockMvc.perform(get("/api/pain/network"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.segments.WHALE").exists());
        mockMvc.perform(get("/api/pain/report"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.painIndices").exists())
                .andExpect(jsonPath("$.leaderboard").isArray());
        mockMvc.perform(get("/api/pain/impact").param("asset", "BTC").param("windowHours", "24"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.impactBySegment.SHRIMP").exists());
    }
}
