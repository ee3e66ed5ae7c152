package com.hydra.backend.controller;

import com.hydra.backend.service.marketdata.InMemoryPriceFeed;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class HydraApiControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private InMemoryPriceFeed priceFeed;

    @Test
    void ingestedSignalShowsUpInScore() throws Exception {
        mockMvc.perform(post("/api/signals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sourceId":"gex_levels","asset":"QQQ","direction":0.6,"strength":0.8}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.stored").value(true));

        mockMvc.perform(get("/api/signals/QQQ"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.asset").value("QQQ"))
                .andExpect(jsonPath("$.contributingSignalCount").value(1))
                .andExpect(jsonPath("$.netDirection", greaterThan(0.0)))
                .andExpect(jsonPath("$.dominantSource").value("gex_levels"));
    }

    @Test
    void outOfRangeSignalIsRejected() throws Exception {
        mockMvc.perform(post("/api/signals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sourceId":"vix_term","asset":"SPY","direction":1.5,"strength":0.8}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.path").value("/api/signals"));
    }

    @Test
    void pricePushFeedsThePriceFeed() throws Exception {
        mockMvc.perform(post("/api/market-data/prices")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"asset":"IWM","close":201.25}
                                """))
                .andExpect(status().isNoContent());

        assertThat(priceFeed.getPrice("IWM")).hasValue(201.25);
    }

    @Test
    void nonPositivePriceIsRejected() throws Exception {
        mockMvc.perform(post("/api/market-data/prices")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"asset":"IWM","close":0}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void dashboardSnapshotCombinesEverySection() throws Exception {
        mockMvc.perform(get("/api/dashboard/snapshot"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.regime.regime").exists())
                .andExpect(jsonPath("$.risk.capital").isNumber())
                .andExpect(jsonPath("$.openPositions").isArray())
                .andExpect(jsonPath("$.strategyWeights").exists())
                .andExpect(jsonPath("$.generatedAt").exists());
    }

    @Test
    void riskStatusAndResume() throws Exception {
        mockMvc.perform(get("/api/risk/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.halted").value(false))
                .andExpect(jsonPath("$.killSwitchTripped").value(false));

        mockMvc.perform(post("/api/risk/resume"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.halted").value(false));
    }

    @Test
    void regimeStartsUnknown() throws Exception {
        mockMvc.perform(get("/api/regime/current"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.regime").value("UNKNOWN"));
    }

    @Test
    void closingUnknownPositionIsNotFound() throws Exception {
        mockMvc.perform(post("/api/positions/does-not-exist/close"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));

        mockMvc.perform(get("/api/positions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }
}
