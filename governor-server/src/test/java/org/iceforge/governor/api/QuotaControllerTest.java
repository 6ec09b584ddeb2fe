package org.iceforge.governor.api;

import org.iceforge.governor.quota.QuotaLedger;
import org.iceforge.governor.quota.QuotaTier;
import org.iceforge.governor.quota.ResourceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class QuotaControllerTest {

    private QuotaLedger ledger;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        Map<String, QuotaTier> tiers = Map.of(
                "free", new QuotaTier("free", Map.of(ResourceType.JOBS, 2L)),
                "professional", new QuotaTier("professional", Map.of(ResourceType.JOBS, 200L)));
        ledger = new QuotaLedger(tiers, "free", Clock.systemUTC(), null);
        mockMvc = MockMvcBuilders.standaloneSetup(new QuotaController(ledger))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void tenant_reportsDefaultTierAndUsage() throws Exception {
        ledger.reserve("acme", ResourceType.JOBS, 1);

        mockMvc.perform(get("/api/quotas/acme"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tenantId").value("acme"))
                .andExpect(jsonPath("$.tier").value("free"))
                .andExpect(jsonPath("$.usage[0].resource").value("JOBS"))
                .andExpect(jsonPath("$.usage[0].consumed").value(1))
                .andExpect(jsonPath("$.usage[0].limit").value(2));
    }

    @Test
    void assignTier_switchesLimits() throws Exception {
        mockMvc.perform(put("/api/quotas/acme/tier")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tier\":\"professional\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tier").value("professional"));

        assertThat(ledger.activePolicy("acme", ResourceType.JOBS).orElseThrow().limit()).isEqualTo(200L);
    }

    @Test
    void assignTier_unknown_returns400ListingValidTiers() throws Exception {
        mockMvc.perform(put("/api/quotas/acme/tier")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tier\":\"platinum\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown tier: platinum. Valid tiers: [free, professional]"));
    }

    @Test
    void setPolicy_overridesTier_and_removePolicyRestoresIt() throws Exception {
        mockMvc.perform(put("/api/quotas/acme/api-requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"limit\":100,\"windowSeconds\":60}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tenantId").value("acme"))
                .andExpect(jsonPath("$.limit").value(100));

        assertThat(ledger.reserve("acme", ResourceType.API_REQUESTS, 100).allowed()).isTrue();
        assertThat(ledger.reserve("acme", ResourceType.API_REQUESTS, 1).allowed()).isFalse();

        mockMvc.perform(delete("/api/quotas/acme/api-requests")).andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/quotas/acme/api-requests")).andExpect(status().isNotFound());
        assertThat(ledger.activePolicy("acme", ResourceType.API_REQUESTS)).isEmpty();
    }

    @Test
    void setPolicy_unknownResource_returns400() throws Exception {
        mockMvc.perform(put("/api/quotas/acme/gpus")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"limit\":1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown resource: gpus"));
    }

    @Test
    void overview_listsTiersAndKnownTenants() throws Exception {
        ledger.reserve("globex", ResourceType.JOBS, 1);

        mockMvc.perform(get("/api/quotas"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tenants[0]").value("globex"));
    }
}
