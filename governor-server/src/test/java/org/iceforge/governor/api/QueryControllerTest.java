package org.iceforge.governor.api;

import org.iceforge.governor.query.ComputeFailureException;
import org.iceforge.governor.query.QueryService;
import org.iceforge.governor.quota.QuotaExceededException;
import org.iceforge.governor.quota.QuotaLedger;
import org.iceforge.governor.quota.QuotaPolicy;
import org.iceforge.governor.quota.ResourceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class QueryControllerTest {

    private QueryService queryService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        queryService = mock(QueryService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new QueryController(queryService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void query_miss_returnsNdjsonWithMissHeader() throws Exception {
        byte[] body = "{\"N\":1}\n".getBytes(StandardCharsets.UTF_8);
        when(queryService.run(any())).thenReturn(new QueryService.QueryResult("query:abc", false, body));

        mockMvc.perform(post("/api/queries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tenantId\":\"acme\",\"sql\":\"select 1 as n\"}"))
                .andExpect(status().isOk())
                .andExpect(header().string("Governor-Cache", "MISS"))
                .andExpect(header().string("Governor-Cache-Key", "query:abc"))
                .andExpect(content().contentType("application/x-ndjson"))
                .andExpect(content().bytes(body));
    }

    @Test
    void query_hit_setsHitHeader() throws Exception {
        when(queryService.run(any())).thenReturn(new QueryService.QueryResult("query:abc", true, new byte[0]));

        mockMvc.perform(post("/api/queries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tenantId\":\"acme\",\"sql\":\"select 1\"}"))
                .andExpect(status().isOk())
                .andExpect(header().string("Governor-Cache", "HIT"));
    }

    @Test
    void query_quotaDenied_returns429WithDecision() throws Exception {
        QuotaLedger ledger = new QuotaLedger();
        ledger.setPolicy(new QuotaPolicy("acme", ResourceType.CACHE_BYTES, 10));
        QuotaExceededException denied = new QuotaExceededException(ledger.reserve("acme", ResourceType.CACHE_BYTES, 64));
        when(queryService.run(any())).thenThrow(denied);

        mockMvc.perform(post("/api/queries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tenantId\":\"acme\",\"sql\":\"select 1\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error").value("quota_exceeded"))
                .andExpect(jsonPath("$.tenantId").value("acme"))
                .andExpect(jsonPath("$.resource").value("cache-bytes"))
                .andExpect(jsonPath("$.requested").value(64))
                .andExpect(jsonPath("$.limit").value(10));
    }

    @Test
    void query_computeFailure_returns502() throws Exception {
        when(queryService.run(any())).thenThrow(new ComputeFailureException("query:x", "Failed to compute query:x: boom", null));

        mockMvc.perform(post("/api/queries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tenantId\":\"acme\",\"sql\":\"select 1\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("compute_failed"));
    }

    @Test
    void query_invalidRequest_returns400() throws Exception {
        when(queryService.run(any())).thenThrow(new IllegalArgumentException("sql is required"));

        mockMvc.perform(post("/api/queries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tenantId\":\"acme\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("sql is required"));
    }
}
