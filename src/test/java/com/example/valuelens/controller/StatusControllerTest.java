package com.example.valuelens.controller;

import com.example.valuelens.cache.CacheStore;
import com.example.valuelens.config.ValueLensConfig;
import com.example.valuelens.service.ProviderDiagnosticsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = StatusController.class, properties = "valuelens.providers.eodhd.api-key=")
@Import(ValueLensConfig.class)
class StatusControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockBean
    CacheStore cacheStore;
    @MockBean
    ProviderDiagnosticsService diagnosticsService;

    @Test
    @DisplayName("health reports sources, cache size and that EODHD is off")
    void health() throws Exception {
        when(cacheStore.size()).thenReturn(7);

        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.service").value("ValueLens API v4"))
                .andExpect(jsonPath("$.sources.realtime").value("Indian Stock Market API (INR)"))
                .andExpect(jsonPath("$.sources.financials").value("Yahoo Finance (INR)"))
                .andExpect(jsonPath("$.sources.fallback").value("none"))
                .andExpect(jsonPath("$.cache_entries").value(7))
                .andExpect(jsonPath("$.eodhd_configured").value(false));
    }

    @Test
    @DisplayName("test endpoint returns the live provider probe")
    void providerProbe() throws Exception {
        Map<String, Object> sources = new LinkedHashMap<>();
        sources.put("isma", Map.of("working", true));
        sources.put("eodhd", Map.of("configured", false));
        Map<String, Object> probe = new LinkedHashMap<>();
        probe.put("status", "ok");
        probe.put("sources", sources);
        when(diagnosticsService.probe()).thenReturn(probe);

        mockMvc.perform(get("/api/test"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.sources.isma.working").value(true))
                .andExpect(jsonPath("$.sources.eodhd.configured").value(false));
    }
}
