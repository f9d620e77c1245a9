package com.example.valuelens.controller;

import com.example.valuelens.cache.CacheStore;
import com.example.valuelens.config.ValueLensProperties;
import com.example.valuelens.service.ProviderDiagnosticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class StatusController {

  private static final String SERVICE_NAME = "ValueLens API v4";

  private final CacheStore cacheStore;
  private final ValueLensProperties properties;
  private final ProviderDiagnosticsService diagnosticsService;

  @GetMapping("/")
  public ResponseEntity<Map<String, Object>> health() {
    boolean eodhdConfigured = properties.getProviders().getEodhd().isConfigured();

    Map<String, Object> sources = new LinkedHashMap<>();
    sources.put("realtime", "Indian Stock Market API (INR)");
    sources.put("financials", eodhdConfigured ? "EODHD" : "Yahoo Finance (INR)");
    sources.put("fallback", eodhdConfigured ? "Yahoo Finance (INR)" : "none");

    Map<String, Object> response = new LinkedHashMap<>();
    response.put("status", "ok");
    response.put("service", SERVICE_NAME);
    response.put("sources", sources);
    response.put("cache_entries", cacheStore.size());
    response.put("eodhd_configured", eodhdConfigured);
    return ResponseEntity.ok(response);
  }

  /**
   * Live probe of every upstream provider (debug).
   */
  @GetMapping("/api/test")
  public ResponseEntity<Map<String, Object>> test() {
    return ResponseEntity.ok(diagnosticsService.probe());
  }
}
