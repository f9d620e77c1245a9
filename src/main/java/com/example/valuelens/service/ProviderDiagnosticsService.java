package com.example.valuelens.service;

import com.example.valuelens.provider.DiagnosableProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Live reachability check of every upstream provider. Bypasses the cache.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderDiagnosticsService {

  private final List<DiagnosableProvider> providers;

  public Map<String, Object> probe() {
    Map<String, Object> sources = new LinkedHashMap<>();
    for (DiagnosableProvider provider : providers) {
      try {
        sources.put(provider.getProviderName(), provider.probe());
      } catch (RuntimeException e) {
        log.error("Probe of {} failed: {}", provider.getProviderName(), e.toString());
        sources.put(provider.getProviderName(), Map.of(
            "working", false,
            "error", String.valueOf(e.getMessage())
        ));
      }
    }

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("status", "ok");
    result.put("sources", sources);
    return result;
  }
}
