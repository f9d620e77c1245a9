package com.example.valuelens.service;

import com.example.valuelens.cache.CacheCategory;
import com.example.valuelens.cache.CacheStore;
import com.example.valuelens.model.QuoteSummary;
import com.example.valuelens.model.Symbols;
import com.example.valuelens.provider.RealtimeQuoteProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Best-effort quotes for a watchlist in a single upstream request. No per-symbol fallback.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchQuoteService {

  static final int MAX_SYMBOLS = 20;
  static final String CACHE_PREFIX = "batch:";

  private final CacheStore cacheStore;
  private final RealtimeQuoteProvider realtimeProvider;

  public List<QuoteSummary> quotes(List<String> symbols) {
    if (symbols == null || symbols.isEmpty()) {
      return Collections.emptyList();
    }

    List<String> requested = symbols.stream()
        .limit(MAX_SYMBOLS)
        .filter(Objects::nonNull)
        .map(Symbols::normalize)
        .filter(s -> !s.isEmpty())
        .toList();
    if (requested.isEmpty()) {
      return Collections.emptyList();
    }

    String cacheKey = CACHE_PREFIX + requested.stream().sorted().collect(Collectors.joining("_"));
    Optional<List<QuoteSummary>> cached = cacheStore.get(cacheKey);
    if (cached.isPresent()) {
      return cached.get();
    }

    List<QuoteSummary> results = realtimeProvider.fetchBatch(requested);
    log.debug("Batch of {} returned {} quotes", requested.size(), results.size());

    cacheStore.put(cacheKey, CacheCategory.QUOTE, results);
    return results;
  }
}
