package com.example.valuelens.service;

import com.example.valuelens.cache.CacheCategory;
import com.example.valuelens.cache.CacheStore;
import com.example.valuelens.model.SearchResult;
import com.example.valuelens.provider.SymbolSearchProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Symbol search across providers in bean order. The next provider is tried only when the
 * previous one found nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SymbolSearchService {

  static final int MIN_QUERY_LENGTH = 2;
  static final String CACHE_PREFIX = "search:";

  private final CacheStore cacheStore;
  private final List<SymbolSearchProvider> searchProviders;

  /**
   * Search for symbols matching a query string.
   *
   * @param query Search query (e.g., "TCS" or "Tata")
   * @return Matching symbols; empty for queries shorter than two characters
   */
  public List<SearchResult> search(String query) {
    String q = query == null ? "" : query.trim();
    if (q.length() < MIN_QUERY_LENGTH) {
      return Collections.emptyList();
    }

    String cacheKey = CACHE_PREFIX + q.toLowerCase(Locale.ROOT);
    Optional<List<SearchResult>> cached = cacheStore.get(cacheKey);
    if (cached.isPresent() && !cached.get().isEmpty()) {
      return cached.get();
    }

    List<SearchResult> results = Collections.emptyList();
    for (SymbolSearchProvider provider : searchProviders) {
      try {
        results = provider.search(q);
      } catch (RuntimeException e) {
        log.error("[{}] Search failed for '{}': {}", provider.getProviderName(), q, e.toString());
        results = Collections.emptyList();
      }
      if (!results.isEmpty()) {
        break;
      }
      log.info("[{}] No matches for '{}'", provider.getProviderName(), q);
    }

    cacheStore.put(cacheKey, CacheCategory.SEARCH, results);
    return results;
  }
}
