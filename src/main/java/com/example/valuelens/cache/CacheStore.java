package com.example.valuelens.cache;

import com.example.valuelens.config.ValueLensProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-lifetime response cache keyed by request parameters.
 *
 * Entries expire only by TTL and are dropped when an expired entry is looked up.
 * There is no size bound and no single-flight: concurrent misses for one key both reach upstream.
 */
@Slf4j
@Component
public class CacheStore {

  private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
  private final Map<CacheCategory, Duration> ttls = new EnumMap<>(CacheCategory.class);
  private final Clock clock;

  public CacheStore(ValueLensProperties properties, Clock clock) {
    this.clock = clock;
    ValueLensProperties.Cache settings = properties.getCache();
    ttls.put(CacheCategory.QUOTE, settings.getQuoteTtl());
    ttls.put(CacheCategory.SEARCH, settings.getSearchTtl());
  }

  /**
   * Returns the cached payload for {@code key} if present and within its category's TTL.
   */
  @SuppressWarnings("unchecked")
  public <T> Optional<T> get(String key) {
    CacheEntry entry = entries.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (isExpired(entry, clock.instant())) {
      entries.remove(key, entry);
      log.debug("Cache entry expired: {}", key);
      return Optional.empty();
    }
    log.debug("Cache hit: {}", key);
    return Optional.of((T) entry.payload);
  }

  public void put(String key, CacheCategory category, Object payload) {
    if (payload == null) {
      return;
    }
    entries.put(key, new CacheEntry(payload, category, clock.instant()));
  }

  /**
   * Number of stored entries still within their TTL.
   */
  public int size() {
    Instant now = clock.instant();
    return (int) entries.values().stream()
        .filter(entry -> !isExpired(entry, now))
        .count();
  }

  private boolean isExpired(CacheEntry entry, Instant now) {
    Duration age = Duration.between(entry.insertedAt, now);
    return age.compareTo(ttls.get(entry.category)) > 0;
  }

  private static final class CacheEntry {
    private final Object payload;
    private final CacheCategory category;
    private final Instant insertedAt;

    private CacheEntry(Object payload, CacheCategory category, Instant insertedAt) {
      this.payload = payload;
      this.category = category;
      this.insertedAt = insertedAt;
    }
  }
}
