package com.example.valuelens.cache;

/**
 * Cache categories. Each one carries its own time-to-live, configured under valuelens.cache.
 */
public enum CacheCategory {
  QUOTE,
  SEARCH
}
