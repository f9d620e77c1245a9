package com.example.valuelens.model;

import lombok.Getter;

import java.util.Optional;

/**
 * Outcome of a provider call: a value with the name of the provider that supplied it, or empty.
 * Providers return this instead of throwing.
 */
@Getter
public final class ProviderResult<T> {

  private static final ProviderResult<?> EMPTY = new ProviderResult<>(null, SourceInfo.NONE);

  private final T value;
  private final String source;

  private ProviderResult(T value, String source) {
    this.value = value;
    this.source = source;
  }

  public static <T> ProviderResult<T> found(T value, String source) {
    if (value == null || source == null) {
      return empty();
    }
    return new ProviderResult<>(value, source);
  }

  @SuppressWarnings("unchecked")
  public static <T> ProviderResult<T> empty() {
    return (ProviderResult<T>) EMPTY;
  }

  public boolean isEmpty() {
    return value == null;
  }

  public Optional<T> getValue() {
    return Optional.ofNullable(value);
  }
}
