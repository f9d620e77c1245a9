package com.example.valuelens.model;

import java.util.Locale;

/**
 * Ticker normalization. Exchange suffixes are dropped and the result is uppercased.
 */
public final class Symbols {

  private static final String[] EXCHANGE_SUFFIXES = {".NS", ".BO"};

  private Symbols() {
  }

  public static String normalize(String symbol) {
    if (symbol == null) {
      return "";
    }
    String upper = symbol.trim().toUpperCase(Locale.ROOT);
    for (String suffix : EXCHANGE_SUFFIXES) {
      upper = upper.replace(suffix, "");
    }
    return upper;
  }
}
