package com.example.valuelens.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Conversions into crores (1 crore = 10,000,000 rupees).
 */
public final class Crores {

  public static final BigDecimal CRORE = new BigDecimal("10000000");

  /**
   * ISMA reports market cap in rupees for most symbols but already in crores for some.
   * Values at or below this are taken to be crores. Provider workaround, not a general rule.
   */
  static final BigDecimal RAW_MARKET_CAP_THRESHOLD = new BigDecimal("1000000");

  private Crores() {
  }

  /**
   * Converts an amount in units (rupees, shares) to crores, rounded to {@code scale} decimals.
   */
  public static BigDecimal of(BigDecimal units, int scale) {
    if (units == null) {
      return BigDecimal.ZERO.setScale(scale);
    }
    return units.divide(CRORE, scale, RoundingMode.HALF_UP);
  }

  /**
   * Market cap in crores, unrounded.
   */
  public static BigDecimal fromMarketCap(BigDecimal rawMarketCap) {
    if (rawMarketCap == null) {
      return BigDecimal.ZERO;
    }
    if (rawMarketCap.compareTo(RAW_MARKET_CAP_THRESHOLD) > 0) {
      return rawMarketCap.divide(CRORE, MathContext.DECIMAL64);
    }
    return rawMarketCap;
  }
}
