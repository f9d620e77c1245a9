package com.example.valuelens.service;

import com.example.valuelens.model.FinancialMetric;
import com.example.valuelens.model.FinancialYear;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * Compound annual growth rate over a yearly series ordered most recent first.
 */
public final class CagrCalculator {

  private CagrCalculator() {
  }

  /**
   * CAGR in percent between index 0 and index {@code years}, rounded to one decimal.
   *
   * Empty when the series has fewer than {@code years + 1} entries or either endpoint is missing
   * or not strictly positive. Empty is distinct from a computed 0.0%.
   */
  public static Optional<BigDecimal> cagr(List<FinancialYear> series, FinancialMetric metric, int years) {
    if (series == null || years <= 0 || series.size() < years + 1) {
      return Optional.empty();
    }

    BigDecimal latest = metric.valueOf(series.get(0));
    BigDecimal base = metric.valueOf(series.get(years));
    if (latest == null || base == null || latest.signum() <= 0 || base.signum() <= 0) {
      return Optional.empty();
    }

    double percent = (Math.pow(latest.doubleValue() / base.doubleValue(), 1.0 / years) - 1) * 100;
    if (!Double.isFinite(percent)) {
      return Optional.empty();
    }
    return Optional.of(BigDecimal.valueOf(percent).setScale(1, RoundingMode.HALF_UP));
  }
}
