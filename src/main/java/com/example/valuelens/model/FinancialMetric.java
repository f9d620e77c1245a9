package com.example.valuelens.model;

import java.math.BigDecimal;
import java.util.function.Function;

public enum FinancialMetric {

  REVENUE(FinancialYear::getRevenue),
  PROFIT(FinancialYear::getProfit);

  private final Function<FinancialYear, BigDecimal> accessor;

  FinancialMetric(Function<FinancialYear, BigDecimal> accessor) {
    this.accessor = accessor;
  }

  public BigDecimal valueOf(FinancialYear year) {
    return year == null ? null : accessor.apply(year);
  }
}
