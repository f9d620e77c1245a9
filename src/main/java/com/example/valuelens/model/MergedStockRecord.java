package com.example.valuelens.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical per-symbol view merged from the realtime and financials providers.
 * Amounts in crores unless noted. CAGR fields are null when not computable.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MergedStockRecord implements Serializable {

  private static final long serialVersionUID = 1L;

  @JsonProperty("sym")
  private String symbol;
  private String name;
  @JsonProperty("sec")
  private String sector;
  private String industry;

  @JsonProperty("cmp")
  private BigDecimal price;           // Rupees per share
  @JsonProperty("shr")
  private BigDecimal sharesCrores;
  private BigDecimal mcapCr;
  private BigDecimal pe;
  private BigDecimal eps;
  @JsonProperty("pat")
  private BigDecimal latestProfit;
  @JsonProperty("rev")
  private BigDecimal latestRevenue;

  @JsonProperty("r3")
  private BigDecimal revenueCagr3y;
  @JsonProperty("r5")
  private BigDecimal revenueCagr5y;
  @JsonProperty("p3")
  private BigDecimal profitCagr3y;
  @JsonProperty("p5")
  private BigDecimal profitCagr5y;

  private BigDecimal dayChange;
  private BigDecimal dayChangePct;
  private BigDecimal yearHigh;
  private BigDecimal yearLow;
  private BigDecimal volume;
  private BigDecimal bookValue;
  private BigDecimal dividendYield;

  @Builder.Default
  private List<FinancialYear> years = new ArrayList<>();

  @JsonProperty("_source")
  private SourceInfo source;
}
