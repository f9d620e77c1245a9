package com.example.valuelens.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigDecimal;

/**
 * Realtime snapshot for one symbol from the realtime provider.
 * Absent upstream values are stored as zero or empty string.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RealtimeQuote implements Serializable {

  private static final long serialVersionUID = 1L;

  private String symbol;
  private String companyName;
  private String sector;
  private String industry;

  private BigDecimal price;
  private BigDecimal marketCap;     // Rupees, or crores for some symbols
  private BigDecimal peRatio;
  private BigDecimal eps;
  private BigDecimal change;
  private BigDecimal changePercent;
  private BigDecimal yearHigh;
  private BigDecimal yearLow;
  private BigDecimal volume;
  private BigDecimal bookValue;
  private BigDecimal dividendYield;
}
