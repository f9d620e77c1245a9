package com.example.valuelens.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigDecimal;

/**
 * Lightweight quote returned by the batch endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuoteSummary implements Serializable {

  private static final long serialVersionUID = 1L;

  @JsonProperty("sym")
  private String symbol;
  private String name;
  @JsonProperty("cmp")
  private BigDecimal price;
  private BigDecimal pe;
  private BigDecimal mcapCr;
  private BigDecimal dayChangePct;
}
