package com.example.valuelens.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigDecimal;

/**
 * One annual income statement row. Amounts are in crores.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinancialYear implements Serializable {

  private static final long serialVersionUID = 1L;

  private String year;

  @JsonProperty("rev")
  private BigDecimal revenue;

  @JsonProperty("pat")
  private BigDecimal profit;
}
