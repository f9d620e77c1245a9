package com.example.valuelens.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Annual statements from a financials provider, most recent year first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinancialSeries implements Serializable {

  private static final long serialVersionUID = 1L;

  @Builder.Default
  private List<FinancialYear> years = new ArrayList<>();

  private long sharesOutstanding;   // Raw share count, 0 when unknown

  public boolean isEmpty() {
    return years == null || years.isEmpty();
  }
}
