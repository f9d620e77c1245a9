package com.example.valuelens.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Represents a symbol search match.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResult implements Serializable {

  private static final long serialVersionUID = 1L;

  @JsonProperty("sym")
  private String symbol;          // Ticker symbol (e.g., "TCS")
  private String name;            // Company name
  @JsonProperty("sec")
  private String exchange;        // Exchange tag ("NSE") or sector
}
