package com.example.valuelens.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Which provider supplied each part of a merged record.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceInfo implements Serializable {

  private static final long serialVersionUID = 1L;

  public static final String NONE = "none";

  private String realtime;
  private String financials;

  @JsonProperty("years_available")
  private int yearsAvailable;
}
