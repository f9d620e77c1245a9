package com.example.valuelens.provider;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * Lenient field readers for upstream JSON. Missing, null or non-numeric values read as zero or "".
 */
final class JsonValues {

  private JsonValues() {
  }

  static BigDecimal decimal(JsonNode node, String field) {
    return decimal(node.path(field));
  }

  static BigDecimal decimal(JsonNode value) {
    if (value.isNumber()) {
      return value.decimalValue();
    }
    if (value.isTextual()) {
      try {
        return new BigDecimal(value.asText().trim());
      } catch (NumberFormatException e) {
        return BigDecimal.ZERO;
      }
    }
    return BigDecimal.ZERO;
  }

  static String text(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (value.isMissingNode() || value.isNull()) {
      return "";
    }
    return value.asText("");
  }
}
