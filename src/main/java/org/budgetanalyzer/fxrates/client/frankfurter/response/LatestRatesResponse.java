package org.budgetanalyzer.fxrates.client.frankfurter.response;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Body of {@code GET /latest?base=X&symbols=Y}.
 *
 * <p>Rate values stay raw JSON nodes so they can be normalized without a detour through double.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LatestRatesResponse(
    BigDecimal amount, String base, LocalDate date, Map<String, JsonNode> rates) {

  public LatestRatesResponse {
    rates = rates == null ? Map.of() : rates;
  }

  /** Returns the raw rate node for a symbol, or null when absent or JSON null. */
  public JsonNode rateFor(String symbol) {
    var node = rates.get(symbol);
    return node == null || node.isNull() ? null : node;
  }
}
