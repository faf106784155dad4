package org.budgetanalyzer.fxrates.client.frankfurter.response;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Body of {@code GET /{start}..{end}?base=X&symbols=Y}.
 *
 * <p>Only business days appear in {@code rates}; weekends and holidays are simply missing. The
 * first key may also precede the requested start when the start falls on a non-business day.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TimeSeriesResponse(
    BigDecimal amount,
    String base,
    @JsonProperty("start_date") LocalDate startDate,
    @JsonProperty("end_date") LocalDate endDate,
    Map<LocalDate, Map<String, JsonNode>> rates) {

  public TimeSeriesResponse {
    rates = rates == null ? Map.of() : rates;
  }
}
