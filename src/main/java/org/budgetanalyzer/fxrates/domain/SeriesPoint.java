package org.budgetanalyzer.fxrates.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/** One calendar day of a {@link RateSeries}. */
public record SeriesPoint(LocalDate date, BigDecimal rate) {

  public SeriesPoint {
    Objects.requireNonNull(date, "date");
    Objects.requireNonNull(rate, "rate");
  }
}
