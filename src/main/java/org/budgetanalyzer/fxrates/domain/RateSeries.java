package org.budgetanalyzer.fxrates.domain;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Daily rates for a currency pair, oldest first, one point per calendar day.
 *
 * <p>Points are immutable and never null. Ordering is enforced: each date must be exactly one day
 * after the previous one.
 */
public record RateSeries(CurrencyCode base, CurrencyCode target, List<SeriesPoint> points) {

  public RateSeries {
    Objects.requireNonNull(base, "base");
    Objects.requireNonNull(target, "target");
    points = List.copyOf(points);
    for (int i = 1; i < points.size(); i++) {
      var expected = points.get(i - 1).date().plusDays(1);
      if (!points.get(i).date().equals(expected)) {
        throw new IllegalArgumentException(
            "Series dates must be consecutive, expected " + expected + " at index " + i);
      }
    }
  }

  public List<BigDecimal> rates() {
    return points.stream().map(SeriesPoint::rate).toList();
  }

  public int size() {
    return points.size();
  }
}
