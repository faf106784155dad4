package org.budgetanalyzer.fxrates.service;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.stereotype.Component;

import org.budgetanalyzer.fxrates.domain.DecimalNormalizer;
import org.budgetanalyzer.fxrates.domain.RateSeries;
import org.budgetanalyzer.fxrates.domain.Trend;

/**
 * Reduces a rate series to {@link Trend#UP}, {@link Trend#DOWN} or {@link Trend#FLAT}.
 *
 * <p>Only the first and last rates are compared; intermediate values do not matter. A relative
 * change below 0.1% either way is flat.
 */
@Component
public class TrendClassifier {

  private static final BigDecimal FLAT_THRESHOLD = new BigDecimal("0.1");
  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  public Trend classify(RateSeries series) {
    return classify(series.rates());
  }

  /**
   * Classifies a plain list of rates, oldest first.
   *
   * @param rates rates in chronological order
   * @return flat for fewer than two rates or a zero first rate
   */
  public Trend classify(List<BigDecimal> rates) {
    if (rates == null || rates.size() < 2) {
      return Trend.FLAT;
    }

    var first = rates.get(0);
    var last = rates.get(rates.size() - 1);
    if (first.signum() == 0) {
      return Trend.FLAT;
    }

    var percentChange =
        last.subtract(first)
            .divide(first, DecimalNormalizer.MATH_CONTEXT)
            .multiply(HUNDRED, DecimalNormalizer.MATH_CONTEXT);

    if (percentChange.abs().compareTo(FLAT_THRESHOLD) < 0) {
      return Trend.FLAT;
    }
    return percentChange.signum() > 0 ? Trend.UP : Trend.DOWN;
  }
}
