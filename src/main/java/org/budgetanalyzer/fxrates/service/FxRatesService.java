package org.budgetanalyzer.fxrates.service;

import java.math.BigDecimal;
import java.util.SortedSet;

import org.springframework.stereotype.Service;

import org.budgetanalyzer.fxrates.domain.CurrencyCode;
import org.budgetanalyzer.fxrates.domain.DecimalNormalizer;
import org.budgetanalyzer.fxrates.domain.RateSeries;
import org.budgetanalyzer.fxrates.domain.Trend;
import org.budgetanalyzer.fxrates.service.dto.ConversionResult;
import org.budgetanalyzer.fxrates.service.dto.TrendAnalysis;

/**
 * Entry point used by the surrounding application (sessions, conversion history, HTTP routing).
 *
 * <p>Every operation either returns a value or throws a subclass of {@link
 * org.budgetanalyzer.fxrates.exception.FxRatesException}; none of them fall back to defaults.
 * Currency codes are resolved by the caller and may be in any case.
 */
@Service
public class FxRatesService {

  private final RateService rateService;
  private final MonthlySeriesBuilder monthlySeriesBuilder;
  private final TrendClassifier trendClassifier;

  public FxRatesService(
      RateService rateService,
      MonthlySeriesBuilder monthlySeriesBuilder,
      TrendClassifier trendClassifier) {
    this.rateService = rateService;
    this.monthlySeriesBuilder = monthlySeriesBuilder;
    this.trendClassifier = trendClassifier;
  }

  public BigDecimal currentRate(String base, String target) {
    return rateService.getCurrentRate(base, target);
  }

  /**
   * Converts an amount given as {@link BigDecimal}, integer, decimal string or floating number.
   *
   * @param base base currency code
   * @param target target currency code
   * @param amount amount in base currency
   * @return conversion result at scale 4
   * @throws org.budgetanalyzer.fxrates.exception.TypeConversionException if {@code amount} is not
   *     one of the accepted representations
   */
  public ConversionResult convert(String base, String target, Object amount) {
    return rateService.convert(base, target, DecimalNormalizer.toExactDecimal(amount));
  }

  public SortedSet<CurrencyCode> supportedCurrencies() {
    return rateService.getSupportedCurrencies();
  }

  public RateSeries monthlySeries(String base, String target) {
    return monthlySeriesBuilder.getMonthlySeries(base, target);
  }

  public Trend trend(RateSeries series) {
    return trendClassifier.classify(series);
  }

  /**
   * Builds the monthly series for a pair and classifies it.
   *
   * @param base base currency code
   * @param target target currency code
   * @return trend and the series behind it
   */
  public TrendAnalysis analyzeTrend(String base, String target) {
    var series = monthlySeriesBuilder.getMonthlySeries(base, target);
    return new TrendAnalysis(trendClassifier.classify(series), series);
  }
}
