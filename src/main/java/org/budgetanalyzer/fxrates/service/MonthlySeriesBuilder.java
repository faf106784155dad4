package org.budgetanalyzer.fxrates.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import org.budgetanalyzer.fxrates.client.frankfurter.FrankfurterClient;
import org.budgetanalyzer.fxrates.client.frankfurter.response.TimeSeriesResponse;
import org.budgetanalyzer.fxrates.domain.CurrencyCode;
import org.budgetanalyzer.fxrates.domain.DecimalNormalizer;
import org.budgetanalyzer.fxrates.domain.NumericValue;
import org.budgetanalyzer.fxrates.domain.RateSeries;
import org.budgetanalyzer.fxrates.domain.SeriesPoint;
import org.budgetanalyzer.fxrates.exception.TypeConversionException;
import org.budgetanalyzer.fxrates.exception.UpstreamFormatException;

/**
 * Builds the dense 30 day rate series {@code [today-29, today]} for a currency pair.
 *
 * <p>Upstream only reports business days. Missing days are forward-filled with the last known
 * rate. When the window starts with missing days, the seed is the most recent rate upstream
 * returned before the window; if there is none, the current rate is fetched once and used for
 * every leading gap.
 */
@Service
public class MonthlySeriesBuilder {

  private static final Logger log = LoggerFactory.getLogger(MonthlySeriesBuilder.class);

  /** Number of calendar days in every series, today included. */
  public static final int WINDOW_DAYS = 30;

  private final FrankfurterClient frankfurterClient;
  private final RateService rateService;
  private final Clock clock;

  public MonthlySeriesBuilder(
      FrankfurterClient frankfurterClient, RateService rateService, Clock clock) {
    this.frankfurterClient = frankfurterClient;
    this.rateService = rateService;
    this.clock = clock;
  }

  /**
   * Returns exactly {@value #WINDOW_DAYS} daily rates ending today, oldest first.
   *
   * @param base base currency code
   * @param target target currency code
   * @return dense series with no missing day
   * @throws UpstreamFormatException if a reported rate is not a number
   */
  public RateSeries getMonthlySeries(String base, String target) {
    var baseCode = CurrencyCode.of(base);
    var targetCode = CurrencyCode.of(target);
    var endDate = LocalDate.now(clock);
    var startDate = endDate.minusDays(WINDOW_DAYS - 1L);

    if (baseCode.equals(targetCode)) {
      return constantSeries(baseCode, targetCode, startDate, BigDecimal.ONE);
    }

    var response = frankfurterClient.getTimeSeries(startDate, endDate, baseCode, targetCode);
    var ratesByDate = toSparseRates(response, targetCode, "/" + startDate + ".." + endDate);
    log.debug(
        "Frankfurter returned {} rates for {}->{} between {} and {}",
        ratesByDate.size(),
        baseCode,
        targetCode,
        startDate,
        endDate);

    return buildDenseSeries(baseCode, targetCode, ratesByDate, startDate, endDate);
  }

  private TreeMap<LocalDate, BigDecimal> toSparseRates(
      TimeSeriesResponse response, CurrencyCode target, String path) {
    var ratesByDate = new TreeMap<LocalDate, BigDecimal>();

    for (var entry : response.rates().entrySet()) {
      var day = entry.getValue();
      var node = day == null ? null : day.get(target.value());
      if (node == null || node.isNull()) {
        continue;
      }
      try {
        ratesByDate.put(
            entry.getKey(), DecimalNormalizer.toExactDecimal(NumericValue.fromJson(node)));
      } catch (TypeConversionException e) {
        throw new UpstreamFormatException(
            path, "Rate for " + target + " on " + entry.getKey() + " is not a number", e);
      }
    }

    return ratesByDate;
  }

  private RateSeries buildDenseSeries(
      CurrencyCode base,
      CurrencyCode target,
      TreeMap<LocalDate, BigDecimal> ratesByDate,
      LocalDate startDate,
      LocalDate endDate) {
    var points = new ArrayList<SeriesPoint>(WINDOW_DAYS);

    // Check if we have a rate before the window to carry into it
    var previous = ratesByDate.lowerEntry(startDate);
    BigDecimal lastKnown = previous != null ? previous.getValue() : null;

    for (var date = startDate; !date.isAfter(endDate); date = date.plusDays(1)) {
      var reported = ratesByDate.get(date);
      if (reported != null) {
        lastKnown = reported;
      } else if (lastKnown == null) {
        log.info(
            "No rate for {}->{} on or before {}, seeding with current rate", base, target, date);
        lastKnown = rateService.getCurrentRate(base, target);
      }

      points.add(new SeriesPoint(date, lastKnown));
    }

    return new RateSeries(base, target, points);
  }

  private static RateSeries constantSeries(
      CurrencyCode base, CurrencyCode target, LocalDate startDate, BigDecimal rate) {
    var points = new ArrayList<SeriesPoint>(WINDOW_DAYS);
    for (int i = 0; i < WINDOW_DAYS; i++) {
      points.add(new SeriesPoint(startDate.plusDays(i), rate));
    }
    return new RateSeries(base, target, points);
  }
}
