package org.budgetanalyzer.fxrates.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import org.budgetanalyzer.fxrates.client.frankfurter.FrankfurterClient;
import org.budgetanalyzer.fxrates.client.frankfurter.response.LatestRatesResponse;
import org.budgetanalyzer.fxrates.client.frankfurter.response.TimeSeriesResponse;
import org.budgetanalyzer.fxrates.domain.CurrencyCode;
import org.budgetanalyzer.fxrates.domain.RateSeries;
import org.budgetanalyzer.fxrates.domain.SeriesPoint;
import org.budgetanalyzer.fxrates.exception.TypeConversionException;
import org.budgetanalyzer.fxrates.exception.UpstreamFormatException;
import org.budgetanalyzer.fxrates.fixture.FrankfurterApiStubs;
import org.budgetanalyzer.fxrates.fixture.TestConstants;

/**
 * Unit tests for {@link MonthlySeriesBuilder}.
 *
 * <p>"Today" is {@link TestConstants#TODAY} (Friday 2024-03-15), so the window is Thursday
 * 2024-02-15 to 2024-03-15 and contains eight weekend days.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("MonthlySeriesBuilder Unit Tests")
class MonthlySeriesBuilderTest {

  private static final CurrencyCode USD = CurrencyCode.of(TestConstants.CURRENCY_USD);
  private static final CurrencyCode JPY = CurrencyCode.of(TestConstants.CURRENCY_JPY);

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  @Mock private FrankfurterClient frankfurterClient;

  private MonthlySeriesBuilder monthlySeriesBuilder;

  @BeforeEach
  void setUp() {
    var clock =
        Clock.fixed(
            TestConstants.TODAY.atTime(9, 30).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
    monthlySeriesBuilder =
        new MonthlySeriesBuilder(frankfurterClient, new RateService(frankfurterClient), clock);
  }

  @Test
  @DisplayName("getMonthlySeries - same currency - 30 ones without calling upstream")
  void getMonthlySeries_SameCurrency_ReturnsOnes() {
    var series = monthlySeriesBuilder.getMonthlySeries("usd", "USD");

    assertThat(series.size()).isEqualTo(MonthlySeriesBuilder.WINDOW_DAYS);
    assertThat(series.rates()).containsOnly(BigDecimal.ONE);
    assertWindowDates(series);
    verifyNoInteractions(frankfurterClient);
  }

  @Test
  @DisplayName("getMonthlySeries - rate for every day - adopts each value as is")
  void getMonthlySeries_DenseData_AdoptsEveryValue() {
    // Arrange
    var rates = new LinkedHashMap<LocalDate, BigDecimal>();
    for (int i = 0; i < 30; i++) {
      rates.put(TestConstants.WINDOW_START.plusDays(i), BigDecimal.valueOf(150 + i));
    }
    stubSeries(rates);

    // Act
    var series = monthlySeriesBuilder.getMonthlySeries("USD", "JPY");

    // Assert
    assertThat(series.size()).isEqualTo(30);
    assertWindowDates(series);
    for (int i = 0; i < 30; i++) {
      assertThat(series.rates().get(i)).isEqualByComparingTo(BigDecimal.valueOf(150 + i));
    }
    verify(frankfurterClient, never()).getLatestRates(USD, JPY);
  }

  @Test
  @DisplayName("getMonthlySeries - weekend gaps - carry the Friday rate forward")
  void getMonthlySeries_WeekendGaps_CarriesForward() {
    // Arrange
    var rates = FrankfurterApiStubs.weekdayRates(new BigDecimal("150.00"), new BigDecimal("0.10"));
    stubSeries(rates);

    // Act
    var series = monthlySeriesBuilder.getMonthlySeries("USD", "JPY");

    // Assert
    assertThat(series.size()).isEqualTo(30);
    assertWindowDates(series);
    assertThat(rateOn(series, LocalDate.of(2024, 2, 17)))
        .isEqualByComparingTo(rates.get(LocalDate.of(2024, 2, 16)));
    assertThat(rateOn(series, LocalDate.of(2024, 2, 18)))
        .isEqualByComparingTo(rates.get(LocalDate.of(2024, 2, 16)));
    assertThat(rateOn(series, LocalDate.of(2024, 3, 10)))
        .isEqualByComparingTo(rates.get(LocalDate.of(2024, 3, 8)));
    assertThat(series.rates().get(0)).isEqualByComparingTo("150.00");
    verify(frankfurterClient, never()).getLatestRates(USD, JPY);
  }

  @Test
  @DisplayName("getMonthlySeries - no upstream data - seeds with current rate exactly once")
  void getMonthlySeries_NoData_SeedsOnce() {
    // Arrange
    stubSeries(Map.of());
    when(frankfurterClient.getLatestRates(USD, JPY)).thenReturn(latest(NODES.numberNode(151.2)));

    // Act
    var series = monthlySeriesBuilder.getMonthlySeries("USD", "JPY");

    // Assert
    assertThat(series.size()).isEqualTo(30);
    assertWindowDates(series);
    assertThat(series.rates()).allSatisfy(rate -> assertThat(rate).isEqualByComparingTo("151.2"));
    verify(frankfurterClient, times(1)).getLatestRates(USD, JPY);
  }

  @Test
  @DisplayName("getMonthlySeries - leading gap with later data - seed covers only the gap")
  void getMonthlySeries_LeadingGap_SeedThenUpstreamValues() {
    // Arrange - first upstream value is on the third day of the window
    var rates = new LinkedHashMap<LocalDate, BigDecimal>();
    rates.put(TestConstants.WINDOW_START.plusDays(2), new BigDecimal("149.5"));
    stubSeries(rates);
    when(frankfurterClient.getLatestRates(USD, JPY)).thenReturn(latest(NODES.textNode("151.0")));

    // Act
    var series = monthlySeriesBuilder.getMonthlySeries("USD", "JPY");

    // Assert
    assertThat(series.rates().get(0)).isEqualByComparingTo("151.0");
    assertThat(series.rates().get(1)).isEqualByComparingTo("151.0");
    assertThat(series.rates().subList(2, 30))
        .allSatisfy(rate -> assertThat(rate).isEqualByComparingTo("149.5"));
    verify(frankfurterClient, times(1)).getLatestRates(USD, JPY);
  }

  @Test
  @DisplayName("getMonthlySeries - upstream reports a day before the window - used as seed")
  void getMonthlySeries_RateBeforeWindow_UsedAsSeed() {
    // Arrange
    var rates = new LinkedHashMap<LocalDate, BigDecimal>();
    rates.put(TestConstants.WINDOW_START.minusDays(3), new BigDecimal("148.0"));
    rates.put(TestConstants.WINDOW_START.minusDays(1), new BigDecimal("148.7"));
    rates.put(TestConstants.WINDOW_START.plusDays(5), new BigDecimal("149.9"));
    stubSeries(rates);

    // Act
    var series = monthlySeriesBuilder.getMonthlySeries("USD", "JPY");

    // Assert
    assertThat(series.size()).isEqualTo(30);
    assertThat(series.rates().get(0)).isEqualByComparingTo("148.7");
    assertThat(series.rates().get(4)).isEqualByComparingTo("148.7");
    assertThat(series.rates().get(5)).isEqualByComparingTo("149.9");
    assertThat(series.rates().get(29)).isEqualByComparingTo("149.9");
    verify(frankfurterClient, never()).getLatestRates(USD, JPY);
  }

  @Test
  @DisplayName("getMonthlySeries - null and foreign-symbol entries - treated as missing days")
  void getMonthlySeries_NullEntries_TreatedAsMissing() {
    // Arrange
    var rates = new LinkedHashMap<LocalDate, Map<String, JsonNode>>();
    rates.put(TestConstants.WINDOW_START, Map.of("JPY", NODES.numberNode(150.0)));
    var nullDay = new LinkedHashMap<String, JsonNode>();
    nullDay.put("JPY", NODES.nullNode());
    rates.put(TestConstants.WINDOW_START.plusDays(1), nullDay);
    rates.put(TestConstants.WINDOW_START.plusDays(2), Map.of("EUR", NODES.numberNode(0.92)));
    when(frankfurterClient.getTimeSeries(TestConstants.WINDOW_START, TestConstants.TODAY, USD, JPY))
        .thenReturn(
            new TimeSeriesResponse(
                BigDecimal.ONE, "USD", TestConstants.WINDOW_START, TestConstants.TODAY, rates));

    // Act
    var series = monthlySeriesBuilder.getMonthlySeries("USD", "JPY");

    // Assert
    assertThat(series.rates()).allSatisfy(rate -> assertThat(rate).isEqualByComparingTo("150"));
  }

  @Test
  @DisplayName("getMonthlySeries - rate is not a number - throws UpstreamFormatException")
  void getMonthlySeries_NonNumericRate_ThrowsUpstreamFormat() {
    // Arrange
    var rates = new LinkedHashMap<LocalDate, Map<String, JsonNode>>();
    rates.put(TestConstants.WINDOW_START, Map.of("JPY", NODES.numberNode(150.0)));
    rates.put(TestConstants.WINDOW_START.plusDays(1), Map.of("JPY", NODES.textNode("n/a")));
    when(frankfurterClient.getTimeSeries(TestConstants.WINDOW_START, TestConstants.TODAY, USD, JPY))
        .thenReturn(
            new TimeSeriesResponse(
                BigDecimal.ONE, "USD", TestConstants.WINDOW_START, TestConstants.TODAY, rates));

    // Act & Assert
    assertThatThrownBy(() -> monthlySeriesBuilder.getMonthlySeries("USD", "JPY"))
        .isInstanceOfSatisfying(
            UpstreamFormatException.class,
            ex -> {
              assertThat(ex.getUrl())
                  .isEqualTo("/" + TestConstants.WINDOW_START + ".." + TestConstants.TODAY);
              assertThat(ex.getMessage())
                  .contains(TestConstants.WINDOW_START.plusDays(1).toString());
              assertThat(ex).hasCauseInstanceOf(TypeConversionException.class);
            });
    verify(frankfurterClient, never()).getLatestRates(USD, JPY);
  }

  private void stubSeries(Map<LocalDate, BigDecimal> rates) {
    var body = new LinkedHashMap<LocalDate, Map<String, JsonNode>>();
    rates.forEach(
        (date, rate) -> body.put(date, Map.of("JPY", NODES.numberNode(rate))));
    when(frankfurterClient.getTimeSeries(TestConstants.WINDOW_START, TestConstants.TODAY, USD, JPY))
        .thenReturn(
            new TimeSeriesResponse(
                BigDecimal.ONE, "USD", TestConstants.WINDOW_START, TestConstants.TODAY, body));
  }

  private static LatestRatesResponse latest(JsonNode rate) {
    return new LatestRatesResponse(BigDecimal.ONE, "USD", TestConstants.TODAY, Map.of("JPY", rate));
  }

  private static void assertWindowDates(RateSeries series) {
    assertThat(series.points().get(0).date()).isEqualTo(TestConstants.WINDOW_START);
    assertThat(series.points().get(29).date()).isEqualTo(TestConstants.TODAY);
  }

  private static BigDecimal rateOn(RateSeries series, LocalDate date) {
    return series.points().stream()
        .filter(point -> point.date().equals(date))
        .map(SeriesPoint::rate)
        .findFirst()
        .orElseThrow();
  }
}
