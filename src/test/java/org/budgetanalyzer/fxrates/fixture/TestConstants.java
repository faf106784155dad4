package org.budgetanalyzer.fxrates.fixture;

import java.math.BigDecimal;
import java.time.LocalDate;

/** Test constants shared by unit and integration tests. */
public final class TestConstants {

  // ===========================================================================================
  // Currency Codes
  // ===========================================================================================

  public static final String CURRENCY_EUR = "EUR";
  public static final String CURRENCY_USD = "USD";
  public static final String CURRENCY_GBP = "GBP";
  public static final String CURRENCY_JPY = "JPY";
  public static final String CURRENCY_AUD = "AUD";

  // ===========================================================================================
  // Dates
  // ===========================================================================================

  /** Fixed "today" used by the test clock: a Friday in a leap year. */
  public static final LocalDate TODAY = LocalDate.of(2024, 3, 15);

  /** First day of the 30 day window ending on {@link #TODAY} (a Thursday). */
  public static final LocalDate WINDOW_START = TODAY.minusDays(29);

  // ===========================================================================================
  // Frankfurter API
  // ===========================================================================================

  public static final String FRANKFURTER_PATH_LATEST = "/latest";
  public static final String FRANKFURTER_PATH_CURRENCIES = "/currencies";
  public static final String FRANKFURTER_PATH_WINDOW = "/" + WINDOW_START + ".." + TODAY;

  public static final String PARAM_BASE = "base";
  public static final String PARAM_SYMBOLS = "symbols";

  // ===========================================================================================
  // Rates
  // ===========================================================================================

  /** Sample EUR to USD rate. */
  public static final BigDecimal RATE_EUR_USD = new BigDecimal("1.0845");

  private TestConstants() {
    throw new UnsupportedOperationException("Utility class - do not instantiate");
  }
}
