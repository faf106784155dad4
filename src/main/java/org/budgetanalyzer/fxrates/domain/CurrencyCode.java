package org.budgetanalyzer.fxrates.domain;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Three-letter currency identifier, always stored upper-case.
 *
 * <p>Use {@link #of(String)} at the boundary: it trims and upper-cases, so {@code "usd"} and
 * {@code "USD"} produce equal codes.
 */
public record CurrencyCode(String value) implements Comparable<CurrencyCode> {

  private static final Pattern CODE_PATTERN = Pattern.compile("[A-Z]{3}");

  public CurrencyCode {
    if (value == null || !CODE_PATTERN.matcher(value).matches()) {
      throw new IllegalArgumentException("Currency code must be 3 upper-case letters: " + value);
    }
  }

  /**
   * Parses a caller-supplied code.
   *
   * @param code raw code in any case, surrounding whitespace allowed
   * @return canonical code
   * @throws IllegalArgumentException if the code is not 3 letters
   */
  public static CurrencyCode of(String code) {
    if (code == null) {
      throw new IllegalArgumentException("Currency code must not be null");
    }
    return new CurrencyCode(code.trim().toUpperCase(Locale.ROOT));
  }

  @Override
  public int compareTo(CurrencyCode other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return value;
  }
}
