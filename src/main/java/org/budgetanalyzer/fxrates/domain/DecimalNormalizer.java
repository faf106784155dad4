package org.budgetanalyzer.fxrates.domain;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/** Turns heterogeneous numeric input into exact decimals. */
public final class DecimalNormalizer {

  /** Arithmetic context for every chained rate operation: 28 significant digits, half-even. */
  public static final MathContext MATH_CONTEXT = new MathContext(28, RoundingMode.HALF_EVEN);

  private DecimalNormalizer() {
    throw new UnsupportedOperationException("Utility class - do not instantiate");
  }

  /**
   * Converts a value to an exact decimal.
   *
   * @param value a {@link BigDecimal}, a {@link NumericValue} or anything {@link
   *     NumericValue#of(Object)} accepts
   * @return exact decimal
   * @throws org.budgetanalyzer.fxrates.exception.TypeConversionException if the value type is
   *     not supported or its text is not a number
   */
  public static BigDecimal toExactDecimal(Object value) {
    if (value instanceof BigDecimal decimal) {
      return decimal;
    }
    if (value instanceof NumericValue numeric) {
      return numeric.toBigDecimal();
    }
    return NumericValue.of(value).toBigDecimal();
  }
}
