package org.budgetanalyzer.fxrates.domain;

import java.math.BigDecimal;
import java.math.BigInteger;

import com.fasterxml.jackson.databind.JsonNode;

import org.budgetanalyzer.fxrates.exception.TypeConversionException;

/**
 * The numeric representations accepted from upstream JSON or from callers.
 *
 * <p>Each variant has one fixed rule for becoming an exact {@link BigDecimal}; nothing passes
 * through a binary float on the way except {@link Floating}, which goes through its shortest
 * decimal text first.
 */
public sealed interface NumericValue
    permits NumericValue.Integral, NumericValue.Textual, NumericValue.Floating {

  BigDecimal toBigDecimal();

  /**
   * Classifies an arbitrary Java value.
   *
   * @param value integer types, {@link CharSequence}, {@code double} or {@code float}
   * @return the matching variant
   * @throws TypeConversionException for any other type, including null
   */
  static NumericValue of(Object value) {
    if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte) {
      return new Integral(BigInteger.valueOf(((Number) value).longValue()));
    }
    if (value instanceof BigInteger bigInteger) {
      return new Integral(bigInteger);
    }
    if (value instanceof CharSequence text) {
      return new Textual(text.toString());
    }
    if (value instanceof Double number) {
      return new Floating(number);
    }
    if (value instanceof Float number) {
      if (number.isNaN() || number.isInfinite()) {
        throw new TypeConversionException("Cannot convert " + number + " to Decimal");
      }
      // widen through the float's own shortest text, not its binary value
      return new Floating(Double.parseDouble(Float.toString(number)));
    }
    throw new TypeConversionException(
        "Cannot convert " + (value == null ? "null" : value.getClass().getName()) + " to Decimal");
  }

  /**
   * Classifies a JSON node as received from upstream.
   *
   * @param node number or string node
   * @return the matching variant
   * @throws TypeConversionException for booleans, nulls, objects and arrays
   */
  static NumericValue fromJson(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      throw new TypeConversionException("Cannot convert null to Decimal");
    }
    if (node.isIntegralNumber()) {
      return new Integral(node.bigIntegerValue());
    }
    if (node.isBigDecimal()) {
      return new Textual(node.decimalValue().toString());
    }
    if (node.isFloatingPointNumber()) {
      return new Floating(node.doubleValue());
    }
    if (node.isTextual()) {
      return new Textual(node.textValue());
    }
    throw new TypeConversionException("Cannot convert JSON " + node.getNodeType() + " to Decimal");
  }

  record Integral(BigInteger value) implements NumericValue {
    @Override
    public BigDecimal toBigDecimal() {
      return new BigDecimal(value);
    }
  }

  record Textual(String value) implements NumericValue {
    @Override
    public BigDecimal toBigDecimal() {
      try {
        return new BigDecimal(value.trim());
      } catch (NumberFormatException e) {
        throw new TypeConversionException("Cannot convert '" + value + "' to Decimal", e);
      }
    }
  }

  record Floating(double value) implements NumericValue {
    @Override
    public BigDecimal toBigDecimal() {
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        throw new TypeConversionException("Cannot convert " + value + " to Decimal");
      }
      // Double.toString always keeps one fractional digit; drop it in exponent form (1.0E-7)
      var text = Double.toString(value).replace(".0E", "E");
      return new BigDecimal(text);
    }
  }
}
