package org.budgetanalyzer.fxrates.exception;

public class TypeConversionException extends FxRatesException {

  public TypeConversionException(String message) {
    super(message, FxRatesError.TYPE_CONVERSION_ERROR);
  }

  public TypeConversionException(String message, Throwable cause) {
    super(message, FxRatesError.TYPE_CONVERSION_ERROR, cause);
  }
}
