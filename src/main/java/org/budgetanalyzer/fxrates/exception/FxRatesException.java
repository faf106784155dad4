package org.budgetanalyzer.fxrates.exception;

/**
 * Base class of every failure raised by the FX core.
 *
 * <p>Callers map {@link #getError()} to a transport-level response; the core itself never turns a
 * failure into a default value.
 */
public abstract class FxRatesException extends RuntimeException {

  private final FxRatesError error;

  protected FxRatesException(String message, FxRatesError error) {
    super(message);
    this.error = error;
  }

  protected FxRatesException(String message, FxRatesError error, Throwable cause) {
    super(message, cause);
    this.error = error;
  }

  public FxRatesError getError() {
    return error;
  }

  public String getCode() {
    return error.name();
  }
}
