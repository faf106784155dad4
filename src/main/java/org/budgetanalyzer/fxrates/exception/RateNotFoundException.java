package org.budgetanalyzer.fxrates.exception;

import org.budgetanalyzer.fxrates.domain.CurrencyCode;

public class RateNotFoundException extends FxRatesException {

  private final CurrencyCode base;
  private final CurrencyCode target;

  public RateNotFoundException(CurrencyCode base, CurrencyCode target) {
    super("No rate found for " + base + "->" + target, FxRatesError.RATE_NOT_FOUND);
    this.base = base;
    this.target = target;
  }

  public CurrencyCode getBase() {
    return base;
  }

  public CurrencyCode getTarget() {
    return target;
  }
}
