package org.budgetanalyzer.fxrates.service.dto;

import java.math.BigDecimal;

import org.budgetanalyzer.fxrates.domain.CurrencyCode;

/**
 * Outcome of converting an amount between two currencies.
 *
 * <p>Carries the rate that was applied so callers can keep a conversion record without fetching
 * the rate a second time.
 *
 * @param base currency the amount is expressed in
 * @param target currency the amount was converted into
 * @param amount exact input amount
 * @param rate units of target per one unit of base
 * @param result {@code amount * rate} at scale 4, rounded half-even
 */
public record ConversionResult(
    CurrencyCode base, CurrencyCode target, BigDecimal amount, BigDecimal rate, BigDecimal result) {}
