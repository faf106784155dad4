package org.budgetanalyzer.fxrates.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import org.budgetanalyzer.fxrates.client.frankfurter.FrankfurterClient;
import org.budgetanalyzer.fxrates.domain.CurrencyCode;
import org.budgetanalyzer.fxrates.domain.DecimalNormalizer;
import org.budgetanalyzer.fxrates.domain.NumericValue;
import org.budgetanalyzer.fxrates.exception.RateNotFoundException;
import org.budgetanalyzer.fxrates.exception.TypeConversionException;
import org.budgetanalyzer.fxrates.exception.UpstreamFormatException;
import org.budgetanalyzer.fxrates.service.dto.ConversionResult;

/**
 * Spot rates, supported currencies and amount conversion backed by the Frankfurter API.
 *
 * <p>All operations are stateless; the only shared resource is the pooled {@link
 * FrankfurterClient}.
 */
@Service
public class RateService {

  private static final Logger log = LoggerFactory.getLogger(RateService.class);

  /** Scale of every conversion result. */
  public static final int RESULT_SCALE = 4;

  private final FrankfurterClient frankfurterClient;

  public RateService(FrankfurterClient frankfurterClient) {
    this.frankfurterClient = frankfurterClient;
  }

  /**
   * Returns the latest rate from {@code base} to {@code target}.
   *
   * <p>Codes are case-insensitive. Identical codes return exactly {@code 1} without a network
   * call.
   *
   * @param base base currency code
   * @param target target currency code
   * @return units of target per one unit of base
   * @throws RateNotFoundException if upstream does not report the target
   * @throws UpstreamFormatException if the reported rate is not a number
   */
  public BigDecimal getCurrentRate(String base, String target) {
    return getCurrentRate(CurrencyCode.of(base), CurrencyCode.of(target));
  }

  public BigDecimal getCurrentRate(CurrencyCode base, CurrencyCode target) {
    if (base.equals(target)) {
      return BigDecimal.ONE;
    }

    var response = frankfurterClient.getLatestRates(base, target);
    var rateNode = response.rateFor(target.value());
    if (rateNode == null) {
      throw new RateNotFoundException(base, target);
    }

    BigDecimal rate;
    try {
      rate = DecimalNormalizer.toExactDecimal(NumericValue.fromJson(rateNode));
    } catch (TypeConversionException e) {
      throw new UpstreamFormatException(
          "/latest", "Rate for " + base + "->" + target + " is not a number", e);
    }
    log.debug("Current rate {}->{} = {}", base, target, rate);
    return rate;
  }

  /**
   * Lists the currency codes upstream supports, sorted ascending and upper-cased.
   *
   * <p>Keys are parsed strictly: a key that is not 3 letters after upper-casing rejects the whole
   * response rather than being passed through or skipped.
   *
   * @return unmodifiable sorted set of codes
   * @throws UpstreamFormatException if the response is not a code-to-name object or a key is not a
   *     valid currency code
   */
  public SortedSet<CurrencyCode> getSupportedCurrencies() {
    var codes = new TreeSet<CurrencyCode>();
    for (var name : frankfurterClient.getCurrencies().keySet()) {
      try {
        codes.add(CurrencyCode.of(name));
      } catch (IllegalArgumentException e) {
        throw new UpstreamFormatException(
            "/currencies", "Invalid currency code '" + name + "' in response", e);
      }
    }

    log.debug("Frankfurter supports {} currencies", codes.size());
    return Collections.unmodifiableSortedSet(codes);
  }

  /**
   * Converts {@code amount} at the current rate.
   *
   * @param base base currency code
   * @param target target currency code
   * @param amount exact amount in base currency
   * @return conversion with the applied rate and the result at scale 4, half-even
   */
  public ConversionResult convert(String base, String target, BigDecimal amount) {
    if (amount == null) {
      throw new IllegalArgumentException("Amount must not be null");
    }

    var baseCode = CurrencyCode.of(base);
    var targetCode = CurrencyCode.of(target);
    var rate = getCurrentRate(baseCode, targetCode);
    var result =
        amount
            .multiply(rate, DecimalNormalizer.MATH_CONTEXT)
            .setScale(RESULT_SCALE, RoundingMode.HALF_EVEN);

    log.info("Converted {} {} to {} {} at rate {}", amount, baseCode, result, targetCode, rate);
    return new ConversionResult(baseCode, targetCode, amount, rate, result);
  }

  /**
   * Converts a non-decimal amount after normalizing it.
   *
   * @param base base currency code
   * @param target target currency code
   * @param amount integral, textual or floating amount
   * @return conversion result
   */
  public ConversionResult convert(String base, String target, NumericValue amount) {
    return convert(base, target, DecimalNormalizer.toExactDecimal(amount));
  }
}
