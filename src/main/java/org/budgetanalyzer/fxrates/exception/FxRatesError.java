package org.budgetanalyzer.fxrates.exception;

/** Error codes carried by every {@link FxRatesException}. */
public enum FxRatesError {
  /** Upstream answered with HTTP 4xx/5xx after retries were exhausted. */
  UPSTREAM_HTTP_ERROR,

  /** Upstream could not be reached, or timed out, after retries were exhausted. */
  UPSTREAM_CONNECTION_ERROR,

  /** Upstream body was not valid JSON or did not have the expected shape. */
  UPSTREAM_FORMAT_ERROR,

  /** Well-formed upstream response did not contain the requested rate. */
  RATE_NOT_FOUND,

  /** Numeric input could not be turned into an exact decimal. */
  TYPE_CONVERSION_ERROR,
}
