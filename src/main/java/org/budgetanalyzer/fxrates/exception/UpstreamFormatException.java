package org.budgetanalyzer.fxrates.exception;

/** Upstream answered 2xx but the body was not JSON, or not JSON of the expected shape. */
public class UpstreamFormatException extends FxRatesException {

  private final String url;

  public UpstreamFormatException(String url, String message) {
    super(message + " from " + url, FxRatesError.UPSTREAM_FORMAT_ERROR);
    this.url = url;
  }

  public UpstreamFormatException(String url, String message, Throwable cause) {
    super(message + " from " + url, FxRatesError.UPSTREAM_FORMAT_ERROR, cause);
    this.url = url;
  }

  public String getUrl() {
    return url;
  }
}
