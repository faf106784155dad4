package org.budgetanalyzer.fxrates.exception;

/** Upstream was unreachable or too slow on every attempt. */
public class UpstreamConnectionException extends FxRatesException {

  private final String url;

  public UpstreamConnectionException(String url, Throwable cause) {
    super(
        "Failed to reach " + url + ": " + cause.getMessage(),
        FxRatesError.UPSTREAM_CONNECTION_ERROR,
        cause);
    this.url = url;
  }

  public String getUrl() {
    return url;
  }
}
