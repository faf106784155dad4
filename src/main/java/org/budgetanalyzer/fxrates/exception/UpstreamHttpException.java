package org.budgetanalyzer.fxrates.exception;

/** Upstream returned an error status and the retry budget is spent. */
public class UpstreamHttpException extends FxRatesException {

  /** Longest response body excerpt kept on the exception. */
  public static final int MAX_BODY_EXCERPT = 300;

  private final int statusCode;
  private final String url;
  private final String bodyExcerpt;

  public UpstreamHttpException(int statusCode, String url, String body) {
    this(statusCode, url, body, excerpt(body));
  }

  private UpstreamHttpException(int statusCode, String url, String body, String bodyExcerpt) {
    super(
        "HTTP " + statusCode + " Error for " + url + ": " + bodyExcerpt,
        FxRatesError.UPSTREAM_HTTP_ERROR);
    this.statusCode = statusCode;
    this.url = url;
    this.bodyExcerpt = bodyExcerpt;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getUrl() {
    return url;
  }

  public String getBodyExcerpt() {
    return bodyExcerpt;
  }

  /**
   * Truncates an upstream body so error messages and logs stay bounded.
   *
   * @param body raw response body, may be null
   * @return at most {@value #MAX_BODY_EXCERPT} characters of the body
   */
  public static String excerpt(String body) {
    if (body == null) {
      return "";
    }
    return body.length() > MAX_BODY_EXCERPT ? body.substring(0, MAX_BODY_EXCERPT) : body;
  }
}
