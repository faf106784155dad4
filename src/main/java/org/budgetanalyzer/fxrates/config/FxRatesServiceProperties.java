package org.budgetanalyzer.fxrates.config;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "fx-rates-service")
@Validated
public class FxRatesServiceProperties {

  @Valid private Frankfurter frankfurter = new Frankfurter();
  @Valid private Retry retry = new Retry();

  public Frankfurter getFrankfurter() {
    return frankfurter;
  }

  public void setFrankfurter(Frankfurter frankfurter) {
    this.frankfurter = frankfurter;
  }

  public Retry getRetry() {
    return retry;
  }

  public void setRetry(Retry retry) {
    this.retry = retry;
  }

  public static class Frankfurter {
    /** Frankfurter API base URL. */
    @NotBlank(message = "Frankfurter base URL must be configured")
    private String baseUrl = "https://api.frankfurter.dev/v1";

    /** TCP connect timeout per attempt. */
    @Min(100)
    @Max(60_000)
    private int connectTimeoutMillis = 5000;

    /** Read timeout per attempt. */
    @Min(1)
    @Max(120)
    private int readTimeoutSeconds = 10;

    /** Upper bound of pooled connections shared by all calls. */
    @Min(1)
    @Max(500)
    private int maxConnections = 50;

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public int getConnectTimeoutMillis() {
      return connectTimeoutMillis;
    }

    public void setConnectTimeoutMillis(int connectTimeoutMillis) {
      this.connectTimeoutMillis = connectTimeoutMillis;
    }

    public int getReadTimeoutSeconds() {
      return readTimeoutSeconds;
    }

    public void setReadTimeoutSeconds(int readTimeoutSeconds) {
      this.readTimeoutSeconds = readTimeoutSeconds;
    }

    public int getMaxConnections() {
      return maxConnections;
    }

    public void setMaxConnections(int maxConnections) {
      this.maxConnections = maxConnections;
    }
  }

  public static class Retry {
    /**
     * Maximum number of attempts (including initial attempt). Example: max-attempts=3 means 1
     * initial + 2 retries.
     */
    @Min(1)
    @Max(10)
    private int maxAttempts = 3;

    /** Delay before the first retry; doubled for every following retry. */
    @Min(1)
    @Max(60_000)
    private long initialBackoffMillis = 300;

    /** HTTP status codes that are treated as transient. */
    @NotEmpty private List<Integer> retryableStatuses = List.of(429, 500, 502, 503, 504);

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public long getInitialBackoffMillis() {
      return initialBackoffMillis;
    }

    public void setInitialBackoffMillis(long initialBackoffMillis) {
      this.initialBackoffMillis = initialBackoffMillis;
    }

    public List<Integer> getRetryableStatuses() {
      return retryableStatuses;
    }

    public void setRetryableStatuses(List<Integer> retryableStatuses) {
      this.retryableStatuses = retryableStatuses;
    }
  }
}
