package org.budgetanalyzer.fxrates.client.frankfurter;

import java.net.URI;
import java.time.Duration;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriComponentsBuilder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.netty.handler.timeout.TimeoutException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import org.budgetanalyzer.fxrates.client.frankfurter.response.LatestRatesResponse;
import org.budgetanalyzer.fxrates.client.frankfurter.response.TimeSeriesResponse;
import org.budgetanalyzer.fxrates.config.FxRatesServiceProperties;
import org.budgetanalyzer.fxrates.config.WebClientConfig;
import org.budgetanalyzer.fxrates.domain.CurrencyCode;
import org.budgetanalyzer.fxrates.exception.FxRatesException;
import org.budgetanalyzer.fxrates.exception.UpstreamConnectionException;
import org.budgetanalyzer.fxrates.exception.UpstreamFormatException;
import org.budgetanalyzer.fxrates.exception.UpstreamHttpException;

/**
 * HTTP client for the Frankfurter FX API.
 *
 * <p>One instance wraps one {@link WebClient} over a pooled Reactor Netty connection provider and
 * is safe to share between concurrent requests. GET calls are retried with exponential backoff on
 * transient failures: the configured retryable status codes and connection-level errors
 * (connection refused or reset, connect and read timeouts). Other statuses fail on the first
 * attempt.
 */
@Component
public class FrankfurterClient {

  private static final Logger log = LoggerFactory.getLogger(FrankfurterClient.class);

  private static final String USER_AGENT = "FxRatesServiceClient/1.0";

  /** In-memory codec limit configured in {@link WebClientConfig}. */
  private static final int MAX_BODY_BYTES = WebClientConfig.MAX_IN_MEMORY_BYTES;

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final String baseUrl;
  private final int maxAttempts;
  private final Duration initialBackoff;
  private final Set<Integer> retryableStatuses;

  public FrankfurterClient(
      WebClient.Builder webClientBuilder,
      FxRatesServiceProperties properties,
      ObjectMapper objectMapper) {
    var frankfurterConfig = properties.getFrankfurter();
    var retryConfig = properties.getRetry();

    // properties have @Validated but double checking
    if (frankfurterConfig.getBaseUrl() == null || frankfurterConfig.getBaseUrl().isBlank()) {
      throw new IllegalArgumentException("Frankfurter base URL must be configured");
    }

    this.baseUrl = frankfurterConfig.getBaseUrl();
    this.webClient = webClientBuilder.defaultHeader("User-Agent", USER_AGENT).build();
    this.objectMapper = objectMapper;
    this.maxAttempts = retryConfig.getMaxAttempts();
    this.initialBackoff = Duration.ofMillis(retryConfig.getInitialBackoffMillis());
    this.retryableStatuses = Set.copyOf(retryConfig.getRetryableStatuses());

    log.info(
        "FrankfurterClient initialized with base URL: {} maxAttempts: {} initialBackoff: {}",
        baseUrl,
        maxAttempts,
        initialBackoff);
  }

  /**
   * Fetches {@code /currencies}: an object mapping currency code to display name.
   *
   * @return code to display-name node, in upstream order
   * @throws UpstreamFormatException if the body is not a JSON object
   */
  public Map<String, JsonNode> getCurrencies() {
    var path = "/currencies";
    var body = fetchJson(path, Map.of());
    requireObject(body, buildUri(path, Map.of()));

    var currencies = new LinkedHashMap<String, JsonNode>();
    body.fields().forEachRemaining(entry -> currencies.put(entry.getKey(), entry.getValue()));
    return currencies;
  }

  /**
   * Fetches the latest rate of {@code symbol} against {@code base}.
   *
   * @param base base currency
   * @param symbol target currency
   * @return decoded body
   */
  public LatestRatesResponse getLatestRates(CurrencyCode base, CurrencyCode symbol) {
    var path = "/latest";
    var params = pairParams(base, symbol);
    return decode(fetchJson(path, params), LatestRatesResponse.class, buildUri(path, params));
  }

  /**
   * Fetches daily rates for the inclusive range {@code [startDate, endDate]}.
   *
   * @param startDate first day of the range
   * @param endDate last day of the range
   * @param base base currency
   * @param symbol target currency
   * @return decoded body with one entry per business day
   */
  public TimeSeriesResponse getTimeSeries(
      LocalDate startDate, LocalDate endDate, CurrencyCode base, CurrencyCode symbol) {
    var path = "/" + startDate + ".." + endDate;
    var params = pairParams(base, symbol);
    return decode(fetchJson(path, params), TimeSeriesResponse.class, buildUri(path, params));
  }

  /**
   * Blocking GET returning the decoded JSON body.
   *
   * <p>Interrupting the calling thread cancels the in-flight exchange and surfaces as {@link
   * CancellationException} with the interrupt flag restored.
   *
   * @param path path relative to the configured base URL
   * @param queryParams query parameters, in order
   * @return parsed JSON body
   * @throws UpstreamHttpException on a 4xx/5xx status after retries
   * @throws UpstreamConnectionException when every attempt failed at the connection level
   * @throws UpstreamFormatException when a 2xx body is not JSON
   */
  public JsonNode fetchJson(String path, Map<String, String> queryParams) {
    var uri = buildUri(path, queryParams);

    try {
      var body = fetchJsonAsync(uri).block();

      if (body == null) {
        throw new UpstreamFormatException(uri.toString(), "Received empty response");
      }
      return body;
    } catch (FxRatesException e) {
      throw e;
    } catch (RuntimeException e) {
      if (Exceptions.unwrap(e) instanceof InterruptedException) {
        Thread.currentThread().interrupt();
        var cancellation = new CancellationException("Interrupted while waiting for " + uri);
        cancellation.initCause(e);
        throw cancellation;
      }
      log.warn("Unexpected error fetching {}: {}", uri, e.getMessage(), e);
      throw new UpstreamConnectionException(uri.toString(), e);
    }
  }

  /**
   * Non-blocking GET. Disposing the subscription cancels the HTTP exchange, so callers can apply
   * their own deadline with {@link Mono#timeout(Duration)}.
   *
   * @param path path relative to the configured base URL
   * @param queryParams query parameters, in order
   * @return mono emitting the parsed JSON body or one of the upstream exceptions
   */
  public Mono<JsonNode> fetchJsonAsync(String path, Map<String, String> queryParams) {
    return fetchJsonAsync(buildUri(path, queryParams));
  }

  private Mono<JsonNode> fetchJsonAsync(URI uri) {
    var url = uri.toString();

    return Mono.defer(
            () -> {
              log.debug("Requesting Frankfurter: {}", url);
              return webClient
                  .get()
                  .uri(uri)
                  .accept(MediaType.APPLICATION_JSON)
                  .exchangeToMono(response -> readBody(response, url));
            })
        .retryWhen(retrySpec(url))
        .onErrorMap(WebClientRequestException.class, e -> connectionFailure(url, e))
        .onErrorMap(FrankfurterClient::isTimeout, e -> connectionFailure(url, e));
  }

  private Mono<JsonNode> readBody(ClientResponse response, String url) {
    int status = response.statusCode().value();

    return response
        .bodyToMono(String.class)
        .defaultIfEmpty("")
        .onErrorMap(DataBufferLimitException.class, e -> oversizedBody(status, url, e))
        .map(
            body -> {
              if (status >= 400) {
                throw httpFailure(status, url, body);
              }
              return parseJson(body, url);
            });
  }

  private UpstreamHttpException httpFailure(int status, String url, String body) {
    var exception = new UpstreamHttpException(status, url, body);
    log.warn(
        "Frankfurter API error: HTTP {} for {} - Body: {}",
        status,
        url,
        exception.getBodyExcerpt());
    return exception;
  }

  // the body is never buffered past the codec limit, so keep the status and drop the body
  private FxRatesException oversizedBody(int status, String url, DataBufferLimitException e) {
    if (status >= 400) {
      return httpFailure(status, url, "[body exceeded " + MAX_BODY_BYTES + " bytes]");
    }
    log.warn("Frankfurter response from {} exceeded {} bytes", url, MAX_BODY_BYTES);
    return new UpstreamFormatException(url, "Response body too large", e);
  }

  private JsonNode parseJson(String body, String url) {
    if (body.isBlank()) {
      log.warn("Frankfurter returned an empty body for {}", url);
      throw new UpstreamFormatException(url, "Invalid JSON returned");
    }

    try {
      return objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      log.warn(
          "Could not parse Frankfurter response from {} as JSON: {} - Body: {}",
          url,
          e.getOriginalMessage(),
          UpstreamHttpException.excerpt(body));
      throw new UpstreamFormatException(url, "Invalid JSON returned", e);
    }
  }

  private RetryBackoffSpec retrySpec(String url) {
    return Retry.backoff(maxAttempts - 1L, initialBackoff)
        .jitter(0d)
        .filter(this::isTransient)
        .doBeforeRetry(
            signal ->
                log.warn(
                    "Transient failure calling {} (attempt {}/{}), retrying: {}",
                    url,
                    signal.totalRetries() + 1,
                    maxAttempts,
                    signal.failure().getMessage()))
        .onRetryExhaustedThrow((spec, signal) -> signal.failure());
  }

  private boolean isTransient(Throwable failure) {
    if (failure instanceof UpstreamHttpException httpFailure) {
      return retryableStatuses.contains(httpFailure.getStatusCode());
    }
    return failure instanceof WebClientRequestException || isTimeout(failure);
  }

  // read timeouts raised while streaming the body are not wrapped by WebClient
  private static boolean isTimeout(Throwable failure) {
    for (var current = failure; current != null; current = current.getCause()) {
      if (current instanceof TimeoutException) {
        return !(failure instanceof FxRatesException);
      }
    }
    return false;
  }

  private UpstreamConnectionException connectionFailure(String url, Throwable cause) {
    log.warn(
        "Frankfurter API unreachable at {} after {} attempts: {}",
        url,
        maxAttempts,
        cause.getMessage());
    return new UpstreamConnectionException(url, cause);
  }

  private void requireObject(JsonNode body, URI uri) {
    if (!body.isObject()) {
      log.warn("Expected a JSON object from {} but got {}", uri, body.getNodeType());
      throw new UpstreamFormatException(
          uri.toString(), "Invalid response format: expected a JSON object");
    }
  }

  private <T> T decode(JsonNode body, Class<T> type, URI uri) {
    requireObject(body, uri);

    try {
      return objectMapper.treeToValue(body, type);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      log.warn("Unexpected Frankfurter response shape from {}: {}", uri, e.getMessage());
      throw new UpstreamFormatException(uri.toString(), "Unexpected response shape", e);
    }
  }

  private URI buildUri(String path, Map<String, String> queryParams) {
    var builder = UriComponentsBuilder.fromUriString(baseUrl).path(path);
    queryParams.forEach(builder::queryParam);
    return builder.encode().build().toUri();
  }

  private static Map<String, String> pairParams(CurrencyCode base, CurrencyCode symbol) {
    var params = new LinkedHashMap<String, String>();
    params.put("base", base.value());
    params.put("symbols", symbol.value());
    return params;
  }
}
