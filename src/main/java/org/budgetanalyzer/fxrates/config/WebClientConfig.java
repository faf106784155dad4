package org.budgetanalyzer.fxrates.config;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

@Configuration
public class WebClientConfig {

  /** Largest response body buffered in memory. */
  public static final int MAX_IN_MEMORY_BYTES = 1024 * 1024;

  /**
   * Connection pool shared by every upstream call. Disposed with the application context.
   *
   * @param properties service properties
   * @return pooled connection provider
   */
  @Bean(destroyMethod = "dispose")
  public ConnectionProvider frankfurterConnectionProvider(FxRatesServiceProperties properties) {
    return ConnectionProvider.builder("frankfurter")
        .maxConnections(properties.getFrankfurter().getMaxConnections())
        .maxIdleTime(Duration.ofSeconds(30))
        .evictInBackground(Duration.ofSeconds(60))
        .build();
  }

  @Bean
  public WebClient.Builder webClientBuilder(
      ConnectionProvider frankfurterConnectionProvider, FxRatesServiceProperties properties) {
    var frankfurter = properties.getFrankfurter();
    int readTimeoutSeconds = frankfurter.getReadTimeoutSeconds();

    // Configure timeouts
    var httpClient =
        HttpClient.create(frankfurterConnectionProvider)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, frankfurter.getConnectTimeoutMillis())
            .responseTimeout(Duration.ofSeconds(readTimeoutSeconds))
            .doOnConnected(
                conn ->
                    conn.addHandlerLast(
                            new ReadTimeoutHandler(readTimeoutSeconds, TimeUnit.SECONDS))
                        .addHandlerLast(
                            new WriteTimeoutHandler(readTimeoutSeconds, TimeUnit.SECONDS)));

    // Rate payloads are small; 1MB is plenty for a 30 day window
    var strategies =
        ExchangeStrategies.builder()
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
            .build();

    return WebClient.builder()
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .exchangeStrategies(strategies);
  }
}
