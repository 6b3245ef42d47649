package com.polyspike.hft.polymarket.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polyspike.hft.config.HftProperties;
import com.polyspike.hft.polymarket.clob.PolymarketClobClient;
import com.polyspike.hft.polymarket.data.PolymarketDataApiClient;
import com.polyspike.hft.polymarket.gamma.PolymarketGammaClient;
import com.polyspike.hft.polymarket.http.PolymarketHttpTransport;
import com.polyspike.hft.polymarket.http.RequestRateLimiter;
import com.polyspike.hft.polymarket.http.RetryPolicy;
import com.polyspike.hft.polymarket.http.TokenBucketRateLimiter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Configuration(proxyBeanMethods = false)
public class PolymarketConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public HttpClient httpClient() {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(5))
        .version(HttpClient.Version.HTTP_1_1)
        .build();
  }

  @Bean
  public PolymarketHttpTransport polymarketHttpTransport(
      HftProperties properties,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      Clock clock
  ) {
    HftProperties.Rest rest = properties.polymarket().rest();
    RequestRateLimiter rateLimiter = buildRateLimiter(rest.rateLimit(), clock);
    RetryPolicy retry = buildRetryPolicy(rest.retry());
    return new PolymarketHttpTransport(httpClient, objectMapper, rateLimiter, retry);
  }

  @Bean
  public PolymarketClobClient polymarketClobClient(
      HftProperties properties,
      PolymarketHttpTransport transport,
      ObjectMapper objectMapper
  ) {
    return new PolymarketClobClient(URI.create(properties.polymarket().clobRestUrl()), transport, objectMapper);
  }

  @Bean
  public PolymarketGammaClient polymarketGammaClient(HftProperties properties, PolymarketHttpTransport transport) {
    return new PolymarketGammaClient(URI.create(properties.polymarket().gammaUrl()), transport);
  }

  @Bean
  public PolymarketDataApiClient polymarketDataApiClient(
      HftProperties properties,
      PolymarketHttpTransport transport,
      ObjectMapper objectMapper
  ) {
    return new PolymarketDataApiClient(URI.create(properties.polymarket().dataApiUrl()), transport, objectMapper);
  }

  static RequestRateLimiter buildRateLimiter(HftProperties.RateLimit cfg, Clock clock) {
    if (cfg == null || !cfg.enabled()) {
      return RequestRateLimiter.noop();
    }
    if (cfg.requestsPerSecond() <= 0 || cfg.burst() <= 0) {
      return RequestRateLimiter.noop();
    }
    return new TokenBucketRateLimiter(cfg.requestsPerSecond(), cfg.burst(), clock);
  }

  static RetryPolicy buildRetryPolicy(HftProperties.Retry cfg) {
    if (cfg == null) {
      return RetryPolicy.disabled();
    }
    long initial = Math.max(0, cfg.initialBackoffMillis());
    return new RetryPolicy(
        cfg.enabled(),
        Math.max(1, cfg.maxAttempts()),
        initial,
        Math.max(0, cfg.maxBackoffMillis()),
        initial / 2
    );
  }
}
