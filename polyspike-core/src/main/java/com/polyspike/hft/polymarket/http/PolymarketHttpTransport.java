package com.polyspike.hft.polymarket.http;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Rate-limited HTTP transport with bounded retries for reads.
 * <p>
 * Only requests flagged as safe to repeat are retried; an order submission that timed out is surfaced as
 * {@link PolymarketTransportException} so the caller can treat the outcome as unknown.
 */
@Slf4j
public final class PolymarketHttpTransport {

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final RequestRateLimiter rateLimiter;
  private final RetryPolicy retryPolicy;

  public PolymarketHttpTransport(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      RequestRateLimiter rateLimiter,
      RetryPolicy retryPolicy
  ) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
  }

  private static boolean isIdempotent(String method) {
    return "GET".equalsIgnoreCase(method) || "HEAD".equalsIgnoreCase(method);
  }

  public <T> T sendJson(HttpRequest request, Class<T> type) {
    return decode(request, sendString(request, isIdempotent(request.method())), type);
  }

  /**
   * For POST endpoints that only read (e.g. batched order books) and may be retried.
   */
  public <T> T sendJson(HttpRequest request, TypeReference<T> type, boolean idempotent) {
    String body = sendString(request, idempotent);
    try {
      return objectMapper.readValue(body, type);
    } catch (IOException e) {
      throw new PolymarketDecodeException(request.uri(), e);
    }
  }

  public String sendString(HttpRequest request, boolean idempotent) {
    int maxAttempts = idempotent ? retryPolicy.attempts() : 1;

    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      rateLimiter.acquire();
      try {
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
          return response.body();
        }

        if (attempt < maxAttempts && RetryPolicy.isRetryableStatus(status)) {
          long delayMillis = retryPolicy.jitteredDelayMillis(attempt, response.headers().firstValue("retry-after"));
          log.debug("HTTP {} from {} {} (attempt {}/{}), retrying in {}ms",
              status, request.method(), request.uri(), attempt, maxAttempts, delayMillis);
          sleep(delayMillis, request);
          continue;
        }

        throw new PolymarketHttpException(request.method(), request.uri(), status, response.body());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new PolymarketTransportException("HTTP request interrupted", request.uri(), e);
      } catch (IOException e) {
        if (attempt < maxAttempts) {
          long delayMillis = retryPolicy.jitteredDelayMillis(attempt, Optional.empty());
          log.debug("HTTP I/O failure on {} {} (attempt {}/{}): {}",
              request.method(), request.uri(), attempt, maxAttempts, e.toString());
          sleep(delayMillis, request);
          continue;
        }
        throw new PolymarketTransportException("HTTP request failed", request.uri(), e);
      }
    }

    throw new IllegalStateException("Unreachable");
  }

  private <T> T decode(HttpRequest request, String body, Class<T> type) {
    try {
      return objectMapper.readValue(body, type);
    } catch (IOException e) {
      throw new PolymarketDecodeException(request.uri(), e);
    }
  }

  private static void sleep(long delayMillis, HttpRequest request) {
    if (delayMillis <= 0) {
      return;
    }
    try {
      TimeUnit.MILLISECONDS.sleep(delayMillis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PolymarketTransportException("HTTP retry interrupted", request.uri(), e);
    }
  }
}
