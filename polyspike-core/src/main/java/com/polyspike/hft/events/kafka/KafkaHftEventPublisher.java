package com.polyspike.hft.events.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polyspike.hft.events.HftEventPublisher;
import com.polyspike.hft.events.HftEventsProperties;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishes engine events as JSON envelopes {@code {ts, source, type, data}} keyed by instrument.
 * Failures are counted and logged with sampling; they never reach the trading path.
 */
@Slf4j
public final class KafkaHftEventPublisher implements HftEventPublisher {

  private final HftEventsProperties properties;
  private final KafkaTemplate<String, String> kafkaTemplate;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final String source;

  private final AtomicLong failures = new AtomicLong(0);

  public KafkaHftEventPublisher(
      @NonNull HftEventsProperties properties,
      @NonNull KafkaTemplate<String, String> kafkaTemplate,
      @NonNull ObjectMapper objectMapper,
      @NonNull Clock clock,
      @NonNull String source
  ) {
    this.properties = properties;
    this.kafkaTemplate = kafkaTemplate;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.source = source.isBlank() ? "polyspike" : source.trim().toLowerCase(Locale.ROOT);
  }

  @Override
  public boolean isEnabled() {
    return Boolean.TRUE.equals(properties.enabled());
  }

  @Override
  public void publish(Instant ts, String type, String key, Object data) {
    if (!isEnabled() || type == null || type.isBlank()) {
      return;
    }

    Map<String, Object> envelope = new LinkedHashMap<>();
    envelope.put("ts", ts != null ? ts : Instant.now(clock));
    envelope.put("source", source);
    envelope.put("type", type.trim());
    envelope.put("data", data == null ? Map.of() : data);

    String json;
    try {
      json = objectMapper.writeValueAsString(envelope);
    } catch (JsonProcessingException e) {
      recordFailure("serialize", e);
      return;
    }

    String topic = properties.topic();
    CompletableFuture<SendResult<String, String>> future = (key == null || key.isBlank())
        ? kafkaTemplate.send(topic, json)
        : kafkaTemplate.send(topic, key, json);
    future.exceptionally(ex -> {
      recordFailure("send", ex);
      return null;
    });
  }

  long failureCount() {
    return failures.get();
  }

  private void recordFailure(String stage, Throwable t) {
    long n = failures.incrementAndGet();
    if (n == 1 || n % 1000 == 0) {
      log.warn("Kafka event publish failed stage={} failures={} error={}", stage, n, t.toString());
    }
  }
}
