package com.polyspike.hft.events;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "hft.events")
public record HftEventsProperties(
    @NotNull Boolean enabled,
    String topic
) {
  public HftEventsProperties {
    if (enabled == null) {
      enabled = false;
    }
    if (topic == null || topic.isBlank()) {
      topic = "polyspike.events";
    }
  }
}
